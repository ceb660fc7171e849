package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.aggregator.ItemAggregator;
import br.com.analytics.pipeline.order_analytics_batch.aggregator.PaymentAggregator;
import br.com.analytics.pipeline.order_analytics_batch.aggregator.ReviewAggregator;

import java.util.concurrent.Executor;

public final class OrderAnalyticsPipelines {

    private OrderAnalyticsPipelines() {}

    public static OrderAnalyticsPipeline create(Executor executor) {
        return new OrderAnalyticsPipeline(
                new PaymentAggregator(),
                new ItemAggregator(),
                new ReviewAggregator(),
                new OrderComposer(),
                new QualificationFilter(),
                new RegionClassifier(),
                new DeliveryKpiCalculator(),
                new NullNormalizer(),
                executor);
    }
}
