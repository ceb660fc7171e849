package br.com.analytics.pipeline.order_analytics_batch.processor;

import br.com.analytics.pipeline.order_analytics_batch.model.OrderAnalyticsRecord;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderCustomerRow;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.AggregateStore;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.OrderAnalyticsPipeline;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.infrastructure.item.ItemProcessor;

public class OrderAnalyticsProcessor implements ItemProcessor<OrderCustomerRow, OrderAnalyticsRecord> {

    private final OrderAnalyticsPipeline pipeline;
    private final AggregateStore aggregateStore;

    public OrderAnalyticsProcessor(OrderAnalyticsPipeline pipeline, AggregateStore aggregateStore) {
        this.pipeline = pipeline;
        this.aggregateStore = aggregateStore;
    }

    @Override
    public @Nullable OrderAnalyticsRecord process(OrderCustomerRow row) throws Exception {
        return pipeline.process(row, aggregateStore.current());
    }
}
