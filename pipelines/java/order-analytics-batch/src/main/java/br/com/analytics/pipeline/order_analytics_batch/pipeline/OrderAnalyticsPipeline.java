package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.aggregator.Accumulation;
import br.com.analytics.pipeline.order_analytics_batch.aggregator.EntityAggregator;
import br.com.analytics.pipeline.order_analytics_batch.aggregator.RowSource;
import br.com.analytics.pipeline.order_analytics_batch.model.AggregateSnapshot;
import br.com.analytics.pipeline.order_analytics_batch.model.ComposedOrder;
import br.com.analytics.pipeline.order_analytics_batch.model.DeliveryKpis;
import br.com.analytics.pipeline.order_analytics_batch.model.ItemSummary;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderAnalyticsRecord;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderCustomerRow;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderItem;
import br.com.analytics.pipeline.order_analytics_batch.model.Payment;
import br.com.analytics.pipeline.order_analytics_batch.model.PaymentSummary;
import br.com.analytics.pipeline.order_analytics_batch.model.Review;
import br.com.analytics.pipeline.order_analytics_batch.model.ReviewSummary;
import br.com.analytics.pipeline.order_analytics_batch.model.SourceSnapshot;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

public class OrderAnalyticsPipeline {

    private static final Logger logger = LoggerFactory.getLogger(OrderAnalyticsPipeline.class);

    private final EntityAggregator<Payment, PaymentSummary> paymentAggregator;
    private final EntityAggregator<OrderItem, ItemSummary> itemAggregator;
    private final EntityAggregator<Review, ReviewSummary> reviewAggregator;
    private final OrderComposer composer;
    private final QualificationFilter qualificationFilter;
    private final RegionClassifier regionClassifier;
    private final DeliveryKpiCalculator kpiCalculator;
    private final NullNormalizer nullNormalizer;
    private final Executor aggregationExecutor;

    public OrderAnalyticsPipeline(
            EntityAggregator<Payment, PaymentSummary> paymentAggregator,
            EntityAggregator<OrderItem, ItemSummary> itemAggregator,
            EntityAggregator<Review, ReviewSummary> reviewAggregator,
            OrderComposer composer,
            QualificationFilter qualificationFilter,
            RegionClassifier regionClassifier,
            DeliveryKpiCalculator kpiCalculator,
            NullNormalizer nullNormalizer,
            Executor aggregationExecutor) {
        this.paymentAggregator = paymentAggregator;
        this.itemAggregator = itemAggregator;
        this.reviewAggregator = reviewAggregator;
        this.composer = composer;
        this.qualificationFilter = qualificationFilter;
        this.regionClassifier = regionClassifier;
        this.kpiCalculator = kpiCalculator;
        this.nullNormalizer = nullNormalizer;
        this.aggregationExecutor = aggregationExecutor;
    }

    public List<OrderAnalyticsRecord> run(SourceSnapshot snapshot) {
        AggregateSnapshot aggregates = aggregate(snapshot.payments(), snapshot.items(), snapshot.reviews());

        List<OrderAnalyticsRecord> records = new ArrayList<>();
        for (OrderCustomerRow row : composer.baseRelation(snapshot.orders(), snapshot.customers())) {
            OrderAnalyticsRecord analyticsRecord = process(row, aggregates);
            if (analyticsRecord != null) {
                records.add(analyticsRecord);
            }
        }

        logger.info("Built {} order analytics records from {} orders", records.size(), snapshot.orders().size());
        return records;
    }

    public AggregateSnapshot aggregate(List<Payment> payments, List<OrderItem> items, List<Review> reviews) {
        return aggregateRows(payments::forEach, items::forEach, reviews::forEach);
    }

    // each source is drained on its own executor thread; returns once all three are done
    public AggregateSnapshot aggregateRows(RowSource<Payment> payments, RowSource<OrderItem> items,
                                           RowSource<Review> reviews) {
        CompletableFuture<Map<String, PaymentSummary>> paymentSummaries = aggregateAsync(paymentAggregator, payments);
        CompletableFuture<Map<String, ItemSummary>> itemSummaries = aggregateAsync(itemAggregator, items);
        CompletableFuture<Map<String, ReviewSummary>> reviewSummaries = aggregateAsync(reviewAggregator, reviews);

        CompletableFuture.allOf(paymentSummaries, itemSummaries, reviewSummaries).join();

        return new AggregateSnapshot(paymentSummaries.join(), itemSummaries.join(), reviewSummaries.join());
    }

    public @Nullable OrderAnalyticsRecord process(OrderCustomerRow row, AggregateSnapshot aggregates) {
        if (!qualificationFilter.test(row.order())) {
            return null;
        }

        ComposedOrder composed = composer.compose(row, aggregates);
        String region = regionClassifier.classify(composed.customer().customerState());
        DeliveryKpis kpis = kpiCalculator.calculate(composed.order());

        return nullNormalizer.normalize(composed, region, kpis);
    }

    private <T, S> CompletableFuture<Map<String, S>> aggregateAsync(EntityAggregator<T, S> aggregator,
                                                                    RowSource<T> rows) {
        return CompletableFuture.supplyAsync(() -> {
            Accumulation<T, S> accumulation = aggregator.start();
            AtomicLong rowCount = new AtomicLong();
            rows.forEach(row -> {
                rowCount.incrementAndGet();
                accumulation.add(row);
            });
            Map<String, S> summaries = accumulation.finish();
            logger.info("Aggregated {} {} rows into {} order summaries",
                    rowCount.get(), aggregator.entityName(), summaries.size());
            return summaries;
        }, aggregationExecutor);
    }
}
