package br.com.analytics.pipeline.order_analytics_batch.model;

import org.jspecify.annotations.Nullable;

public record ComposedOrder(
        Order order,
        Customer customer,
        @Nullable PaymentSummary payments,
        @Nullable ItemSummary items,
        @Nullable ReviewSummary reviews
) {
}
