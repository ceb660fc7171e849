package br.com.analytics.pipeline.order_analytics_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.Map;

public record AggregateSnapshot(
        Map<String, PaymentSummary> payments,
        Map<String, ItemSummary> items,
        Map<String, ReviewSummary> reviews
) {

    public AggregateSnapshot {
        payments = Map.copyOf(payments);
        items = Map.copyOf(items);
        reviews = Map.copyOf(reviews);
    }

    public @Nullable PaymentSummary paymentsFor(String orderId) {
        return payments.get(orderId);
    }

    public @Nullable ItemSummary itemsFor(String orderId) {
        return items.get(orderId);
    }

    public @Nullable ReviewSummary reviewsFor(String orderId) {
        return reviews.get(orderId);
    }
}
