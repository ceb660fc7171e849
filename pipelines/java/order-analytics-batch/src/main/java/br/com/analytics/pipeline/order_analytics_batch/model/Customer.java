package br.com.analytics.pipeline.order_analytics_batch.model;

import org.jspecify.annotations.Nullable;

public record Customer(
        String customerId,
        String customerUniqueId,
        @Nullable String customerCity,
        @Nullable String customerState
) {
}
