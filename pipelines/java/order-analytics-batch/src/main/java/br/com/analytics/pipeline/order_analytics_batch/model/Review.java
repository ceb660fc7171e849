package br.com.analytics.pipeline.order_analytics_batch.model;

import org.jspecify.annotations.Nullable;

public record Review(
        String orderId,
        @Nullable Integer reviewScore
) {
}
