package br.com.analytics.pipeline.order_analytics_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record ReviewSummary(
        String orderId,
        @Nullable BigDecimal averageScore
) {
}
