package br.com.analytics.pipeline.order_analytics_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record OrderItem(
        String orderId,
        @Nullable BigDecimal price,
        @Nullable BigDecimal freightValue
) {
}
