package br.com.analytics.pipeline.order_analytics_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

public record Order(
        String orderId,
        String customerId,
        String orderStatus,
        @Nullable LocalDateTime purchaseTimestamp,
        @Nullable LocalDateTime estimatedDeliveryDate,
        @Nullable LocalDateTime deliveredCustomerDate
) {
}
