package br.com.analytics.pipeline.order_analytics_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record OrderAnalyticsRecord(
        String orderId,
        String customerUniqueId,
        String orderStatus,
        @Nullable String customerCity,
        @Nullable String customerState,
        String region,
        @Nullable LocalDateTime purchaseTimestamp,
        @Nullable LocalDateTime deliveredCustomerDate,
        @Nullable LocalDateTime estimatedDeliveryDate,
        @Nullable Long deliveryLeadTimeDays,
        @Nullable Long promisedLeadTimeDays,
        String deliveryStatus,
        BigDecimal totalPaymentValue,
        BigDecimal totalProductValue,
        BigDecimal totalFreightValue,
        @Nullable String paymentMethods,
        @Nullable BigDecimal reviewScore
) {
}
