package br.com.analytics.pipeline.order_analytics_batch.model;

import java.math.BigDecimal;
import java.util.SortedSet;

public record PaymentSummary(
        String orderId,
        BigDecimal totalPaymentValue,
        SortedSet<String> paymentMethods
) {
}
