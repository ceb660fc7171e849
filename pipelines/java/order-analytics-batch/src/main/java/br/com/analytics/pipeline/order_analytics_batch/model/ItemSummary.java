package br.com.analytics.pipeline.order_analytics_batch.model;

import java.math.BigDecimal;

public record ItemSummary(
        String orderId,
        BigDecimal totalProductValue,
        BigDecimal totalFreightValue
) {
}
