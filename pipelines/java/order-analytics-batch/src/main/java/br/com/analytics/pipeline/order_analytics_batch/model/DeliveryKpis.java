package br.com.analytics.pipeline.order_analytics_batch.model;

import org.jspecify.annotations.Nullable;

public record DeliveryKpis(
        @Nullable Long deliveryLeadTimeDays,
        @Nullable Long promisedLeadTimeDays,
        DeliveryStatus deliveryStatus
) {
}
