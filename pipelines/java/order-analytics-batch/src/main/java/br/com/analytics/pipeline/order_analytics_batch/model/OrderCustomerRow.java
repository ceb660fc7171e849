package br.com.analytics.pipeline.order_analytics_batch.model;

public record OrderCustomerRow(
        Order order,
        Customer customer
) {
}
