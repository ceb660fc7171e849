package br.com.analytics.pipeline.order_analytics_batch.model;

import java.util.List;

public record SourceSnapshot(
        List<Order> orders,
        List<Customer> customers,
        List<Payment> payments,
        List<OrderItem> items,
        List<Review> reviews
) {

    public SourceSnapshot {
        orders = List.copyOf(orders);
        customers = List.copyOf(customers);
        payments = List.copyOf(payments);
        items = List.copyOf(items);
        reviews = List.copyOf(reviews);
    }
}
