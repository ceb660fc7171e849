package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.model.Order;

import java.util.function.Predicate;

public class QualificationFilter implements Predicate<Order> {

    public static final String DELIVERED = "delivered";

    @Override
    public boolean test(Order order) {
        return DELIVERED.equals(order.orderStatus()) && order.deliveredCustomerDate() != null;
    }
}
