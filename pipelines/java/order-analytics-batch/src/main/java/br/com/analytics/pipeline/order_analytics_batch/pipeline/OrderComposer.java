package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.model.AggregateSnapshot;
import br.com.analytics.pipeline.order_analytics_batch.model.ComposedOrder;
import br.com.analytics.pipeline.order_analytics_batch.model.Customer;
import br.com.analytics.pipeline.order_analytics_batch.model.Order;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderCustomerRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class OrderComposer {

    private static final Logger logger = LoggerFactory.getLogger(OrderComposer.class);

    public List<OrderCustomerRow> baseRelation(Collection<Order> orders, Collection<Customer> customers) {
        Map<String, Customer> customersById = new HashMap<>();
        for (Customer customer : customers) {
            customersById.putIfAbsent(customer.customerId(), customer);
        }

        List<OrderCustomerRow> rows = new ArrayList<>(orders.size());
        for (Order order : orders) {
            Customer customer = customersById.get(order.customerId());
            if (customer != null) {
                rows.add(new OrderCustomerRow(order, customer));
            }
        }

        if (rows.size() < orders.size()) {
            logger.debug("Dropped {} orders without a matching customer", orders.size() - rows.size());
        }
        return rows;
    }

    public ComposedOrder compose(OrderCustomerRow row, AggregateSnapshot aggregates) {
        String orderId = row.order().orderId();
        return new ComposedOrder(
                row.order(),
                row.customer(),
                aggregates.paymentsFor(orderId),
                aggregates.itemsFor(orderId),
                aggregates.reviewsFor(orderId));
    }
}
