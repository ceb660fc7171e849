package br.com.analytics.pipeline.order_analytics_batch.reader;

import br.com.analytics.pipeline.order_analytics_batch.model.Customer;
import br.com.analytics.pipeline.order_analytics_batch.model.Order;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderCustomerRow;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;

public class OrderCustomerRowMapper implements RowMapper<OrderCustomerRow> {

    @Override
    public OrderCustomerRow mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        Order order = new Order(
                resultSet.getString("order_id"),
                resultSet.getString("customer_id"),
                resultSet.getString("order_status"),
                resultSet.getObject("order_purchase_timestamp", LocalDateTime.class),
                resultSet.getObject("order_estimated_delivery_date", LocalDateTime.class),
                resultSet.getObject("order_delivered_customer_date", LocalDateTime.class)
        );
        Customer customer = new Customer(
                resultSet.getString("customer_id"),
                resultSet.getString("customer_unique_id"),
                resultSet.getString("customer_city"),
                resultSet.getString("customer_state")
        );
        return new OrderCustomerRow(order, customer);
    }
}
