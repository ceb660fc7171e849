package br.com.analytics.pipeline.order_analytics_batch.reader;

import br.com.analytics.pipeline.order_analytics_batch.model.OrderItem;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class OrderItemRowMapper implements RowMapper<OrderItem> {

    @Override
    public OrderItem mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new OrderItem(
                resultSet.getString("order_id"),
                resultSet.getBigDecimal("price"),
                resultSet.getBigDecimal("freight_value")
        );
    }
}
