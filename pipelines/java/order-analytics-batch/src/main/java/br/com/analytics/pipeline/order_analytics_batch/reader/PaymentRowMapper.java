package br.com.analytics.pipeline.order_analytics_batch.reader;

import br.com.analytics.pipeline.order_analytics_batch.model.Payment;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class PaymentRowMapper implements RowMapper<Payment> {

    @Override
    public Payment mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new Payment(
                resultSet.getString("order_id"),
                resultSet.getBigDecimal("payment_value"),
                resultSet.getString("payment_type")
        );
    }
}
