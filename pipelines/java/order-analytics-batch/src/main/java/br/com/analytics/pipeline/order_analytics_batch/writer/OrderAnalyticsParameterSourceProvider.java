package br.com.analytics.pipeline.order_analytics_batch.writer;

import br.com.analytics.pipeline.order_analytics_batch.model.OrderAnalyticsRecord;
import org.springframework.batch.infrastructure.item.database.ItemSqlParameterSourceProvider;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Types;
import java.time.Clock;
import java.time.LocalDateTime;

public class OrderAnalyticsParameterSourceProvider implements ItemSqlParameterSourceProvider<OrderAnalyticsRecord> {

    private final Clock clock;

    public OrderAnalyticsParameterSourceProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public SqlParameterSource createSqlParameterSource(OrderAnalyticsRecord item) {
        return new MapSqlParameterSource()
                .addValue("orderId", item.orderId())
                .addValue("customerUniqueId", item.customerUniqueId())
                .addValue("orderStatus", item.orderStatus())
                .addValue("customerCity", item.customerCity(), Types.VARCHAR)
                .addValue("customerState", item.customerState(), Types.VARCHAR)
                .addValue("region", item.region())
                .addValue("purchaseTimestamp", item.purchaseTimestamp(), Types.TIMESTAMP)
                .addValue("deliveredCustomerDate", item.deliveredCustomerDate(), Types.TIMESTAMP)
                .addValue("estimatedDeliveryDate", item.estimatedDeliveryDate(), Types.TIMESTAMP)
                .addValue("deliveryLeadTimeDays", item.deliveryLeadTimeDays(), Types.INTEGER)
                .addValue("promisedLeadTimeDays", item.promisedLeadTimeDays(), Types.INTEGER)
                .addValue("deliveryStatus", item.deliveryStatus())
                .addValue("totalPaymentValue", item.totalPaymentValue())
                .addValue("totalProductValue", item.totalProductValue())
                .addValue("totalFreightValue", item.totalFreightValue())
                .addValue("paymentMethods", item.paymentMethods(), Types.VARCHAR)
                .addValue("reviewScore", item.reviewScore(), Types.NUMERIC)
                .addValue("calculationDate", LocalDateTime.now(clock), Types.TIMESTAMP);
    }
}
