package br.com.analytics.pipeline.order_analytics_batch.writer;

import br.com.analytics.pipeline.order_analytics_batch.model.OrderAnalyticsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;

import javax.sql.DataSource;
import java.time.Clock;

public class OrderAnalyticsWriter implements ItemWriter<OrderAnalyticsRecord> {

    private static final Logger logger = LoggerFactory.getLogger(OrderAnalyticsWriter.class);

    static final String SQL_INSERT =
            "INSERT INTO order_analytics (order_id, customer_unique_id, order_status, customer_city, " +
                    "customer_state, regiao_cliente, dt_compra, dt_entrega, dt_prometida, " +
                    "dias_para_entrega, dias_ate_promessa, status_entrega, valor_total_pagamento, " +
                    "valor_total_produtos, valor_total_frete, metodos_pagamento, nota_review, calculation_date) " +
                    "VALUES (:orderId, :customerUniqueId, :orderStatus, :customerCity, " +
                    ":customerState, :region, :purchaseTimestamp, :deliveredCustomerDate, :estimatedDeliveryDate, " +
                    ":deliveryLeadTimeDays, :promisedLeadTimeDays, :deliveryStatus, :totalPaymentValue, " +
                    ":totalProductValue, :totalFreightValue, :paymentMethods, :reviewScore, :calculationDate)";

    private final JdbcBatchItemWriter<OrderAnalyticsRecord> delegateWriter;

    public OrderAnalyticsWriter(DataSource batchDataSource, Clock clock) {
        this.delegateWriter = createDelegateWriter(batchDataSource, clock);
    }

    private JdbcBatchItemWriter<OrderAnalyticsRecord> createDelegateWriter(DataSource dataSource, Clock clock) {
        return new JdbcBatchItemWriterBuilder<OrderAnalyticsRecord>()
                .itemSqlParameterSourceProvider(new OrderAnalyticsParameterSourceProvider(clock))
                .sql(SQL_INSERT)
                .dataSource(dataSource)
                .build();
    }

    @Override
    public void write(Chunk<? extends OrderAnalyticsRecord> chunk) throws Exception {
        if (chunk.isEmpty()) {
            logger.debug("No order analytics records in this chunk");
            return;
        }

        logger.debug("Writing {} order analytics records", chunk.size());
        delegateWriter.write(chunk);
    }
}
