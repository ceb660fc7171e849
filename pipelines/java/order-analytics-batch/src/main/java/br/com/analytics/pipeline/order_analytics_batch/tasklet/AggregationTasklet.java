package br.com.analytics.pipeline.order_analytics_batch.tasklet;

import br.com.analytics.pipeline.order_analytics_batch.aggregator.RowSource;
import br.com.analytics.pipeline.order_analytics_batch.model.AggregateSnapshot;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.AggregateStore;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.OrderAnalyticsPipeline;
import br.com.analytics.pipeline.order_analytics_batch.reader.OrderItemRowMapper;
import br.com.analytics.pipeline.order_analytics_batch.reader.PaymentRowMapper;
import br.com.analytics.pipeline.order_analytics_batch.reader.ReviewRowMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;

public class AggregationTasklet implements Tasklet {

    private static final Logger logger = LoggerFactory.getLogger(AggregationTasklet.class);

    static final String PAYMENTS_QUERY =
            "SELECT order_id, payment_value, payment_type FROM pagamentos";

    static final String ITEMS_QUERY =
            "SELECT order_id, price, freight_value FROM itens_pedidos";

    static final String REVIEWS_QUERY =
            "SELECT order_id, review_score FROM reviews";

    private final JdbcTemplate jdbcTemplate;
    private final OrderAnalyticsPipeline pipeline;
    private final AggregateStore aggregateStore;

    public AggregationTasklet(DataSource appDataSource, int fetchSize,
                              OrderAnalyticsPipeline pipeline, AggregateStore aggregateStore) {
        this.jdbcTemplate = new JdbcTemplate(appDataSource);
        this.jdbcTemplate.setFetchSize(fetchSize);
        this.pipeline = pipeline;
        this.aggregateStore = aggregateStore;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        aggregateStore.clear();

        AggregateSnapshot snapshot = pipeline.aggregateRows(
                stream(PAYMENTS_QUERY, new PaymentRowMapper()),
                stream(ITEMS_QUERY, new OrderItemRowMapper()),
                stream(REVIEWS_QUERY, new ReviewRowMapper()));
        aggregateStore.publish(snapshot);

        logger.info("Published aggregates: {} payment, {} item, {} review summaries",
                snapshot.payments().size(), snapshot.items().size(), snapshot.reviews().size());

        return RepeatStatus.FINISHED;
    }

    // rows go straight from the cursor into the aggregator, never into a list
    private <T> RowSource<T> stream(String sql, RowMapper<T> rowMapper) {
        return consumer -> {
            RowCallbackHandler handler = resultSet -> consumer.accept(rowMapper.mapRow(resultSet, resultSet.getRow()));
            jdbcTemplate.query(sql, handler);
        };
    }
}
