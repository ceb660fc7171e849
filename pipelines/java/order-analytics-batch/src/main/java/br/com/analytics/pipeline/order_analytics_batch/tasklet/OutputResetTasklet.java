package br.com.analytics.pipeline.order_analytics_batch.tasklet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

public class OutputResetTasklet implements Tasklet {

    private static final Logger logger = LoggerFactory.getLogger(OutputResetTasklet.class);

    static final String SQL_CLEAR_OUTPUT = "DELETE FROM order_analytics";

    private final JdbcTemplate jdbcTemplate;

    public OutputResetTasklet(DataSource batchDataSource) {
        this.jdbcTemplate = new JdbcTemplate(batchDataSource);
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        int deletedRows = jdbcTemplate.update(SQL_CLEAR_OUTPUT);
        logger.info("Cleared {} rows from order_analytics", deletedRows);
        return RepeatStatus.FINISHED;
    }
}
