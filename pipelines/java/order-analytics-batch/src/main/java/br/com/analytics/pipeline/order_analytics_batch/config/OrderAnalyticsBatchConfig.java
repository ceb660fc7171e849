package br.com.analytics.pipeline.order_analytics_batch.config;

import br.com.analytics.pipeline.order_analytics_batch.aggregator.ItemAggregator;
import br.com.analytics.pipeline.order_analytics_batch.aggregator.PaymentAggregator;
import br.com.analytics.pipeline.order_analytics_batch.aggregator.ReviewAggregator;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderAnalyticsRecord;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderCustomerRow;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.AggregateStore;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.DeliveryKpiCalculator;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.NullNormalizer;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.OrderAnalyticsPipeline;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.OrderComposer;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.QualificationFilter;
import br.com.analytics.pipeline.order_analytics_batch.pipeline.RegionClassifier;
import br.com.analytics.pipeline.order_analytics_batch.processor.OrderAnalyticsProcessor;
import br.com.analytics.pipeline.order_analytics_batch.reader.OrderCustomerRowMapper;
import br.com.analytics.pipeline.order_analytics_batch.tasklet.AggregationTasklet;
import br.com.analytics.pipeline.order_analytics_batch.tasklet.OutputResetTasklet;
import br.com.analytics.pipeline.order_analytics_batch.writer.OrderAnalyticsWriter;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.ItemProcessor;
import org.springframework.batch.infrastructure.item.ItemReader;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.batch.infrastructure.item.database.builder.JdbcCursorItemReaderBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
public class OrderAnalyticsBatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;

    public OrderAnalyticsBatchConfig(JobRepository jobRepository, PlatformTransactionManager transactionManager) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
    }

    // Base relation: every order with its customer. Qualification happens in the processor.
    static final String ORDER_CUSTOMER_QUERY =
                    "SELECT " +
                    "o.order_id, o.customer_id, o.order_status, o.order_purchase_timestamp, " +
                    "o.order_estimated_delivery_date, o.order_delivered_customer_date, " +
                    "c.customer_unique_id, c.customer_city, c.customer_state " +
                    "FROM pedidos o " +
                    "JOIN clientes c ON o.customer_id = c.customer_id " +
                    "ORDER BY o.order_id";

    @Bean
    public ThreadPoolTaskExecutor aggregationTaskExecutor(
            @Value("${analytics.pipeline.aggregation-threads:3}") int aggregationThreads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aggregationThreads);
        executor.setMaxPoolSize(aggregationThreads);
        executor.setThreadNamePrefix("aggregation-");
        return executor;
    }

    @Bean
    public OrderAnalyticsPipeline orderAnalyticsPipeline(
            ThreadPoolTaskExecutor aggregationTaskExecutor,
            @Value("${analytics.pipeline.payment-method-separator:, }") String paymentMethodSeparator) {
        return new OrderAnalyticsPipeline(
                new PaymentAggregator(),
                new ItemAggregator(),
                new ReviewAggregator(),
                new OrderComposer(),
                new QualificationFilter(),
                new RegionClassifier(),
                new DeliveryKpiCalculator(),
                new NullNormalizer(paymentMethodSeparator),
                aggregationTaskExecutor);
    }

    @Bean
    public AggregateStore aggregateStore() {
        return new AggregateStore();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public JdbcCursorItemReader<OrderCustomerRow> itemReader(
            @Qualifier("appDataSource") DataSource appDataSource,
            @Value("${analytics.pipeline.fetch-size:1000}") int fetchSize
            ){
        return new JdbcCursorItemReaderBuilder<OrderCustomerRow>()
                .name("orderCustomerReader")
                .dataSource(appDataSource)
                .sql(ORDER_CUSTOMER_QUERY)
                .rowMapper(new OrderCustomerRowMapper())
                .fetchSize(fetchSize)
                .build();
    }

    @Bean
    public ItemProcessor<OrderCustomerRow, OrderAnalyticsRecord> itemProcessor(
            OrderAnalyticsPipeline orderAnalyticsPipeline, AggregateStore aggregateStore){
        return new OrderAnalyticsProcessor(orderAnalyticsPipeline, aggregateStore);
    }

    @Bean
    public ItemWriter<OrderAnalyticsRecord> itemWriter(
            @Qualifier("batchDataSource") DataSource batchDataSource, Clock clock){
        return new OrderAnalyticsWriter(batchDataSource, clock);
    }

    @Bean
    public Step resetStep(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new StepBuilder("resetStep", jobRepository)
                .tasklet(new OutputResetTasklet(batchDataSource), transactionManager)
                .build();
    }

    @Bean
    public Step aggregationStep(
            @Qualifier("appDataSource") DataSource appDataSource,
            @Value("${analytics.pipeline.fetch-size:1000}") int fetchSize,
            OrderAnalyticsPipeline orderAnalyticsPipeline,
            AggregateStore aggregateStore
    ){
        return new StepBuilder("aggregationStep", jobRepository)
                .tasklet(new AggregationTasklet(appDataSource, fetchSize, orderAnalyticsPipeline, aggregateStore),
                        transactionManager)
                .build();
    }

    @Bean
    public Step compositionStep(
            ItemReader<OrderCustomerRow> reader,
            ItemProcessor<OrderCustomerRow, OrderAnalyticsRecord> processor,
            ItemWriter<OrderAnalyticsRecord> writer,
            @Value("${analytics.pipeline.chunk-size:500}") int chunkSize
    ){
        return new StepBuilder("compositionStep", jobRepository)
                .<OrderCustomerRow, OrderAnalyticsRecord>chunk(chunkSize)
                .transactionManager(transactionManager)
                .reader(reader)
                .processor(processor)
                .writer(writer)
                .build();
    }

    @Bean
    public Job orderAnalyticsJob(Step resetStep, Step aggregationStep, Step compositionStep){
        return new JobBuilder("orderAnalyticsJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(resetStep)
                .next(aggregationStep)
                .next(compositionStep)
                .build();
    }

}
