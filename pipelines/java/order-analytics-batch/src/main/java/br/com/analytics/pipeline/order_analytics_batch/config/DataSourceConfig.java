package br.com.analytics.pipeline.order_analytics_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

@Configuration
public class DataSourceConfig {

    static final String OUTPUT_SCHEMA = "schema/order_analytics.sql";

    @Autowired
    private Environment env;

    @Bean(name = "appDataSource")
    public DataSource appDataSource() {
        return createDataSource("spring.datasource.app", "app-pool");
    }

    @Primary
    @Bean(name = "batchDataSource")
    public DataSource batchDataSource() {
        return createDataSource("spring.datasource.batch", "batch-pool");
    }

    @Bean(name = "appTransactionManager")
    public DataSourceTransactionManager appTransactionManager(@Qualifier("appDataSource") DataSource appDataSource) {
        return new DataSourceTransactionManager(appDataSource);
    }

    @Primary
    @Bean(name = "batchTransactionManager")
    public DataSourceTransactionManager batchTransactionManager(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new DataSourceTransactionManager(batchDataSource);
    }

    @Bean
    public DataSourceInitializer outputSchemaInitializer(
            @Qualifier("batchDataSource") DataSource batchDataSource,
            @Value("${analytics.output.initialize-schema:true}") boolean initializeSchema) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(batchDataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(OUTPUT_SCHEMA)));
        initializer.setEnabled(initializeSchema);
        return initializer;
    }

    private HikariDataSource createDataSource(String prefix, String poolName) {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName(poolName);
        dataSource.setDriverClassName(env.getProperty(prefix + ".driver-class-name"));
        dataSource.setJdbcUrl(env.getProperty(prefix + ".url"));
        dataSource.setUsername(env.getProperty(prefix + ".username"));
        dataSource.setPassword(env.getProperty(prefix + ".password"));
        return dataSource;
    }

}
