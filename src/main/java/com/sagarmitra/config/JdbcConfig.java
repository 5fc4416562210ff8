package com.sagarmitra.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.util.StringUtils;

import javax.sql.DataSource;

/**
 * Database wiring for the conversation store. Only active when {@code agent.store.type=database};
 * the in-memory store needs none of it.
 */
@Configuration
@ConditionalOnProperty(name = "agent.store.type", havingValue = "database")
@Slf4j
public class JdbcConfig {

    static final String SCHEMA_LOCATION = "schema.sql";

    @Bean
    @ConditionalOnMissingBean(DataSource.class)
    public DataSource conversationStoreDataSource(Environment environment) {
        String url = environment.getProperty("spring.datasource.url");
        if (!StringUtils.hasText(url)) {
            throw new IllegalStateException("Property 'spring.datasource.url' must be set when agent.store.type=database");
        }

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setUrl(url);
        dataSource.setUsername(environment.getProperty("spring.datasource.username"));
        dataSource.setPassword(environment.getProperty("spring.datasource.password"));
        dataSource.setDriverClassName(
                environment.getProperty("spring.datasource.driver-class-name", "com.mysql.cj.jdbc.Driver")
        );
        log.info("Conversation store backed by JDBC url={}", url);
        return dataSource;
    }

    @Bean
    @ConditionalOnMissingBean(NamedParameterJdbcTemplate.class)
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    @ConditionalOnProperty(name = "agent.store.init-schema", havingValue = "true")
    public DataSourceInitializer conversationStoreSchemaInitializer(DataSource dataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.setContinueOnError(false);
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(populator);
        log.info("Conversation store schema will be applied from {}", SCHEMA_LOCATION);
        return initializer;
    }
}
