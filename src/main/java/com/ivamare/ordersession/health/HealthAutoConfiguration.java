package com.ivamare.ordersession.health;

import com.ivamare.ordersession.OrderSessionAutoConfiguration;
import com.ivamare.ordersession.projection.DeadLetterRepository;
import com.ivamare.ordersession.projection.ProjectionEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for order session health indicators.
 */
@AutoConfiguration(after = OrderSessionAutoConfiguration.class)
@ConditionalOnClass({HealthIndicator.class, JdbcTemplate.class})
@ConditionalOnProperty(prefix = "ordersession", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "ordersession", name = "storage", havingValue = "jdbc", matchIfMissing = true)
    @ConditionalOnBean(JdbcTemplate.class)
    @ConditionalOnMissingBean(EventStoreHealthIndicator.class)
    public EventStoreHealthIndicator eventStoreHealthIndicator(JdbcTemplate jdbcTemplate,
                                                               ObjectProvider<DataSource> dataSource) {
        return new EventStoreHealthIndicator(jdbcTemplate, dataSource.getIfAvailable());
    }

    @Bean
    @ConditionalOnBean({ProjectionEngine.class, DeadLetterRepository.class})
    @ConditionalOnMissingBean(ProjectionHealthIndicator.class)
    public ProjectionHealthIndicator projectionHealthIndicator(ProjectionEngine projectionEngine,
                                                               DeadLetterRepository deadLetterRepository) {
        return new ProjectionHealthIndicator(projectionEngine, deadLetterRepository);
    }
}
