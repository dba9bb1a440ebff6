package com.trackflow.config;

import com.trackflow.repository.JdbcTrackStore;
import com.trackflow.service.JdbcTargetEnvironment;
import com.trackflow.service.TargetEnvironment;
import com.trackflow.storage.FileSystemBlobStore;
import com.trackflow.storage.MediaUrls;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the promotion target. Present only where promotion is enabled; the
 * target's pool is kept out of the context so it never replaces the primary
 * data source.
 */
@Configuration
@ConditionalOnPromotion
@Slf4j
public class PromotionConfig {

    @Bean(destroyMethod = "close")
    public JdbcTargetEnvironment targetEnvironment(PipelineProperties properties) {
        PipelineProperties.Promotion promotion = properties.promotion();
        PipelineProperties.Target target = promotion.target();
        if (target.jdbcUrl() == null || target.jdbcUrl().isBlank()) {
            throw new IllegalStateException("pipeline.promotion.target.jdbc-url must be set when promotion is enabled");
        }

        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(target.jdbcUrl())
                .username(target.username())
                .password(target.password())
                .build();
        dataSource.setPoolName("target-" + promotion.targetEnvironment());
        dataSource.setMaximumPoolSize(Math.max(2, promotion.maxConcurrency() * 2));

        log.info("Promotion target '{}': {} / media {}", promotion.targetEnvironment(), target.jdbcUrl(),
                target.mediaDir().toAbsolutePath());
        return new JdbcTargetEnvironment(
                promotion.targetEnvironment(),
                dataSource,
                new JdbcTrackStore(dataSource, target.queryTimeout()),
                new FileSystemBlobStore(target.mediaArea(), target.mediaDir()),
                new MediaUrls(target.mediaBaseUrl()));
    }
}
