package com.firesql.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the datasource identity and credentials from application configuration.
 * Validation happens per query, so a misconfigured datasource still starts and
 * reports a configuration error on every query.
 */
@Configuration
public class DatasourceConfig {
    private static final Logger logger = LoggerFactory.getLogger(DatasourceConfig.class);

    @Value("${firesql.datasource.project-id:}")
    private String projectId;

    @Value("${firesql.datasource.service-account:}")
    private String serviceAccount;

    @Bean
    public DatasourceSettings datasourceSettings() {
        DatasourceSettings settings = new DatasourceSettings(projectId, serviceAccount);
        logger.info("Datasource configured: {}", settings);
        return settings;
    }
}
