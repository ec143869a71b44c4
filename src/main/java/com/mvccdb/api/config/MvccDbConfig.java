package com.mvccdb.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.mvccdb.backend.dbm.DatabaseManager;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(MvccDbProperties.class)
public class MvccDbConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(MvccDbConfig.class);

    @Bean(destroyMethod = "shutdown")
    public DatabaseManager databaseManager(MvccDbProperties properties) {
        DatabaseManager manager = new DatabaseManager(properties.getDefaultIsolation());
        manager.createDefault(properties.getDefaultDatabase());
        LOGGER.info("engine started, default database '{}', default isolation {}",
                properties.getDefaultDatabase(), properties.getDefaultIsolation());
        return manager;
    }
}
