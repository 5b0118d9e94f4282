package com.frameception.client;

import com.frameception.core.config.FrameceptionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the backend client.
 */
@Configuration
public class BackendClientConfig {

    private static final Logger log = LoggerFactory.getLogger(BackendClientConfig.class);

    @Bean
    @ConditionalOnMissingBean(BackendClient.class)
    public BackendClient backendClient(FrameceptionProperties properties) {
        log.info("Backend client targeting {}", properties.getBaseUrl());
        return new HttpBackendClient(properties);
    }
}
