package com.fauxcloud.core.persistence;

import com.fauxcloud.orchestration.OrchestrationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Provides the file-backed {@link InstanceStore}, keeping instance records under
 * {@code <dataDir>/state}.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @ConditionalOnMissingBean(InstanceStore.class)
    public InstanceStore fileInstanceStore(OrchestrationProperties properties) {
        Path stateDir = properties.dataPath().resolve("state");
        log.info("Persisting instance state to {}", stateDir);
        return new FileInstanceStore(stateDir);
    }
}
