package com.edgedispatch.core.execution;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutionConfig {

    /**
     * Policy-denial rule used by {@link RemoteExecutor}. Override this bean to replace the
     * detection rule without touching the executor chain.
     */
    @Bean
    public PolicyDenialClassifier policyDenialClassifier(ExecutionProperties properties) {
        String pattern = properties.getPolicyDenialPattern();
        if (pattern == null || pattern.isBlank()) {
            return PolicyDenialClassifier.defaultClassifier();
        }
        return PolicyDenialClassifier.containing(pattern);
    }
}
