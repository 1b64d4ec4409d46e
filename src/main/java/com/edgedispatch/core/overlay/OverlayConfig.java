package com.edgedispatch.core.overlay;

import com.edgedispatch.core.process.ProcessRunner;
import com.edgedispatch.core.process.SystemProcessRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OverlayConfig {

    @Bean
    public ProcessRunner processRunner() {
        return new SystemProcessRunner();
    }

    @Bean
    public OverlayNetwork overlayNetwork(ProcessRunner processRunner, OverlayProperties properties) {
        return new TailscaleOverlayNetwork(processRunner, properties);
    }
}
