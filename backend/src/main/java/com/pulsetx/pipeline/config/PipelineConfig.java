package com.pulsetx.pipeline.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    /** Fallback time for signatures the ledger returns without a block time. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
