package com.pulsetx.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.pulsetx.pipeline.CorrelationPipeline;
import com.pulsetx.pipeline.config.PipelineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine in-process caches. Pipeline sessions expire after pulsetx.pipeline.session-ttl of inactivity.
 */
@Configuration
public class CaffeineConfig {

    public static final String PIPELINE_SESSION_CACHE = "pipelineSessionCache";

    @Bean(name = PIPELINE_SESSION_CACHE)
    public Cache<String, CorrelationPipeline> pipelineSessionCache(PipelineProperties pipelineProperties) {
        return Caffeine.newBuilder()
                .expireAfterAccess(pipelineProperties.getSessionTtl())
                .maximumSize(Math.max(1, pipelineProperties.getMaxSessions()))
                .build();
    }
}
