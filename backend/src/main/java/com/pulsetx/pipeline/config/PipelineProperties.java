package com.pulsetx.pipeline.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Pagination and session settings. Documented in application.yml under pulsetx.pipeline.
 */
@ConfigurationProperties(prefix = "pulsetx.pipeline")
@NoArgsConstructor
@Getter
@Setter
public class PipelineProperties {

    /** Signatures requested per page. */
    private int pageLimit = 30;

    /** Upper bound for one page operation (fetch plus enrichment). Zero disables the bound. */
    private Duration pageTimeout = Duration.ofSeconds(60);

    /** Idle time after which a session and its records are dropped. */
    private Duration sessionTtl = Duration.ofMinutes(30);

    /** Maximum concurrent sessions kept in memory. */
    private long maxSessions = 1_000;
}
