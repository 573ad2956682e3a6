package com.pulsetx.heartrate.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Heart-rate source configuration. Documented in application.yml under pulsetx.heart-rate.
 */
@ConfigurationProperties(prefix = "pulsetx.heart-rate")
@Getter
@Setter
public class HeartRateProperties {

    /** Which store backs window queries. */
    private StoreType store = StoreType.MEMORY;

    /** Initial read grant. Can be toggled at runtime through the authorization endpoint. */
    private boolean readGranted = true;

    private RemoteProperties remote = new RemoteProperties();

    public enum StoreType {
        MEMORY,
        REMOTE
    }

    @Getter
    @Setter
    public static class RemoteProperties {
        /** Base URL of the remote aggregate service; required when store=REMOTE. */
        private String baseUrl;
        /** Optional bearer token. */
        private String apiToken;
    }
}
