package com.pulsetx.heartrate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Average heart rate in a 60 s window centred on a transaction time: [t - 30s, t + 30s).
 * Best effort: missing grant, empty window and store failures all yield an empty Mono, never an error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeartRateWindowResolver {

    public static final Duration HALF_WINDOW = Duration.ofSeconds(30);

    private final HeartRateStore heartRateStore;
    private final HeartRateAuthorization heartRateAuthorization;

    /**
     * Truncated mean bpm around {@code timestamp}, or empty when unavailable.
     */
    public Mono<Integer> averageAround(Instant timestamp) {
        if (timestamp == null || !heartRateAuthorization.isReadGranted()) {
            return Mono.empty();
        }
        Instant start = timestamp.minus(HALF_WINDOW);
        Instant end = timestamp.plus(HALF_WINDOW);
        return Mono.defer(() -> heartRateStore.averageBetween(start, end))
                .filter(avg -> avg != null && Double.isFinite(avg))
                .map(HeartRateWindowResolver::truncate)
                .onErrorResume(e -> {
                    log.debug("Heart-rate query failed for window {}..{}: {}", start, end, e.getMessage());
                    return Mono.empty();
                });
    }

    static int truncate(double average) {
        return (int) average;
    }
}
