package com.pulsetx.heartrate;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Source of heart-rate samples, in beats per minute.
 */
public interface HeartRateStore {

    /**
     * Mean of samples taken in [start, end). Empty when the window holds no samples.
     */
    Mono<Double> averageBetween(Instant start, Instant end);
}
