package com.pulsetx.heartrate.store;

import com.pulsetx.heartrate.HeartRateSample;
import com.pulsetx.heartrate.HeartRateStore;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Session-lifetime sample store fed through the API. Samples at the same instant are folded into a sum and count.
 */
public class InMemoryHeartRateStore implements HeartRateStore {

    private final ConcurrentSkipListMap<Instant, double[]> samples = new ConcurrentSkipListMap<>();

    public void record(HeartRateSample sample) {
        if (sample == null || sample.timestamp() == null) {
            throw new IllegalArgumentException("sample timestamp is required");
        }
        if (!Double.isFinite(sample.bpm()) || sample.bpm() <= 0) {
            throw new IllegalArgumentException("bpm must be a positive number");
        }
        samples.merge(sample.timestamp(), new double[]{sample.bpm(), 1},
                (a, b) -> new double[]{a[0] + b[0], a[1] + b[1]});
    }

    public void recordAll(Collection<HeartRateSample> batch) {
        batch.forEach(this::record);
    }

    public int size() {
        return samples.values().stream().mapToInt(v -> (int) v[1]).sum();
    }

    public void clear() {
        samples.clear();
    }

    @Override
    public Mono<Double> averageBetween(Instant start, Instant end) {
        return Mono.fromSupplier(() -> {
            if (!start.isBefore(end)) {
                return null;
            }
            NavigableMap<Instant, double[]> window = samples.subMap(start, true, end, false);
            double sum = 0;
            double count = 0;
            for (double[] v : window.values()) {
                sum += v[0];
                count += v[1];
            }
            return count == 0 ? null : sum / count;
        });
    }
}
