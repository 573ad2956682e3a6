package com.pulsetx.heartrate;

import java.time.Instant;

public record HeartRateSample(Instant timestamp, double bpm) {
}
