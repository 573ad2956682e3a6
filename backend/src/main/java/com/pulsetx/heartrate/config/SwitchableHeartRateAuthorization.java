package com.pulsetx.heartrate.config;

import com.pulsetx.heartrate.HeartRateAuthorization;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Read grant seeded from configuration and updated by whoever owns the consent flow.
 */
public class SwitchableHeartRateAuthorization implements HeartRateAuthorization {

    private final AtomicBoolean readGranted;

    public SwitchableHeartRateAuthorization(boolean initiallyGranted) {
        this.readGranted = new AtomicBoolean(initiallyGranted);
    }

    @Override
    public boolean isReadGranted() {
        return readGranted.get();
    }

    public void setReadGranted(boolean granted) {
        readGranted.set(granted);
    }
}
