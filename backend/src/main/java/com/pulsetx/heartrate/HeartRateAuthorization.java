package com.pulsetx.heartrate;

/**
 * Whether heart-rate reads have been granted. The grant itself is obtained outside this service.
 */
public interface HeartRateAuthorization {

    boolean isReadGranted();
}
