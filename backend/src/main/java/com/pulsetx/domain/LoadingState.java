package com.pulsetx.domain;

/**
 * Pipeline loading phase. Only IDLE accepts a new fetch.
 */
public enum LoadingState {
    IDLE,
    LOADING_INITIAL,
    LOADING_MORE
}
