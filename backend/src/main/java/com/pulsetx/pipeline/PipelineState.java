package com.pulsetx.pipeline;

import com.pulsetx.domain.EnrichedRecord;
import com.pulsetx.domain.FetchError;
import com.pulsetx.domain.LoadingState;

import java.util.ArrayList;
import java.util.List;

/**
 * Records, cursor and loading phase of one pipeline. Mutators are package-private and only called by
 * {@link CorrelationPipeline}; everything is guarded by this object's monitor.
 * <p>
 * Each acquired hold gets a generation ticket so that a late release from a finished or cancelled
 * operation cannot free a newer hold.
 */
public class PipelineState {

    private final List<EnrichedRecord> records = new ArrayList<>();
    private String address;
    private String cursor;
    private LoadingState loadingState = LoadingState.IDLE;
    private long generation;
    private boolean exhausted;
    private FetchError lastError;

    /**
     * Moves IDLE to {@code phase}. Returns the ticket, or -1 when another operation holds the state.
     */
    synchronized long tryAcquire(LoadingState phase) {
        if (phase == LoadingState.IDLE) {
            throw new IllegalArgumentException("Cannot acquire IDLE");
        }
        if (loadingState != LoadingState.IDLE) {
            return -1;
        }
        loadingState = phase;
        return ++generation;
    }

    /**
     * Back to IDLE if {@code ticket} still owns the state. Safe to call more than once.
     */
    synchronized boolean release(long ticket) {
        if (!holds(ticket)) {
            return false;
        }
        loadingState = LoadingState.IDLE;
        return true;
    }

    /** Clears records and cursor for a new address. */
    synchronized void reset(String newAddress) {
        records.clear();
        address = newAddress;
        cursor = null;
        exhausted = false;
        lastError = null;
    }

    /**
     * Appends a page in the given order. The cursor moves to the last signature only when the page is non-empty;
     * an empty page marks the history as exhausted. Returns false, changing nothing, when {@code ticket} no
     * longer holds the state.
     */
    synchronized boolean appendPage(long ticket, List<EnrichedRecord> page) {
        if (!holds(ticket)) {
            return false;
        }
        if (page.isEmpty()) {
            exhausted = true;
        } else {
            records.addAll(page);
            cursor = page.get(page.size() - 1).signature();
        }
        lastError = null;
        return true;
    }

    synchronized boolean recordFailure(long ticket, FetchError error) {
        if (!holds(ticket)) {
            return false;
        }
        lastError = error;
        return true;
    }

    private boolean holds(long ticket) {
        return ticket == generation && loadingState != LoadingState.IDLE;
    }

    synchronized String address() {
        return address;
    }

    synchronized boolean exhausted() {
        return exhausted;
    }

    synchronized String cursor() {
        return cursor;
    }

    public synchronized LoadingState loadingState() {
        return loadingState;
    }

    public synchronized PipelineSnapshot snapshot() {
        return new PipelineSnapshot(address, List.copyOf(records), cursor, loadingState, exhausted, lastError);
    }
}
