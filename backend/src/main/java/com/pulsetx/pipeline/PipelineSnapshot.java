package com.pulsetx.pipeline;

import com.pulsetx.domain.EnrichedRecord;
import com.pulsetx.domain.FetchError;
import com.pulsetx.domain.LoadingState;

import java.util.List;

/**
 * Immutable view of a pipeline's state at one moment.
 */
public record PipelineSnapshot(
        String address,
        List<EnrichedRecord> records,
        String cursor,
        LoadingState loadingState,
        boolean exhausted,
        FetchError lastError
) {

    public boolean isLoadingInitial() {
        return loadingState == LoadingState.LOADING_INITIAL;
    }

    public boolean isLoadingMore() {
        return loadingState == LoadingState.LOADING_MORE;
    }

    public boolean isLoading() {
        return loadingState != LoadingState.IDLE;
    }
}
