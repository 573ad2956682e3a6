package com.pulsetx.api.dto;

import java.util.List;

/**
 * GET /api/v1/sessions/{id} response: records in fetch order plus loading flags for UI feedback.
 */
public record PipelineStatusResponse(
        String sessionId,
        String address,
        List<EnrichedRecordResponse> records,
        String cursor,
        boolean loadingInitial,
        boolean loadingMore,
        boolean exhausted,
        FetchErrorResponse lastError
) {
}
