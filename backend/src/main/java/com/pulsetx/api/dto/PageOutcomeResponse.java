package com.pulsetx.api.dto;

import com.pulsetx.domain.PageOutcome;

/**
 * Result of initial-fetch / load-more. error is set only for FAILED.
 */
public record PageOutcomeResponse(
        String status,
        int appended,
        String cursor,
        FetchErrorResponse error
) {

    public static PageOutcomeResponse from(PageOutcome outcome) {
        return new PageOutcomeResponse(
                outcome.status().name(),
                outcome.appended(),
                outcome.cursor(),
                FetchErrorResponse.from(outcome.error()));
    }
}
