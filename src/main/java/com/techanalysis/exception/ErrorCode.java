package com.techanalysis.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure categories of the analysis engine. Neither is raised for thin or degenerate
 * market data, which always yields zero or empty results instead.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", "caller argument can never produce a result"),
    PIPELINE_DEFINITION_ERROR("PIPELINE_DEFINITION_ERROR", "derivation steps are wired incorrectly");

    private final String code;
    private final String description;
}
