package com.techanalysis.exception;

import java.util.Map;

/**
 * Thrown for invalid caller arguments such as a non-positive window size.
 * Degenerate market data never raises this; it is reserved for arguments that
 * can never produce a meaningful result.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
