package com.techanalysis.exception;

import java.util.Map;

/**
 * Raised when a derivation step is wired incorrectly: a forward reference to a
 * field that no earlier step writes, a field written twice, or a step that does
 * not honour its declared outputs at run time.
 */
public class PipelineDefinitionException extends BaseException {

    public PipelineDefinitionException(String message) {
        super(ErrorCode.PIPELINE_DEFINITION_ERROR, message);
    }

    public PipelineDefinitionException(String message, Map<String, Object> details) {
        super(ErrorCode.PIPELINE_DEFINITION_ERROR, message, details);
    }
}
