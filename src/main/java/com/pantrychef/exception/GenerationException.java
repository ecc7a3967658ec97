package com.pantrychef.exception;

import com.pantrychef.model.FailureReason;

/**
 * The generation call failed before producing any text.
 */
public class GenerationException extends PipelineException {

    public GenerationException(String message, Throwable cause) {
        super(FailureReason.GENERATION_FAILED, message, cause);
    }
}
