package com.pantrychef.exception;

import com.pantrychef.model.FailureReason;
import lombok.Getter;

/**
 * Fatal failure of a pipeline run. Anything that is not a {@code PipelineException} and
 * escapes the pipeline is reported as {@link FailureReason#INTERNAL}.
 */
@Getter
public abstract class PipelineException extends RuntimeException {

    private final FailureReason reason;

    protected PipelineException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected PipelineException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
