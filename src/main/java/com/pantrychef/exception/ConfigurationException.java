package com.pantrychef.exception;

import com.pantrychef.model.FailureReason;

/**
 * A required downstream credential is absent. Never retried.
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(FailureReason.CONFIGURATION, message);
    }
}
