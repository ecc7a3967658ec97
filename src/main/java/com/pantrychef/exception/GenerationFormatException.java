package com.pantrychef.exception;

import com.pantrychef.model.FailureReason;
import lombok.Getter;

/**
 * Generation output could not be salvaged into structured recipes.
 */
@Getter
public class GenerationFormatException extends PipelineException {

    private final String rawText;

    public GenerationFormatException(String message, String rawText) {
        super(FailureReason.GENERATION_FORMAT, message);
        this.rawText = rawText;
    }
}
