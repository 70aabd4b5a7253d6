package com.purchasingpower.issueflow.exception;

import lombok.Getter;

/**
 * The model's response could not be decoded into a JSON object, even after one repair round.
 */
@Getter
public class StructuredOutputException extends RuntimeException {

    private final String rawContent;

    public StructuredOutputException(String message, String rawContent) {
        super(message);
        this.rawContent = rawContent;
    }
}
