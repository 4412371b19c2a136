package com.optura.core.llm;

/**
 * Thrown when the model answers with null or blank content.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
