package com.promptsmith.application.orchestration.exception;

public class PromptValidationException extends RuntimeException {
    public PromptValidationException(String message) {
        super(message);
    }
}
