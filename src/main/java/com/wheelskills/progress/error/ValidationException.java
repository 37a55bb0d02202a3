package com.wheelskills.progress.error;

public class ValidationException extends ProgressException {
    public ValidationException(String message) {
        super(message);
    }
}
