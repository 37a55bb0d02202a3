package com.wheelskills.progress.error;

public class NotFoundException extends ProgressException {
    public NotFoundException(String message) {
        super(message);
    }
}
