package com.wheelskills.progress.error;

/** Mutation of an attempt that is no longer in progress. */
public class InvalidStateException extends ProgressException {
    public InvalidStateException(String message) {
        super(message);
    }
}
