package com.wheelskills.progress.error;

/**
 * Base type for failures a client can act on. Anything else reaching the web layer is
 * treated as an internal error.
 */
public abstract class ProgressException extends RuntimeException {
    protected ProgressException(String message) {
        super(message);
    }
}
