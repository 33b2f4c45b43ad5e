package com.shlawgathon.faceguard.backend.index;

/**
 * Raised when a persisted index snapshot cannot be read back consistently.
 */
public class CorruptIndexException extends RuntimeException {

    public CorruptIndexException(String message) {
        super(message);
    }

    public CorruptIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
