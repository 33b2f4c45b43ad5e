package com.shlawgathon.faceguard.backend.client;

/**
 * The record store could not be reached within the retry budget.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
