package com.shlawgathon.faceguard.backend.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The record store answered with an error status. Not retried.
 */
public class RecordStoreException extends RuntimeException {

    private final int statusCode;
    private final transient JsonNode payload;

    public RecordStoreException(int statusCode, String message, JsonNode payload) {
        super(message);
        this.statusCode = statusCode;
        this.payload = payload;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public JsonNode getPayload() {
        return payload;
    }
}
