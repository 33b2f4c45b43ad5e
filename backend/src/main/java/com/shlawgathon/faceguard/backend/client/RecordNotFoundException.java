package com.shlawgathon.faceguard.backend.client;

import com.fasterxml.jackson.databind.JsonNode;

public class RecordNotFoundException extends RecordStoreException {

    public RecordNotFoundException(String path, JsonNode payload) {
        super(404, "Resource not found: " + path, payload);
    }
}
