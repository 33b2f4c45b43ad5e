package com.shlawgathon.faceguard.backend.service;

public class AlertInstanceNotFoundException extends RuntimeException {

    public AlertInstanceNotFoundException(String alertId) {
        super("Alert not found: " + alertId);
    }
}
