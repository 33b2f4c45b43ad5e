package com.shlawgathon.faceguard.backend.model;

public enum AlertStatus {
    TRIGGERED,
    ACKNOWLEDGED,
    RESOLVED
}
