package com.shlawgathon.faceguard.backend.delivery;

public record DeliveryResult(boolean success, String deliveryId, String error) {

    public static DeliveryResult delivered(String deliveryId) {
        return new DeliveryResult(true, deliveryId, null);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, null, error);
    }
}
