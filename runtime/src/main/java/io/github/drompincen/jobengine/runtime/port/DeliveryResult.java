package io.github.drompincen.jobengine.runtime.port;

public record DeliveryResult(boolean accepted, String deliveryId, String error) {

    public static DeliveryResult accepted(String deliveryId) {
        return new DeliveryResult(true, deliveryId, null);
    }

    public static DeliveryResult failure(String error) {
        return new DeliveryResult(false, null, error);
    }
}
