package io.github.drompincen.habitnotifier.runtime.notification;

public record DeliveryResult(DeliveryStatus status, String detail) {

    public static DeliveryResult success() {
        return new DeliveryResult(DeliveryStatus.SUCCESS, null);
    }

    public static DeliveryResult permanentFailure(String detail) {
        return new DeliveryResult(DeliveryStatus.PERMANENT_FAILURE, detail);
    }

    public static DeliveryResult transientFailure(String detail) {
        return new DeliveryResult(DeliveryStatus.TRANSIENT_FAILURE, detail);
    }

    public boolean isSuccess() {
        return status == DeliveryStatus.SUCCESS;
    }

    public boolean isPermanentFailure() {
        return status == DeliveryStatus.PERMANENT_FAILURE;
    }
}
