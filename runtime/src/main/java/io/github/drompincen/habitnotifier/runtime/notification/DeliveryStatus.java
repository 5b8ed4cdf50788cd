package io.github.drompincen.habitnotifier.runtime.notification;

public enum DeliveryStatus {
    SUCCESS,
    /** Blocked or invalid recipient; every later attempt would fail the same way. */
    PERMANENT_FAILURE,
    TRANSIENT_FAILURE
}
