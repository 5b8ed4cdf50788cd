package io.github.drompincen.habitnotifier.runtime.notification;

public interface NotificationChannel {

    /**
     * Sends {@code text} to the user's chat. Implementations report failures through
     * the result instead of throwing.
     */
    DeliveryResult send(long userId, String text);
}
