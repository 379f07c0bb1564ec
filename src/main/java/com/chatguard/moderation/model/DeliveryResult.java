package com.chatguard.moderation.model;

/**
 * Channel a notification went out on; {@code error} holds the last failure when nothing was delivered.
 */
public record DeliveryResult(NotificationChannel channel, String error) {

    public static DeliveryResult delivered(NotificationChannel channel) {
        return new DeliveryResult(channel, null);
    }

    public static DeliveryResult undelivered(String error) {
        return new DeliveryResult(NotificationChannel.NONE, error);
    }

    public boolean isDelivered() {
        return channel != NotificationChannel.NONE;
    }
}
