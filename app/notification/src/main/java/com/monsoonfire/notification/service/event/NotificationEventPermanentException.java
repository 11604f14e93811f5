/*
 * Where: Notification event handling
 * What: Exception signalling a permanent event processing failure
 * Why: Used to stop NATS redelivery and terminate the message
 */
package com.monsoonfire.notification.service.event;

public class NotificationEventPermanentException extends RuntimeException {

    public NotificationEventPermanentException(String message) {
        super(message);
    }

    public NotificationEventPermanentException(String message, Throwable cause) {
        super(message, cause);
    }
}
