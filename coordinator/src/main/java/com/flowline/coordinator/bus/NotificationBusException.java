package com.flowline.coordinator.bus;

/**
 * Thrown when the bus cannot establish or use its LISTEN connection.
 *
 * Only raised inside the listener loop, which catches it and reconnects;
 * publishers never see it.
 */
public class NotificationBusException extends RuntimeException {

    public NotificationBusException(String message) {
        super(message);
    }

    public NotificationBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
