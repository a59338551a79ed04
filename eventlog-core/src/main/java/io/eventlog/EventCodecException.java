package io.eventlog;

/**
 * Thrown when a domain event cannot be encoded into a payload or decoded from one.
 */
public final class EventCodecException extends EventLogException {

    public EventCodecException(String message) {
        super(message);
    }

    public EventCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
