package io.eventlog;

/**
 * Base class of the unchecked exceptions raised by the event log and the aggregate runtime.
 */
public class EventLogException extends RuntimeException {

    public EventLogException(String message) {
        super(message);
    }

    public EventLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
