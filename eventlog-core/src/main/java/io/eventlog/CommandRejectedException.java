package io.eventlog;

/**
 * Thrown synchronously when a decider rejects a command. No event was produced.
 *
 * <p>{@code code} is a stable machine-readable reason (e.g. {@code "empty_text"});
 * the message is meant for humans.
 */
public final class CommandRejectedException extends EventLogException {
    private final String code;

    public CommandRejectedException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
