package io.eventlog;

/**
 * Well-known keys of the event metadata map written by the aggregate runtime.
 */
public final class MetadataKeys {
    /** Identifier shared by every event caused by one user request, including background work. */
    public static final String CORRELATION_ID = "correlation_id";
    /** Event id (or request id) that directly caused the command producing the event. */
    public static final String CAUSATION_ID = "causation_id";
    public static final String ACTOR = "actor";
    public static final String COMMAND_TYPE = "command_type";

    private MetadataKeys() {
    }
}
