package io.eventlog.upcast;

/**
 * Pure transformation of one event type's payload from one schema version to a newer one.
 *
 * <p>Upcasters run at read time only; stored rows keep the version they were written in.
 *
 * @see UpcasterChain
 */
public interface Upcaster {

    /**
     * Event type this upcaster applies to.
     *
     * @return the event type name
     */
    String eventType();

    /**
     * Schema version this upcaster reads.
     *
     * @return the source version
     */
    int sourceVersion();

    /**
     * Schema version this upcaster produces. Defaults to {@code sourceVersion() + 1}.
     *
     * @return the target version, greater than the source version
     */
    default int targetVersion() {
        return sourceVersion() + 1;
    }

    /**
     * Transforms a payload written in {@link #sourceVersion()} into {@link #targetVersion()}.
     *
     * @param payload the source payload
     * @return the transformed payload
     */
    byte[] transform(byte[] payload);
}
