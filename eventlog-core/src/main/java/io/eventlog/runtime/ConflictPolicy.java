package io.eventlog.runtime;

/**
 * How the runtime reacts when an append fails with a
 * {@link io.eventlog.ConcurrencyConflictException}.
 */
public enum ConflictPolicy {
  /**
   * Surface the conflict to the caller immediately. The default for user-originated
   * commands, whose author should see fresh state before trying again.
   */
  FAIL_FAST,
  /**
   * Reload the aggregate, re-run the decider against the fresh state and append again, with
   * exponential backoff, up to the runtime's conflict attempt bound. For system-originated
   * or idempotent commands such as background completion reports.
   */
  RETRY
}
