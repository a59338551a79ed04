/**
 * Pure decision functions: {@link io.eventlog.decider.Decider}, its
 * {@link io.eventlog.decider.Decision} outcome, decider combination,
 * {@link io.eventlog.decider.Saga} reactions and read-side {@link io.eventlog.decider.View}s.
 */
package io.eventlog.decider;
