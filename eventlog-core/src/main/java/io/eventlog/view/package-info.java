/**
 * Read models derived from the event log: {@link io.eventlog.view.Projection} folds events
 * with a {@link io.eventlog.decider.View} and keeps up through the bus.
 */
package io.eventlog.view;
