/**
 * Cancellable background work started after persistence, reporting its lifecycle back as
 * commands.
 */
package io.eventlog.task;
