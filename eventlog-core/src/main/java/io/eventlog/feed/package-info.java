/**
 * Resumable Server-Sent Events feeds: replay from the event log followed by live events
 * from the bus, with keep-alives.
 *
 * @see io.eventlog.feed.ReplayCoordinator
 */
package io.eventlog.feed;
