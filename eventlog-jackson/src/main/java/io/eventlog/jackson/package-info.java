/**
 * Jackson bindings: a JSON {@link io.eventlog.EventCodec} for record-based event
 * hierarchies and a tree-based upcaster.
 */
package io.eventlog.jackson;
