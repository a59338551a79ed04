package io.eventlog.demo.todo;

import io.eventlog.jackson.JacksonEventCodec;
import io.eventlog.jackson.JsonUpcaster;
import io.eventlog.runtime.AggregateDefinition;
import io.eventlog.upcast.Upcaster;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wiring for the Todo aggregate.
 *
 * <p>{@code TodoCreated} is at schema version 2; version 1 payloads named the text field
 * {@code title} and are renamed on read by {@link #CREATED_V1_UPCASTER}.
 */
public final class TodoAggregate {
  public static final String TYPE = "Todo";

  public static final JacksonEventCodec<TodoEvent> CODEC = JacksonEventCodec.builder(TodoEvent.class)
      .register("TodoCreated", TodoEvent.TodoCreated.class, 2)
      .register("TodoTextUpdated", TodoEvent.TodoTextUpdated.class)
      .register("TodoCompleted", TodoEvent.TodoCompleted.class)
      .register("TodoUncompleted", TodoEvent.TodoUncompleted.class)
      .register("TodoDeleted", TodoEvent.TodoDeleted.class)
      .build();

  public static final Upcaster CREATED_V1_UPCASTER = JsonUpcaster.of("TodoCreated", 1, node -> {
    JsonNode title = node.remove("title");
    if (title != null && !node.has("text")) {
      node.set("text", title);
    }
    return node;
  });

  private TodoAggregate() {
  }

  public static AggregateDefinition<TodoCommand, TodoState, TodoEvent> definition() {
    return AggregateDefinition.<TodoCommand, TodoState, TodoEvent>builder(TodoCommand.class, TYPE)
        .decider(new TodoDecider())
        .codec(CODEC)
        .aggregateId(TodoCommand::todoId)
        .terminalWhen(TodoState::isDeleted)
        .build();
  }
}
