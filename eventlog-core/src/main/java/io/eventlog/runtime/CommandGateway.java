package io.eventlog.runtime;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Routes command objects to the {@link AggregateRuntime} responsible for them.
 *
 * <p>Sagas and detached background tasks dispatch through the gateway so they do not need to
 * know which aggregate handles a command. A command is routed to the runtime whose
 * {@linkplain AggregateDefinition#commandType() command type} it is an instance of.
 *
 * <pre>{@code
 * CommandGateway gateway = new CommandGateway()
 *     .register(todoRuntime)
 *     .register(querySessionRuntime);
 * gateway.dispatch(new TodoCommand.Complete("t-1"), CommandContext.user("alice"));
 * }</pre>
 */
public final class CommandGateway {

  private final CopyOnWriteArrayList<AggregateRuntime<?, ?, ?>> runtimes = new CopyOnWriteArrayList<>();
  private final Map<Class<?>, AggregateRuntime<?, ?, ?>> routes = new ConcurrentHashMap<>();

  /**
   * Registers a runtime for its definition's command type.
   *
   * @param runtime the runtime
   * @return this gateway for chaining
   * @throws IllegalArgumentException if a runtime for the same command type is registered
   */
  public CommandGateway register(AggregateRuntime<?, ?, ?> runtime) {
    Objects.requireNonNull(runtime, "runtime");
    Class<?> commandType = runtime.definition().commandType();
    for (AggregateRuntime<?, ?, ?> existing : runtimes) {
      if (existing.definition().commandType().equals(commandType)) {
        throw new IllegalArgumentException("Command type already registered: " + commandType.getName());
      }
    }
    runtimes.add(runtime);
    routes.clear();
    return this;
  }

  /**
   * Handles a command synchronously on its runtime.
   *
   * @param command the command
   * @param context request context
   * @return the result
   * @throws IllegalArgumentException if no runtime handles the command type
   */
  public CommandResult dispatch(Object command, CommandContext context) {
    return route(command).handleUntyped(command, context);
  }

  /**
   * Handles a command on its runtime's executor.
   *
   * @param command the command
   * @param context request context
   * @return a future of the result
   * @throws IllegalArgumentException if no runtime handles the command type
   */
  public CompletableFuture<CommandResult> submit(Object command, CommandContext context) {
    return route(command).submitUntyped(command, context);
  }

  /**
   * Returns whether some registered runtime handles the command's type.
   *
   * @param command the command
   * @return {@code true} if routable
   */
  public boolean canRoute(Object command) {
    return find(command.getClass()) != null;
  }

  private AggregateRuntime<?, ?, ?> route(Object command) {
    Objects.requireNonNull(command, "command");
    AggregateRuntime<?, ?, ?> runtime = find(command.getClass());
    if (runtime == null) {
      throw new IllegalArgumentException("No aggregate runtime handles " + command.getClass().getName());
    }
    return runtime;
  }

  private AggregateRuntime<?, ?, ?> find(Class<?> type) {
    AggregateRuntime<?, ?, ?> cached = routes.get(type);
    if (cached != null) {
      return cached;
    }
    for (AggregateRuntime<?, ?, ?> runtime : runtimes) {
      if (runtime.definition().commandType().isAssignableFrom(type)) {
        routes.put(type, runtime);
        return runtime;
      }
    }
    return null;
  }
}
