package io.eventlog.runtime;

import io.eventlog.AggregateType;
import io.eventlog.EventCodec;
import io.eventlog.decider.Decider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Everything the runtime needs to know about one aggregate type.
 *
 * <pre>{@code
 * AggregateDefinition<TodoCommand, TodoState, TodoEvent> todos =
 *     AggregateDefinition.builder(TodoCommand.class, Aggregates.TODO)
 *         .decider(new TodoDecider())
 *         .codec(todoCodec)
 *         .aggregateId(TodoCommand::todoId)
 *         .conflictPolicy(TodoCommand.Complete.class, ConflictPolicy.RETRY)
 *         .terminalWhen(TodoState::isDeleted)
 *         .build();
 * }</pre>
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public final class AggregateDefinition<C, S, E> {
  private final Class<C> commandType;
  private final String aggregateType;
  private final Decider<C, S, E> decider;
  private final EventCodec<E> codec;
  private final Function<? super C, String> aggregateId;
  private final ConflictPolicy defaultConflictPolicy;
  private final Map<Class<?>, ConflictPolicy> conflictPolicies;
  private final Predicate<? super S> terminal;

  private AggregateDefinition(Builder<C, S, E> builder) {
    this.commandType = builder.commandType;
    this.aggregateType = builder.aggregateType;
    this.decider = Objects.requireNonNull(builder.decider, "decider");
    this.codec = Objects.requireNonNull(builder.codec, "codec");
    this.aggregateId = Objects.requireNonNull(builder.aggregateId, "aggregateId");
    this.defaultConflictPolicy = builder.defaultConflictPolicy;
    this.conflictPolicies = Map.copyOf(builder.conflictPolicies);
    this.terminal = builder.terminal;
  }

  /**
   * Starts a definition.
   *
   * @param commandType   common supertype of the aggregate's commands
   * @param aggregateType the aggregate type
   * @param <C>           command type
   * @param <S>           state type
   * @param <E>           event type
   * @return a new builder
   */
  public static <C, S, E> Builder<C, S, E> builder(Class<C> commandType, AggregateType aggregateType) {
    Objects.requireNonNull(aggregateType, "aggregateType");
    return new Builder<>(commandType, aggregateType.name());
  }

  public static <C, S, E> Builder<C, S, E> builder(Class<C> commandType, String aggregateType) {
    return new Builder<>(commandType, aggregateType);
  }

  public Class<C> commandType() {
    return commandType;
  }

  public String aggregateType() {
    return aggregateType;
  }

  public Decider<C, S, E> decider() {
    return decider;
  }

  public EventCodec<E> codec() {
    return codec;
  }

  /**
   * Extracts the target aggregate id from a command.
   *
   * @param command the command
   * @return the aggregate id
   * @throws IllegalArgumentException if the command yields no id
   */
  public String aggregateIdOf(C command) {
    String id = aggregateId.apply(command);
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("Command " + command.getClass().getSimpleName()
          + " has no aggregate id");
    }
    return id;
  }

  /**
   * Resolves the conflict policy of a command: the override registered for the most specific
   * class or interface the command is an instance of, else the default policy.
   *
   * @param command the command
   * @return the policy
   */
  public ConflictPolicy conflictPolicyFor(C command) {
    for (Class<?> type = command.getClass(); type != null; type = type.getSuperclass()) {
      ConflictPolicy policy = conflictPolicies.get(type);
      if (policy != null) {
        return policy;
      }
      for (Class<?> iface : type.getInterfaces()) {
        policy = conflictPolicies.get(iface);
        if (policy != null) {
          return policy;
        }
      }
    }
    return defaultConflictPolicy;
  }

  /**
   * Returns whether a stream in this state is finalized and accepts no further events.
   *
   * @param state the folded state
   * @return {@code true} if terminal
   */
  public boolean isTerminal(S state) {
    return terminal.test(state);
  }

  /** Builder for {@link AggregateDefinition}. */
  public static final class Builder<C, S, E> {
    private final Class<C> commandType;
    private final String aggregateType;
    private Decider<C, S, E> decider;
    private EventCodec<E> codec;
    private Function<? super C, String> aggregateId;
    private ConflictPolicy defaultConflictPolicy = ConflictPolicy.FAIL_FAST;
    private final Map<Class<?>, ConflictPolicy> conflictPolicies = new LinkedHashMap<>();
    private Predicate<? super S> terminal = state -> false;

    private Builder(Class<C> commandType, String aggregateType) {
      this.commandType = Objects.requireNonNull(commandType, "commandType");
      this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
      if (aggregateType.isEmpty() || aggregateType.contains("/") || aggregateType.contains("*")) {
        throw new IllegalArgumentException("Invalid aggregate type: " + aggregateType);
      }
    }

    /**
     * Sets the decider. <b>Required.</b>
     *
     * @param decider the decider
     * @return this builder
     */
    public Builder<C, S, E> decider(Decider<C, S, E> decider) {
      this.decider = decider;
      return this;
    }

    /**
     * Sets the event codec. <b>Required.</b>
     *
     * @param codec the codec
     * @return this builder
     */
    public Builder<C, S, E> codec(EventCodec<E> codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the function extracting the target aggregate id from a command. <b>Required.</b>
     *
     * @param aggregateId the extractor
     * @return this builder
     */
    public Builder<C, S, E> aggregateId(Function<? super C, String> aggregateId) {
      this.aggregateId = aggregateId;
      return this;
    }

    /**
     * Sets the policy of commands without an override.
     *
     * <p>Optional. Defaults to {@link ConflictPolicy#FAIL_FAST}.
     *
     * @param policy the default policy
     * @return this builder
     */
    public Builder<C, S, E> defaultConflictPolicy(ConflictPolicy policy) {
      this.defaultConflictPolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    /**
     * Overrides the conflict policy for one command class (or interface).
     *
     * @param type   the command class
     * @param policy the policy for that class
     * @return this builder
     */
    public Builder<C, S, E> conflictPolicy(Class<? extends C> type, ConflictPolicy policy) {
      conflictPolicies.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(policy, "policy"));
      return this;
    }

    /**
     * Declares when a stream is finalized. Commands that would append to a finalized
     * stream are rejected with code {@code stream_finalized}.
     *
     * <p>Optional. Defaults to never.
     *
     * @param terminal predicate over the folded state
     * @return this builder
     */
    public Builder<C, S, E> terminalWhen(Predicate<? super S> terminal) {
      this.terminal = Objects.requireNonNull(terminal, "terminal");
      return this;
    }

    public AggregateDefinition<C, S, E> build() {
      return new AggregateDefinition<>(this);
    }
  }
}
