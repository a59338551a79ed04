package io.eventlog.view;

import io.eventlog.EventCodec;
import io.eventlog.EventLog;
import io.eventlog.StoredEvent;
import io.eventlog.bus.BusListener;
import io.eventlog.bus.EventBus;
import io.eventlog.bus.EventKeys;
import io.eventlog.bus.KeyExpression;
import io.eventlog.bus.PublishedRange;
import io.eventlog.bus.Subscription;
import io.eventlog.bus.SubscriptionOptions;
import io.eventlog.decider.View;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A read model derived from the event log by a {@link View}.
 *
 * <p>The projection keeps the state folded so far and the highest global sequence it has
 * examined. {@link #rebuild()} refolds everything from sequence 0; {@link #catchUp()} reads
 * only what was committed since. Subscribed to the bus, live events are applied directly when
 * the {@linkplain PublishedRange published range} shows nothing in between was missed;
 * otherwise, and after lag, the projection catches up from the log. Events whose key does not
 * match the filter are examined but not folded.
 *
 * <pre>{@code
 * Projection<QueryHistory, QuerySessionEvent> history = Projection.builder(new QueryHistoryView(), CODEC)
 *     .eventLog(log)
 *     .filter(EventKeys.aggregateTypePattern("QuerySession"))
 *     .build();
 * Subscription live = history.subscribe(bus, SubscriptionOptions.defaults());
 * QueryHistory current = history.state();
 * }</pre>
 *
 * <p>Thread-safe: updates are serialized, {@link #state()} returns the latest folded state.
 *
 * @param <S> state type
 * @param <E> event type
 */
public final class Projection<S, E> implements BusListener {
  private static final Logger logger = Logger.getLogger(Projection.class.getName());

  private final View<S, E> view;
  private final EventCodec<E> codec;
  private final EventLog eventLog;
  private final KeyExpression filter;
  private final int pageSize;

  private volatile S state;
  private volatile long position;

  private Projection(Builder<S, E> builder) {
    this.view = builder.view;
    this.codec = builder.codec;
    this.eventLog = Objects.requireNonNull(builder.eventLog, "eventLog");
    this.filter = builder.filter;
    this.pageSize = builder.pageSize;
    this.state = view.initialState();
  }

  public static <S, E> Builder<S, E> builder(View<S, E> view, EventCodec<E> codec) {
    return new Builder<>(view, codec);
  }

  public S state() {
    return state;
  }

  /**
   * Returns the highest global sequence examined, folded or filtered out.
   *
   * @return the projection's position in the log
   */
  public long position() {
    return position;
  }

  public KeyExpression filter() {
    return filter;
  }

  /**
   * Discards the current state and folds the whole log again.
   *
   * @return the rebuilt state
   */
  public synchronized S rebuild() {
    state = view.initialState();
    position = 0;
    return catchUp();
  }

  /**
   * Folds every event committed after the current position.
   *
   * @return the updated state
   */
  public synchronized S catchUp() {
    while (true) {
      List<StoredEvent> page = eventLog.querySince(position, pageSize);
      for (StoredEvent event : page) {
        apply(event);
      }
      if (page.size() < pageSize) {
        return state;
      }
    }
  }

  /**
   * Subscribes to the bus, then catches up from the log. Events committed while catching up
   * arrive through the subscription and are skipped if already folded.
   *
   * @param bus     the bus
   * @param options subscription buffer settings
   * @return the subscription; close it to stop live updates
   */
  public Subscription subscribe(EventBus bus, SubscriptionOptions options) {
    Subscription subscription = bus.subscribe(filter, options, this);
    catchUp();
    return subscription;
  }

  @Override
  public void onEvent(StoredEvent event) {
    onEvent(event, PublishedRange.EMPTY);
  }

  @Override
  public synchronized void onEvent(StoredEvent event, PublishedRange published) {
    long sequence = event.globalSequence();
    if (sequence <= position) {
      return;
    }
    if (sequence == position + 1 || published.covers(position, sequence)) {
      apply(event);
    } else {
      catchUp();
    }
  }

  @Override
  public void onLagged(long droppedTotal) {
    logger.log(Level.WARNING, "Projection over {0} lagged, {1} events dropped so far; catching up",
        new Object[] {filter, droppedTotal});
    catchUp();
  }

  private void apply(StoredEvent event) {
    if (filter.matches(EventKeys.eventKey(event))) {
      state = view.evolve(state, codec.decode(event));
    }
    position = event.globalSequence();
  }

  public static final class Builder<S, E> {
    private final View<S, E> view;
    private final EventCodec<E> codec;
    private EventLog eventLog;
    private KeyExpression filter = EventKeys.ALL_EVENTS;
    private int pageSize = 500;

    private Builder(View<S, E> view, EventCodec<E> codec) {
      this.view = Objects.requireNonNull(view, "view");
      this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Builder<S, E> eventLog(EventLog eventLog) {
      this.eventLog = eventLog;
      return this;
    }

    /** Keys of the events to fold; the codec must decode every event it matches. */
    public Builder<S, E> filter(KeyExpression filter) {
      this.filter = Objects.requireNonNull(filter, "filter");
      return this;
    }

    public Builder<S, E> pageSize(int pageSize) {
      if (pageSize < 1) {
        throw new IllegalArgumentException("pageSize must be >= 1");
      }
      this.pageSize = pageSize;
      return this;
    }

    public Projection<S, E> build() {
      return new Projection<>(this);
    }
  }
}
