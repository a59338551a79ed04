package io.eventlog.task;

import io.eventlog.Counters;
import io.eventlog.MetadataKeys;
import io.eventlog.StoredEvent;
import io.eventlog.bus.EventBus;
import io.eventlog.memory.InMemoryEventLog;
import io.eventlog.runtime.AggregateRuntime;
import io.eventlog.runtime.CommandGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DetachedTaskRegistryTest {

  private final InMemoryEventLog log = new InMemoryEventLog();
  private final EventBus bus = new EventBus();
  private final AggregateRuntime<Counters.Command, Counters.State, Counters.Event> runtime =
      AggregateRuntime.builder(Counters.definition().build())
          .eventLog(log)
          .eventBus(bus)
          .build();
  private final CommandGateway gateway = new CommandGateway().register(runtime);
  private DetachedTaskRegistry registry = new DetachedTaskRegistry(gateway, 2);

  @AfterEach
  void tearDown() {
    registry.close();
    runtime.close();
    bus.close();
  }

  /** Start records +1, success records +result, failure records +100, cancellation closes. */
  private static TaskOutcome<Integer> counting(String counterId) {
    return new TaskOutcome<>() {
      @Override
      public Object onStarted() {
        return new Counters.Increment(counterId, 1);
      }

      @Override
      public Object onSuccess(Integer result, Duration elapsed) {
        return new Counters.Increment(counterId, result);
      }

      @Override
      public Object onFailure(Exception error) {
        return new Counters.Increment(counterId, 100);
      }

      @Override
      public Object onCancelled() {
        return new Counters.Close(counterId);
      }
    };
  }

  private List<String> eventTypes(String counterId) {
    List<String> types = new ArrayList<>();
    for (StoredEvent event : log.load(Counters.TYPE, counterId)) {
      types.add(event.eventType());
    }
    return types;
  }

  // ── Terminal outcomes ──

  @Test
  void successRecordsStartAndCompletion() throws Exception {
    TaskHandle handle = registry.spawn("q-1", () -> 41, counting("q-1"));

    assertEquals(TaskStatus.COMPLETED, handle.completion().get(5, TimeUnit.SECONDS));
    assertEquals(new Counters.State(42, false), runtime.state("q-1"));
    assertFalse(registry.isActive("q-1"));

    StoredEvent terminal = log.load(Counters.TYPE, "q-1").get(1);
    assertEquals("q-1", terminal.metadataValue(MetadataKeys.CORRELATION_ID));
    assertEquals("system", terminal.metadataValue(MetadataKeys.ACTOR));
  }

  @Test
  void failureRecordsFailure() throws Exception {
    TaskHandle handle = registry.spawn("q-1", () -> {
      throw new IllegalStateException("syntax error");
    }, counting("q-1"));

    assertEquals(TaskStatus.FAILED, handle.completion().get(5, TimeUnit.SECONDS));
    assertEquals(new Counters.State(101, false), runtime.state("q-1"));
  }

  @Test
  void errorThrownByWorkRecordsFailure() throws Exception {
    TaskHandle handle = registry.spawn("q-1", () -> {
      throw new AssertionError("stack blown");
    }, counting("q-1"));

    assertEquals(TaskStatus.FAILED, handle.completion().get(5, TimeUnit.SECONDS));
    assertEquals(new Counters.State(101, false), runtime.state("q-1"));
    assertTrue(registry.activeTasks().isEmpty());
  }

  @Test
  void failingStartCommandRecordsFailure() throws Exception {
    TaskOutcome<Integer> counting = counting("q-1");
    TaskHandle handle = registry.spawn("q-1", () -> 41, new TaskOutcome<>() {
      @Override
      public Object onStarted() {
        throw new IllegalStateException("no start command");
      }

      @Override
      public Object onSuccess(Integer result, Duration elapsed) {
        return counting.onSuccess(result, elapsed);
      }

      @Override
      public Object onFailure(Exception error) {
        return counting.onFailure(error);
      }

      @Override
      public Object onCancelled() {
        return counting.onCancelled();
      }
    });

    assertEquals(TaskStatus.FAILED, handle.completion().get(5, TimeUnit.SECONDS));
    assertEquals(new Counters.State(100, false), runtime.state("q-1"));
    assertFalse(registry.isActive("q-1"));
  }

  @Test
  void cancelWhileRunningRecordsOneCancellation() throws Exception {
    CountDownLatch running = new CountDownLatch(1);
    TaskHandle handle = registry.spawn("q-1", () -> {
      running.countDown();
      Thread.sleep(10_000);
      return 1;
    }, counting("q-1"));
    assertTrue(running.await(5, TimeUnit.SECONDS));

    assertTrue(registry.cancel("q-1"));

    assertEquals(TaskStatus.CANCELLED, handle.completion().get(5, TimeUnit.SECONDS));
    assertFalse(handle.cancel(), "already terminal");
    assertEquals(List.of("Incremented", "Closed"), eventTypes("q-1"));
  }

  @Test
  void cancelBeforeStartStillRecordsCancellation() throws Exception {
    registry.close();
    registry = new DetachedTaskRegistry(gateway, 1);
    CountDownLatch release = new CountDownLatch(1);
    TaskHandle blocker = registry.spawn("blocker", () -> {
      release.await();
      return 0;
    }, counting("blocker"));
    TaskHandle queued = registry.spawn("q-1", () -> 5, counting("q-1"));

    assertTrue(queued.cancel());

    assertEquals(TaskStatus.CANCELLED, queued.completion().get(5, TimeUnit.SECONDS));
    assertEquals(List.of("Closed"), eventTypes("q-1"), "no start recorded for a task that never ran");
    release.countDown();
    assertEquals(TaskStatus.COMPLETED, blocker.completion().get(5, TimeUnit.SECONDS));
    assertEquals(List.of("Closed"), eventTypes("q-1"));
  }

  @Test
  void terminalDispatchFailureStillCompletes() throws Exception {
    TaskHandle handle = registry.spawn("q-1", () -> 1, new TaskOutcome<Integer>() {
      @Override
      public Object onSuccess(Integer result, Duration elapsed) {
        return "unroutable";
      }

      @Override
      public Object onFailure(Exception error) {
        return null;
      }

      @Override
      public Object onCancelled() {
        return null;
      }
    });

    assertEquals(TaskStatus.COMPLETED, handle.completion().get(5, TimeUnit.SECONDS));
    assertFalse(registry.isActive("q-1"));
  }

  // ── Registry ──

  @Test
  void duplicateActiveCorrelationIdRejected() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    TaskHandle first = registry.spawn("q-1", () -> {
      release.await();
      return 1;
    }, counting("q-1"));

    assertTrue(registry.activeTasks().contains("q-1"));
    assertThrows(IllegalStateException.class, () -> registry.spawn("q-1", () -> 2, counting("q-1")));
    release.countDown();
    first.completion().get(5, TimeUnit.SECONDS);
  }

  @Test
  void cancelUnknownTaskReturnsFalse() {
    assertFalse(registry.cancel("missing"));
  }

  @Test
  void closeCancelsActiveTasks() throws Exception {
    CountDownLatch running = new CountDownLatch(1);
    TaskHandle handle = registry.spawn("q-1", () -> {
      running.countDown();
      Thread.sleep(10_000);
      return 1;
    }, counting("q-1"));
    assertTrue(running.await(5, TimeUnit.SECONDS));

    registry.close();

    assertEquals(TaskStatus.CANCELLED, handle.completion().get(5, TimeUnit.SECONDS));
    assertThrows(IllegalStateException.class, () -> registry.spawn("q-2", () -> 1, counting("q-2")));
  }
}
