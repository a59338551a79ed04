package io.eventlog.spring.boot;

import io.eventlog.StoredEvent;
import io.eventlog.bus.BusListener;
import io.eventlog.bus.EventBus;
import io.eventlog.bus.SubscriptionOptions;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventSubscriberRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(BusConfig.class);

  @Test
  void subscribesAnnotatedListener() {
    runner.withUserConfiguration(TodoListenerConfig.class).run(ctx -> {
      EventBus bus = ctx.getBean(EventBus.class);
      assertEquals(1, bus.subscriberCount());

      bus.publish(event(1, "QuerySession", "q-1"));
      bus.publish(event(2, "Todo", "t-1"));

      TodoListener listener = ctx.getBean(TodoListener.class);
      assertTrue(listener.received.await(5, TimeUnit.SECONDS));
      assertEquals(List.of(2L), listener.sequences);
    });
  }

  @Test
  void busCloseEndsSubscriptions() {
    runner.withUserConfiguration(TodoListenerConfig.class).run(ctx -> {
      EventBus bus = ctx.getBean(EventBus.class);
      bus.close();
      assertEquals(0, bus.subscriberCount());
    });
  }

  @Test
  void failsWhenBeanDoesNotImplementBusListener() {
    runner.withUserConfiguration(NotAListenerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsOnInvalidPattern() {
    runner.withUserConfiguration(BadPatternConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  private static StoredEvent event(long sequence, String type, String id) {
    return new StoredEvent(sequence, "e-" + sequence, type, id, 1, "Happened", 1,
        "{}".getBytes(StandardCharsets.UTF_8), Map.of(), Instant.EPOCH);
  }

  @Configuration
  static class BusConfig {
    @Bean(destroyMethod = "close")
    EventBus eventBus() {
      return new EventBus();
    }

    @Bean
    EventSubscriberRegistrar eventSubscriberRegistrar(ListableBeanFactory beanFactory, EventBus eventBus) {
      return new EventSubscriberRegistrar(beanFactory, eventBus, SubscriptionOptions.defaults());
    }
  }

  @EventSubscriber(value = "events/Todo/**", capacity = 8)
  static class TodoListener implements BusListener {
    final List<Long> sequences = new CopyOnWriteArrayList<>();
    final CountDownLatch received = new CountDownLatch(1);

    @Override
    public void onEvent(StoredEvent event) {
      sequences.add(event.globalSequence());
      received.countDown();
    }
  }

  @Configuration
  static class TodoListenerConfig {
    @Bean
    TodoListener todoListener() {
      return new TodoListener();
    }
  }

  @EventSubscriber("events/**")
  static class NotAListener {
  }

  @Configuration
  static class NotAListenerConfig {
    @Bean
    NotAListener notAListener() {
      return new NotAListener();
    }
  }

  @EventSubscriber("events/Todo*")
  static class BadPatternListener implements BusListener {
    @Override
    public void onEvent(StoredEvent event) {
    }
  }

  @Configuration
  static class BadPatternConfig {
    @Bean
    BadPatternListener badPatternListener() {
      return new BadPatternListener();
    }
  }
}
