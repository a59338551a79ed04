package io.eventlog.spring.boot;

import io.eventlog.EventLog;
import io.eventlog.bus.EventBus;
import io.eventlog.bus.SubscriptionOptions;
import io.eventlog.feed.ReplayCoordinator;
import io.eventlog.jdbc.DataSourceConnectionProvider;
import io.eventlog.jdbc.JdbcEventLog;
import io.eventlog.jdbc.TableNames;
import io.eventlog.jdbc.store.AbstractJdbcEventLogStore;
import io.eventlog.jdbc.store.JdbcEventLogStores;
import io.eventlog.runtime.CommandGateway;
import io.eventlog.runtime.ExponentialBackoffRetryPolicy;
import io.eventlog.runtime.RetryPolicy;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.task.DetachedTaskRegistry;
import io.eventlog.upcast.Upcaster;
import io.eventlog.upcast.UpcasterChain;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Auto-configuration for the event log.
 *
 * <p>Wires a {@link JdbcEventLog} over the application's {@link DataSource}, the
 * {@link EventBus}, a {@link CommandGateway} that every {@code AggregateRuntime} bean is
 * registered with, the {@link DetachedTaskRegistry} and the {@link ReplayCoordinator} for
 * SSE feeds. Aggregate runtimes are declared by the application through
 * {@link AggregateRuntimeFactory}.
 *
 * @see EventLogProperties
 * @see EventLogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcEventLog.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventLogProperties.class)
public class EventLogAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcEventLogStore eventLogStore(DataSource dataSource, EventLogProperties props) {
    AbstractJdbcEventLogStore detected = JdbcEventLogStores.detect(dataSource);
    if (!TableNames.DEFAULT_TABLE.equals(props.getTableName())
        || !TableNames.DEFAULT_SEQUENCE_TABLE.equals(props.getSequenceTableName())) {
      return detected.withTableNames(props.getTableName(), props.getSequenceTableName());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public UpcasterChain upcasterChain(ObjectProvider<Upcaster> upcasters) {
    UpcasterChain.Builder builder = UpcasterChain.builder();
    upcasters.orderedStream().forEach(builder::register);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean(EventLog.class)
  public JdbcEventLog eventLog(ConnectionProvider connectionProvider,
      AbstractJdbcEventLogStore eventLogStore,
      UpcasterChain upcasterChain,
      EventLogProperties props) {
    JdbcEventLog eventLog = JdbcEventLog.builder()
        .connectionProvider(connectionProvider)
        .store(eventLogStore)
        .upcasters(upcasterChain)
        .build();
    if (props.isInitializeSchema()) {
      eventLog.createSchema();
    }
    return eventLog;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventBus eventBus(ObjectProvider<MetricsExporter> metricsProvider) {
    return new EventBus(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean
  @ConditionalOnMissingBean
  public SubscriptionOptions eventLogSubscriptionOptions(EventLogProperties props) {
    EventLogProperties.Bus bus = props.getBus();
    return new SubscriptionOptions(bus.getBufferCapacity(), bus.getOverflowPolicy(),
        Duration.ofMillis(bus.getBlockTimeoutMs()));
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy eventLogRetryPolicy(EventLogProperties props) {
    return new ExponentialBackoffRetryPolicy(
        props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs());
  }

  @Bean
  @ConditionalOnMissingBean
  public CommandGateway commandGateway() {
    return new CommandGateway();
  }

  @Bean
  @ConditionalOnMissingBean
  public AggregateRuntimeFactory aggregateRuntimeFactory(EventLog eventLog,
      EventBus eventBus,
      CommandGateway commandGateway,
      RetryPolicy retryPolicy,
      ObjectProvider<MetricsExporter> metricsProvider,
      EventLogProperties props) {
    return new AggregateRuntimeFactory(eventLog, eventBus, commandGateway, retryPolicy,
        metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP), props.getRuntime());
  }

  @Bean
  @ConditionalOnMissingBean
  public AggregateRuntimeRegistrar aggregateRuntimeRegistrar(ListableBeanFactory beanFactory,
      CommandGateway commandGateway) {
    return new AggregateRuntimeRegistrar(beanFactory, commandGateway);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DetachedTaskRegistry detachedTaskRegistry(CommandGateway commandGateway,
      ObjectProvider<MetricsExporter> metricsProvider,
      EventLogProperties props) {
    return new DetachedTaskRegistry(commandGateway, props.getTasks().getWorkerCount(),
        metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ReplayCoordinator replayCoordinator(EventLog eventLog,
      EventBus eventBus,
      SubscriptionOptions eventLogSubscriptionOptions,
      EventLogProperties props) {
    return ReplayCoordinator.builder()
        .eventLog(eventLog)
        .eventBus(eventBus)
        .keepAlive(Duration.ofMillis(props.getFeed().getKeepAliveMs()))
        .replayPageSize(props.getFeed().getReplayPageSize())
        .subscriptionOptions(eventLogSubscriptionOptions)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventSubscriberRegistrar eventSubscriberRegistrar(ListableBeanFactory beanFactory,
      EventBus eventBus,
      SubscriptionOptions eventLogSubscriptionOptions) {
    return new EventSubscriberRegistrar(beanFactory, eventBus, eventLogSubscriptionOptions);
  }
}
