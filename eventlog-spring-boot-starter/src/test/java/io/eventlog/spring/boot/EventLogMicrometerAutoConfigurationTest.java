package io.eventlog.spring.boot;

import io.eventlog.micrometer.MicrometerMetricsExporter;
import io.eventlog.runtime.AggregateRuntime;
import io.eventlog.runtime.CommandContext;
import io.eventlog.runtime.CommandGateway;
import io.eventlog.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.FilteredClassLoader;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventLogMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EventLogMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("eventlog.metrics.name-prefix=todo.eventlog").run(ctx -> {
            assertNotNull(ctx.getBean(MicrometerMetricsExporter.class));
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("todo.eventlog.append.events").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("eventlog.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void notLoadedWithoutMicrometerOnClasspath() {
        runner.withClassLoader(new FilteredClassLoader(MeterRegistry.class)).run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void runtimesReportThroughExporter() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        DataSourceAutoConfiguration.class,
                        EventLogMicrometerAutoConfiguration.class,
                        EventLogAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class, TallyConfig.class)
                .withPropertyValues(
                        "spring.datasource.url=jdbc:h2:mem:eventlog_metrics_test;DB_CLOSE_DELAY=-1",
                        "spring.datasource.driver-class-name=org.h2.Driver",
                        "eventlog.initialize-schema=true")
                .run(ctx -> {
                    var gateway = ctx.getBean(CommandGateway.class);
                    gateway.dispatch(new Tallies.Add(UUID.randomUUID().toString(), 2), CommandContext.user("tester"));
                    gateway.dispatch(new Tallies.Add(UUID.randomUUID().toString(), 5), CommandContext.user("tester"));

                    var registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(2.0, registry.get("eventlog.append.events").counter().count());
                });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }

    @Configuration
    static class TallyConfig {
        @Bean
        AggregateRuntime<Tallies.Add, Long, Tallies.Added> tallyRuntime(AggregateRuntimeFactory runtimes) {
            return runtimes.builder(Tallies.definition()).build();
        }
    }
}
