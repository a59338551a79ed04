package io.eventlog.spring.boot;

import io.eventlog.runtime.AggregateRuntime;
import io.eventlog.runtime.CommandGateway;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * Registers every {@link AggregateRuntime} bean with the {@link CommandGateway}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * so runtimes can depend on the gateway for saga dispatch without a cycle.
 */
public class AggregateRuntimeRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final CommandGateway gateway;

    public AggregateRuntimeRegistrar(ListableBeanFactory beanFactory, CommandGateway gateway) {
        this.beanFactory = beanFactory;
        this.gateway = gateway;
    }

    @Override
    public void afterSingletonsInstantiated() {
        for (AggregateRuntime<?, ?, ?> runtime : beanFactory.getBeansOfType(AggregateRuntime.class).values()) {
            gateway.register(runtime);
        }
    }
}
