package com.acme.store.processor.config;

import com.acme.store.config.MessagingConfig;
import com.acme.store.config.TimeoutConfig;
import com.acme.store.cqrs.Mediator;
import com.acme.store.event.EventPublisher;
import com.acme.store.processor.mediator.DefaultMediator;
import com.acme.store.processor.mediator.HandlerRegistry;
import com.acme.store.processor.mediator.behavior.LoggingBehavior;
import com.acme.store.processor.mediator.behavior.MetricsBehavior;
import com.acme.store.processor.mediator.behavior.ValidationBehavior;
import com.acme.store.processor.outbox.OutboxRelay;
import com.acme.store.processor.projection.ProjectionDispatcher;
import com.acme.store.processor.publish.BusEventPublisher;
import com.acme.store.processor.publish.OutboxEventPublisher;
import com.acme.store.service.OutboxService;
import com.acme.store.spi.MessageBus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Provider;
import jakarta.inject.Singleton;

/**
 * Factory for creating pipeline beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this factory does the DI wiring. The
 * handler registry comes with the standard behavior chain: logging outermost, then metrics, then
 * validation.
 */
@Factory
public class CoreBeansFactory {

  /** Creates TimeoutConfig bean populated from application.yml timeout.* properties */
  @Singleton
  @ConfigurationProperties("timeout")
  public TimeoutConfig timeoutConfig() {
    return new TimeoutConfig();
  }

  /** Creates MessagingConfig bean populated from application.yml messaging.* properties */
  @Singleton
  @ConfigurationProperties("messaging")
  public MessagingConfig messagingConfig() {
    return new MessagingConfig();
  }

  @Singleton
  public HandlerRegistry handlerRegistry(MeterRegistry meterRegistry) {
    HandlerRegistry registry = new HandlerRegistry();
    registry.addBehavior(new LoggingBehavior());
    registry.addBehavior(new MetricsBehavior(meterRegistry));
    registry.addBehavior(new ValidationBehavior());
    return registry;
  }

  @Singleton
  public Mediator mediator(HandlerRegistry registry) {
    return new DefaultMediator(registry);
  }

  @Singleton
  public ProjectionDispatcher projectionDispatcher() {
    return new ProjectionDispatcher();
  }

  /** Direct or outbox publishing, per messaging.publish-mode. */
  @Singleton
  public EventPublisher eventPublisher(
      MessagingConfig messagingConfig,
      MessageBus bus,
      Provider<OutboxService> outboxService,
      Provider<OutboxRelay> outboxRelay) {
    if (messagingConfig.getPublishMode() == MessagingConfig.PublishMode.OUTBOX) {
      return new OutboxEventPublisher(outboxService.get(), outboxRelay.get(), messagingConfig);
    }
    return new BusEventPublisher(bus);
  }
}
