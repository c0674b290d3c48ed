package com.acme.commerce.config;

import com.acme.commerce.domain.repository.OrderRepository;
import com.acme.commerce.domain.repository.ProductRepository;
import com.acme.commerce.infrastructure.persistence.JdbcOrderRepository;
import com.acme.commerce.infrastructure.persistence.JdbcProductRepository;
import com.acme.commerce.infrastructure.readmodel.JdbcOrderReadStore;
import com.acme.commerce.infrastructure.readmodel.JdbcProductReadStore;
import com.acme.commerce.projection.OrderProjection;
import com.acme.commerce.projection.ProductProjection;
import com.acme.store.config.MessagingConfig;
import com.acme.store.config.TimeoutConfig;
import com.acme.store.event.EventPublisher;
import com.acme.store.processor.bus.InMemoryMessageBus;
import com.acme.store.processor.consumer.ProjectionWorker;
import com.acme.store.processor.mediator.HandlerRegistry;
import com.acme.store.processor.projection.ProjectionDispatcher;
import com.acme.store.processor.uow.TransactionalUnitOfWork;
import com.acme.store.repository.CheckpointRepository;
import com.acme.store.service.DlqService;
import com.acme.store.spi.MessageBus;
import com.acme.store.spi.TransactionalStore;
import com.acme.store.uow.UnitOfWork;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.time.Clock;

/**
 * Wires the commerce context onto the platform beans: repositories inside the unit of work, read
 * stores, projections and the worker draining the commerce projection queue.
 */
@Factory
public class CommerceFactory {

  /** Queue the commerce projections consume from. */
  public static final String PROJECTION_GROUP = "commerce";

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  /** Process-local bus, unless messaging.transport selects a broker. */
  @Singleton
  @Bean(preDestroy = "close")
  @Requires(property = "messaging.transport", value = "in-memory", defaultValue = "in-memory")
  public InMemoryMessageBus inMemoryMessageBus(MessagingConfig messagingConfig) {
    InMemoryMessageBus bus = new InMemoryMessageBus();
    bus.declareQueue(projectionQueue(messagingConfig));
    messagingConfig.getProjectionQueues().forEach(bus::declareQueue);
    return bus;
  }

  @Singleton
  public UnitOfWork unitOfWork(
      TransactionalStore store,
      TransactionOperations<Connection> transactionOps,
      EventPublisher publisher,
      Clock clock) {
    return TransactionalUnitOfWork.builder(store, publisher)
        .repository(
            ProductRepository.class,
            collector -> new JdbcProductRepository(transactionOps, collector, clock))
        .repository(
            OrderRepository.class,
            collector -> new JdbcOrderRepository(transactionOps, collector, clock))
        .build();
  }

  @Singleton
  public JdbcProductReadStore productReadStore(TransactionOperations<Connection> transactionOps) {
    return new JdbcProductReadStore(transactionOps);
  }

  @Singleton
  public JdbcOrderReadStore orderReadStore(TransactionOperations<Connection> transactionOps) {
    return new JdbcOrderReadStore(transactionOps);
  }

  @Singleton
  public ProductProjection productProjection(
      TransactionalStore store, CheckpointRepository checkpoints, JdbcProductReadStore views) {
    return new ProductProjection(store, checkpoints, views);
  }

  @Singleton
  public OrderProjection orderProjection(
      TransactionalStore store, CheckpointRepository checkpoints, JdbcOrderReadStore views) {
    return new OrderProjection(store, checkpoints, views);
  }

  @Context
  public CommerceModule commerceModule(
      UnitOfWork unitOfWork,
      JdbcProductReadStore productViews,
      JdbcOrderReadStore orderViews,
      ProductProjection productProjection,
      OrderProjection orderProjection,
      Clock clock,
      HandlerRegistry registry,
      ProjectionDispatcher dispatcher) {
    CommerceModule module =
        new CommerceModule(
            unitOfWork, productViews, orderViews, productProjection, orderProjection, clock);
    module.registerWith(registry, dispatcher);
    return module;
  }

  /** Started once the handlers and projections are registered; stopped on shutdown. */
  @Context
  @Bean(preDestroy = "stop")
  public ProjectionWorker commerceProjectionWorker(
      CommerceModule module,
      MessagingConfig messagingConfig,
      TimeoutConfig timeoutConfig,
      MessageBus bus,
      ProjectionDispatcher dispatcher,
      DlqService dlq,
      MeterRegistry meters) {
    ProjectionWorker worker =
        new ProjectionWorker(
            "commerce-projection-worker",
            projectionQueue(messagingConfig),
            bus,
            dispatcher,
            dlq,
            timeoutConfig,
            meters);
    worker.start();
    return worker;
  }

  static String projectionQueue(MessagingConfig messagingConfig) {
    return messagingConfig.getQueueNaming().buildProjectionQueue(PROJECTION_GROUP);
  }
}
