package com.acme.store.processor.uow;

import com.acme.store.core.PublishAfterCommitException;
import com.acme.store.core.RequestContext;
import com.acme.store.event.DomainEvent;
import com.acme.store.event.EventPublisher;
import com.acme.store.spi.TransactionalStore;
import com.acme.store.uow.EventCollector;
import com.acme.store.uow.RepositoryFactory;
import com.acme.store.uow.TransactionScope;
import com.acme.store.uow.UnitOfWork;
import com.acme.store.uow.UnitOfWorkAction;
import com.acme.store.uow.UnitOfWorkException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unit of work over a {@link TransactionalStore}. Events collected from saved aggregates are
 * handed to the {@link EventPublisher} only after the commit succeeded.
 */
public class TransactionalUnitOfWork implements UnitOfWork {
  private static final Logger LOG = LoggerFactory.getLogger(TransactionalUnitOfWork.class);

  private final TransactionalStore store;
  private final EventPublisher publisher;
  private final Map<Class<?>, RepositoryFactory<?>> factories;
  private final ThreadLocal<Boolean> active = new ThreadLocal<>();

  private TransactionalUnitOfWork(
      TransactionalStore store,
      EventPublisher publisher,
      Map<Class<?>, RepositoryFactory<?>> factories) {
    this.store = store;
    this.publisher = publisher;
    this.factories = Map.copyOf(factories);
  }

  public static Builder builder(TransactionalStore store, EventPublisher publisher) {
    return new Builder(store, publisher);
  }

  @Override
  public <T> T execute(RequestContext ctx, UnitOfWorkAction<T> action) {
    if (Boolean.TRUE.equals(active.get()) || store.hasActiveTransaction()) {
      throw new IllegalStateException(
          "Nested unit of work on thread " + Thread.currentThread().getName()
              + "; handlers must not dispatch commands from inside a transaction");
    }
    ctx.throwIfCancelled();

    T result;
    List<DomainEvent> events = new ArrayList<>();
    active.set(Boolean.TRUE);
    try {
      EventCollector collector = new EventCollector();
      result =
          store.executeWrite(
              () -> {
                T value = apply(action, new Scope(ctx, collector));
                ctx.throwIfCancelled();
                events.addAll(collector.events());
                publisher.stage(ctx, List.copyOf(events));
                return value;
              });
    } finally {
      active.remove();
    }

    LOG.debug("Committed unit of work {} with {} event(s)", ctx.correlationId(), events.size());
    if (!events.isEmpty()) {
      try {
        publisher.publish(ctx, List.copyOf(events));
      } catch (RuntimeException e) {
        DomainEvent first = events.get(0);
        LOG.warn(
            "Committed but failed to publish {} event(s), first aggregate={} position={}",
            events.size(),
            first.aggregateId(),
            first.streamPosition(),
            e);
        throw new PublishAfterCommitException(result, List.copyOf(events), e);
      }
    }
    return result;
  }

  private static <T> T apply(UnitOfWorkAction<T> action, TransactionScope scope) {
    try {
      return action.apply(scope);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new UnitOfWorkException("Unit of work failed: " + e.getMessage(), e);
    }
  }

  private final class Scope implements TransactionScope {
    private final RequestContext ctx;
    private final EventCollector collector;
    private final Map<Class<?>, Object> repositories = new HashMap<>();

    private Scope(RequestContext ctx, EventCollector collector) {
      this.ctx = ctx;
      this.collector = collector;
    }

    @Override
    public RequestContext context() {
      return ctx;
    }

    @Override
    public <R> R repository(Class<R> type) {
      Object repository =
          repositories.computeIfAbsent(
              type,
              t -> {
                RepositoryFactory<?> factory = factories.get(t);
                if (factory == null) {
                  throw new IllegalArgumentException(
                      "No repository registered for " + t.getName());
                }
                return factory.create(collector);
              });
      return type.cast(repository);
    }
  }

  public static final class Builder {
    private final TransactionalStore store;
    private final EventPublisher publisher;
    private final Map<Class<?>, RepositoryFactory<?>> factories = new LinkedHashMap<>();

    private Builder(TransactionalStore store, EventPublisher publisher) {
      this.store = store;
      this.publisher = publisher;
    }

    public <R> Builder repository(Class<R> type, RepositoryFactory<? extends R> factory) {
      if (factories.putIfAbsent(type, factory) != null) {
        throw new IllegalStateException("Repository already registered for " + type.getName());
      }
      return this;
    }

    public TransactionalUnitOfWork build() {
      return new TransactionalUnitOfWork(store, publisher, factories);
    }
  }
}
