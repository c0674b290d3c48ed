package com.acme.store.processor.bus;

import com.acme.store.core.TransientException;
import com.acme.store.event.EventEnvelope;
import com.acme.store.spi.Delivery;
import com.acme.store.spi.DeliveryHandler;
import com.acme.store.spi.MessageBus;
import com.acme.store.spi.Subscription;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link MessageBus}. Every published envelope is copied to each declared queue.
 * Each queue has one dispatch thread and at most one delivery in flight; a requeued delivery goes
 * back to the head of its queue, so per-queue order is kept across retries. Subscribers of the
 * same queue take turns.
 */
public class InMemoryMessageBus implements MessageBus, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryMessageBus.class);

  private final Map<String, QueueState> queues = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /** Bind {@code queue} to the bus; envelopes published from now on are copied to it. */
  public void declareQueue(String queue) {
    queues.computeIfAbsent(queue, QueueState::new);
  }

  @Override
  public void publish(EventEnvelope envelope) {
    if (closed) {
      throw new TransientException("Message bus is closed");
    }
    queues.values().forEach(q -> q.enqueue(envelope));
  }

  @Override
  public Subscription subscribe(String queue, DeliveryHandler handler) {
    if (closed) {
      throw new IllegalStateException("Message bus is closed");
    }
    return queues.computeIfAbsent(queue, QueueState::new).addSubscriber(handler);
  }

  @Override
  public void ack(String queue, UUID messageId) {
    state(queue).settle(messageId, false);
  }

  @Override
  public void nack(String queue, UUID messageId, boolean requeue) {
    state(queue).settle(messageId, requeue);
  }

  /** Messages waiting or in flight on {@code queue}. */
  public int depth(String queue) {
    QueueState state = queues.get(queue);
    return state == null ? 0 : state.depth();
  }

  @Override
  public void close() {
    closed = true;
    queues.values().forEach(QueueState::shutdown);
  }

  private QueueState state(String queue) {
    QueueState state = queues.get(queue);
    if (state == null) {
      throw new IllegalArgumentException("Unknown queue " + queue);
    }
    return state;
  }

  private record Pending(EventEnvelope envelope, int attempt) {}

  private static final class QueueState implements Runnable {
    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<Pending> ready = new ArrayDeque<>();
    private final List<QueueSubscription> subscribers = new ArrayList<>();
    private final Thread dispatcher;
    private Pending inFlight;
    private int nextSubscriber;
    private boolean shutdown;

    private QueueState(String name) {
      this.name = name;
      this.dispatcher = new Thread(this, "inmemory-bus-" + name);
      this.dispatcher.setDaemon(true);
      this.dispatcher.start();
    }

    void enqueue(EventEnvelope envelope) {
      lock.lock();
      try {
        ready.addLast(new Pending(envelope, 1));
        changed.signalAll();
      } finally {
        lock.unlock();
      }
    }

    Subscription addSubscriber(DeliveryHandler handler) {
      lock.lock();
      try {
        QueueSubscription subscription = new QueueSubscription(this, handler);
        subscribers.add(subscription);
        changed.signalAll();
        return subscription;
      } finally {
        lock.unlock();
      }
    }

    void settle(UUID messageId, boolean requeue) {
      lock.lock();
      try {
        if (inFlight == null || !inFlight.envelope().messageId().equals(messageId)) {
          throw new IllegalStateException(
              "Message " + messageId + " is not in flight on queue " + name);
        }
        if (requeue) {
          ready.addFirst(new Pending(inFlight.envelope(), inFlight.attempt() + 1));
        }
        inFlight = null;
        changed.signalAll();
      } finally {
        lock.unlock();
      }
    }

    int depth() {
      lock.lock();
      try {
        return ready.size() + (inFlight == null ? 0 : 1);
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void run() {
      while (true) {
        Pending pending;
        QueueSubscription target;
        lock.lock();
        try {
          while (!shutdown && (ready.isEmpty() || inFlight != null || !hasActiveSubscriber())) {
            changed.await();
          }
          if (shutdown) {
            return;
          }
          pending = ready.pollFirst();
          inFlight = pending;
          target = nextActiveSubscriber();
          target.busy = true;
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        } finally {
          lock.unlock();
        }
        deliver(pending, target);
      }
    }

    private void deliver(Pending pending, QueueSubscription target) {
      UUID messageId = pending.envelope().messageId();
      try {
        target.handler.onDelivery(new Delivery(name, pending.envelope(), pending.attempt()));
      } catch (RuntimeException e) {
        LOG.error("Subscriber on {} failed on messageId={}", name, messageId, e);
      } finally {
        lock.lock();
        try {
          target.busy = false;
          if (inFlight == pending) {
            LOG.warn("messageId={} on {} was not settled; requeueing", messageId, name);
            ready.addFirst(new Pending(pending.envelope(), pending.attempt() + 1));
            inFlight = null;
          }
          changed.signalAll();
        } finally {
          lock.unlock();
        }
      }
    }

    private boolean hasActiveSubscriber() {
      return subscribers.stream().anyMatch(s -> s.active);
    }

    private QueueSubscription nextActiveSubscriber() {
      for (int i = 0; i < subscribers.size(); i++) {
        QueueSubscription candidate = subscribers.get((nextSubscriber + i) % subscribers.size());
        if (candidate.active) {
          nextSubscriber = (nextSubscriber + i + 1) % subscribers.size();
          return candidate;
        }
      }
      throw new IllegalStateException("No active subscriber on " + name);
    }

    void cancel(QueueSubscription subscription) {
      lock.lock();
      try {
        subscription.active = false;
        subscribers.remove(subscription);
        changed.signalAll();
        if (Thread.currentThread() == dispatcher) {
          return;
        }
        while (subscription.busy) {
          changed.awaitUninterruptibly();
        }
      } finally {
        lock.unlock();
      }
    }

    void shutdown() {
      lock.lock();
      try {
        shutdown = true;
        changed.signalAll();
      } finally {
        lock.unlock();
      }
    }
  }

  private static final class QueueSubscription implements Subscription {
    private final QueueState queue;
    private final DeliveryHandler handler;
    private volatile boolean active = true;
    private boolean busy;

    private QueueSubscription(QueueState queue, DeliveryHandler handler) {
      this.queue = queue;
      this.handler = handler;
    }

    @Override
    public void cancel() {
      queue.cancel(this);
    }

    @Override
    public boolean isActive() {
      return active;
    }
  }
}
