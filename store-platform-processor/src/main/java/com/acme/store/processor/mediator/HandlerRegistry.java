package com.acme.store.processor.mediator;

import com.acme.store.cqrs.Notification;
import com.acme.store.cqrs.NotificationHandler;
import com.acme.store.cqrs.PipelineBehavior;
import com.acme.store.cqrs.Request;
import com.acme.store.cqrs.RequestHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry owned by the application root: one handler per request type, any number of
 * subscribers per notification type, and the ordered behavior chain.
 *
 * <p>Registration happens at startup. The first dispatch seals the registry, after which any
 * further registration fails. Pure POJO - no framework dependencies.
 */
public class HandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

  private final Map<Class<?>, RequestHandler<?, ?>> handlers = new ConcurrentHashMap<>();
  private final Map<Class<?>, List<NotificationHandler<?>>> subscribers =
      new ConcurrentHashMap<>();
  private final List<PipelineBehavior> behaviors = new CopyOnWriteArrayList<>();
  private volatile boolean sealed;

  /**
   * Register the handler for a request type.
   *
   * @throws IllegalStateException if a handler is already registered for this type, or the
   *     registry is sealed
   */
  public synchronized <Q extends Request<R>, R> void register(
      Class<Q> requestType, RequestHandler<Q, R> handler) {
    ensureOpen();
    if (handlers.containsKey(requestType)) {
      String error = "Handler already registered for request type: " + requestType.getName();
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registering handler for request type: {}", requestType.getSimpleName());
    handlers.put(requestType, handler);
  }

  /** Add a subscriber for a notification type. Subscribers accumulate. */
  public synchronized <N extends Notification> void subscribe(
      Class<N> notificationType, NotificationHandler<N> handler) {
    ensureOpen();
    subscribers.computeIfAbsent(notificationType, t -> new CopyOnWriteArrayList<>()).add(handler);
    log.info("Subscribed handler to notification type: {}", notificationType.getSimpleName());
  }

  /** Append a behavior; the first one added is the outermost. */
  public synchronized void addBehavior(PipelineBehavior behavior) {
    ensureOpen();
    behaviors.add(behavior);
    log.info("Added pipeline behavior: {}", behavior.getClass().getSimpleName());
  }

  @SuppressWarnings("unchecked")
  public <R> Optional<RequestHandler<Request<R>, R>> handlerFor(Class<?> requestType) {
    return Optional.ofNullable((RequestHandler<Request<R>, R>) handlers.get(requestType));
  }

  @SuppressWarnings("unchecked")
  public List<NotificationHandler<Notification>> subscribersFor(Class<?> notificationType) {
    List<NotificationHandler<?>> found = subscribers.getOrDefault(notificationType, List.of());
    List<NotificationHandler<Notification>> result = new ArrayList<>(found.size());
    for (NotificationHandler<?> handler : found) {
      result.add((NotificationHandler<Notification>) handler);
    }
    return result;
  }

  public List<PipelineBehavior> behaviors() {
    return List.copyOf(behaviors);
  }

  void seal() {
    if (!sealed) {
      sealed = true;
      log.debug("Handler registry sealed with {} request handler(s)", handlers.size());
    }
  }

  public boolean isSealed() {
    return sealed;
  }

  /** Clear all registrations and unseal. Intended for test isolation. */
  public synchronized void reset() {
    handlers.clear();
    subscribers.clear();
    behaviors.clear();
    sealed = false;
  }

  private void ensureOpen() {
    if (sealed) {
      throw new IllegalStateException("Handler registry is sealed; register before first dispatch");
    }
  }
}
