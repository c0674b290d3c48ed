package com.acme.store.processor.mediator;

import com.acme.store.core.RequestContext;
import com.acme.store.cqrs.Command;
import com.acme.store.cqrs.Mediator;
import com.acme.store.cqrs.Notification;
import com.acme.store.cqrs.NotificationHandler;
import com.acme.store.cqrs.PipelineBehavior;
import com.acme.store.cqrs.Request;
import com.acme.store.cqrs.RequestHandler;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Mediator dispatching synchronously on the caller's thread through the registry's behaviors. */
public class DefaultMediator implements Mediator {
  private static final Logger log = LoggerFactory.getLogger(DefaultMediator.class);

  private final HandlerRegistry registry;

  public DefaultMediator(HandlerRegistry registry) {
    this.registry = registry;
  }

  @Override
  public <R> R send(RequestContext ctx, Request<R> request) {
    ctx.throwIfCancelled();
    registry.seal();

    RequestHandler<Request<R>, R> handler =
        registry
            .<R>handlerFor(request.getClass())
            .orElseThrow(
                () -> {
                  String error = "No handler registered for request type: " + request.type();
                  log.error(error);
                  return new IllegalStateException(error);
                });

    RequestContext effective = ctx;
    if (request instanceof Command) {
      effective =
          ((Command<?>) request).idempotencyKey().map(ctx::withIdempotencyKey).orElse(ctx);
    }

    RequestContext dispatchCtx = effective;
    PipelineBehavior.Next<R> next = () -> handler.handle(dispatchCtx, request);
    List<PipelineBehavior> behaviors = registry.behaviors();
    for (int i = behaviors.size() - 1; i >= 0; i--) {
      PipelineBehavior behavior = behaviors.get(i);
      PipelineBehavior.Next<R> inner = next;
      next = () -> behavior.handle(dispatchCtx, request, inner);
    }
    return next.proceed();
  }

  @Override
  public void publish(RequestContext ctx, Notification notification) {
    ctx.throwIfCancelled();
    registry.seal();
    List<NotificationHandler<Notification>> subscribers =
        registry.subscribersFor(notification.getClass());
    if (subscribers.isEmpty()) {
      log.debug("No subscribers for notification {}", notification.getClass().getSimpleName());
      return;
    }
    for (NotificationHandler<Notification> subscriber : subscribers) {
      try {
        subscriber.handle(ctx, notification);
      } catch (RuntimeException e) {
        log.error(
            "Subscriber {} failed on notification {}",
            subscriber.getClass().getSimpleName(),
            notification.getClass().getSimpleName(),
            e);
        throw e;
      }
    }
  }
}
