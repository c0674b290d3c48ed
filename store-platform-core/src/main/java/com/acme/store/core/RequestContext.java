package com.acme.store.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Carries cancellation, an optional deadline and the correlation id of one logical request.
 *
 * <p>Cancellation is cooperative: the mediator and the unit of work call {@link
 * #throwIfCancelled()} at their boundaries, they never interrupt a running handler.
 */
public final class RequestContext {

  private final String correlationId;
  private final String idempotencyKey;
  private final Instant deadline;
  private final Clock clock;
  private final AtomicBoolean cancelled;

  private RequestContext(
      String correlationId,
      String idempotencyKey,
      Instant deadline,
      Clock clock,
      AtomicBoolean cancelled) {
    this.correlationId = correlationId;
    this.idempotencyKey = idempotencyKey;
    this.deadline = deadline;
    this.clock = clock;
    this.cancelled = cancelled;
  }

  /** A fresh context with a random correlation id and no deadline. */
  public static RequestContext create() {
    return withCorrelationId(UUID.randomUUID().toString());
  }

  public static RequestContext withCorrelationId(String correlationId) {
    return new RequestContext(correlationId, null, null, Clock.systemUTC(), new AtomicBoolean());
  }

  /** Derived context sharing this one's cancellation flag, expiring after {@code timeout}. */
  public RequestContext withTimeout(Duration timeout) {
    return withDeadline(clock.instant().plus(timeout));
  }

  public RequestContext withDeadline(Instant newDeadline) {
    Instant effective =
        deadline != null && deadline.isBefore(newDeadline) ? deadline : newDeadline;
    return new RequestContext(correlationId, idempotencyKey, effective, clock, cancelled);
  }

  public RequestContext withClock(Clock newClock) {
    return new RequestContext(correlationId, idempotencyKey, deadline, newClock, cancelled);
  }

  /** Derived context tagging the events raised under it with {@code key}. */
  public RequestContext withIdempotencyKey(String key) {
    return new RequestContext(correlationId, key, deadline, clock, cancelled);
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get() || isExpired();
  }

  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new RequestCancelledException("Request " + correlationId + " was cancelled");
    }
    if (isExpired()) {
      throw new RequestCancelledException(
          "Request " + correlationId + " exceeded its deadline " + deadline);
    }
  }

  public String correlationId() {
    return correlationId;
  }

  public Optional<String> idempotencyKey() {
    return Optional.ofNullable(idempotencyKey);
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  private boolean isExpired() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }
}
