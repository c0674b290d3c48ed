package com.acme.store.processor.mediator.behavior;

import com.acme.store.core.EnvelopeHeaders;
import com.acme.store.core.RequestContext;
import com.acme.store.core.ValidationException;
import com.acme.store.cqrs.PipelineBehavior;
import com.acme.store.cqrs.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Logs every request with its duration and puts request type and correlation id in the MDC. */
public class LoggingBehavior implements PipelineBehavior {
  private static final Logger log = LoggerFactory.getLogger(LoggingBehavior.class);

  @Override
  public <R> R handle(RequestContext ctx, Request<R> request, Next<R> next) {
    String previousType = MDC.get(EnvelopeHeaders.REQUEST_TYPE);
    String previousCorrelation = MDC.get(EnvelopeHeaders.CORRELATION_ID);
    MDC.put(EnvelopeHeaders.REQUEST_TYPE, request.type());
    MDC.put(EnvelopeHeaders.CORRELATION_ID, ctx.correlationId());
    long start = System.nanoTime();
    try {
      log.debug("Handling {}", request.type());
      R result = next.proceed();
      log.info("Handled {} in {} ms", request.type(), elapsedMillis(start));
      return result;
    } catch (ValidationException e) {
      log.info("Rejected {}: {}", request.type(), e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      log.warn(
          "Failed {} after {} ms: {}", request.type(), elapsedMillis(start), e.toString());
      throw e;
    } finally {
      restore(EnvelopeHeaders.REQUEST_TYPE, previousType);
      restore(EnvelopeHeaders.CORRELATION_ID, previousCorrelation);
    }
  }

  private static long elapsedMillis(long start) {
    return (System.nanoTime() - start) / 1_000_000;
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
