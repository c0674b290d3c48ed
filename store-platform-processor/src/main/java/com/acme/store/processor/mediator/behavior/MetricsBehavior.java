package com.acme.store.processor.mediator.behavior;

import com.acme.store.core.RequestContext;
import com.acme.store.cqrs.PipelineBehavior;
import com.acme.store.cqrs.Request;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/** Times every request, tagged with the request type and outcome. */
public class MetricsBehavior implements PipelineBehavior {

  public static final String METRIC_NAME = "store.mediator.requests";

  private final MeterRegistry registry;

  public MetricsBehavior(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public <R> R handle(RequestContext ctx, Request<R> request, Next<R> next) {
    Timer.Sample sample = Timer.start(registry);
    String outcome = "success";
    try {
      return next.proceed();
    } catch (RuntimeException e) {
      outcome = e.getClass().getSimpleName();
      throw e;
    } finally {
      sample.stop(
          Timer.builder(METRIC_NAME)
              .description("Mediator request handling time")
              .tag("request", request.type())
              .tag("outcome", outcome)
              .register(registry));
    }
  }
}
