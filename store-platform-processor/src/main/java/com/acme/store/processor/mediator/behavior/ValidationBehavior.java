package com.acme.store.processor.mediator.behavior;

import com.acme.store.core.RequestContext;
import com.acme.store.core.ValidationException;
import com.acme.store.cqrs.PipelineBehavior;
import com.acme.store.cqrs.Request;
import java.util.List;

/** Rejects invalid requests before the handler, and any transaction, starts. */
public class ValidationBehavior implements PipelineBehavior {

  @Override
  public <R> R handle(RequestContext ctx, Request<R> request, Next<R> next) {
    List<String> violations = request.validate();
    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
    return next.proceed();
  }
}
