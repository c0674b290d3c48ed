package com.acme.store.cqrs;

import com.acme.store.core.RequestContext;

@FunctionalInterface
public interface RequestHandler<Q extends Request<R>, R> {
  R handle(RequestContext ctx, Q request);
}
