package com.acme.store.cqrs;

import com.acme.store.core.RequestContext;

@FunctionalInterface
public interface NotificationHandler<N extends Notification> {
  void handle(RequestContext ctx, N notification);
}
