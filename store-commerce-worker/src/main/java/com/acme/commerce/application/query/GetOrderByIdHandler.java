package com.acme.commerce.application.query;

import com.acme.commerce.infrastructure.readmodel.JdbcOrderReadStore;
import com.acme.commerce.infrastructure.readmodel.OrderReadModel;
import com.acme.store.core.RequestContext;
import com.acme.store.cqrs.RequestHandler;
import java.util.Optional;

public class GetOrderByIdHandler
    implements RequestHandler<GetOrderByIdQuery, Optional<OrderReadModel>> {
  private final JdbcOrderReadStore views;

  public GetOrderByIdHandler(JdbcOrderReadStore views) {
    this.views = views;
  }

  @Override
  public Optional<OrderReadModel> handle(RequestContext ctx, GetOrderByIdQuery query) {
    return views.findById(query.orderId());
  }
}
