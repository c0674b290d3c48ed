package com.acme.commerce.application.query;

import com.acme.commerce.infrastructure.readmodel.JdbcProductReadStore;
import com.acme.commerce.infrastructure.readmodel.ProductReadModel;
import com.acme.store.core.RequestContext;
import com.acme.store.cqrs.RequestHandler;
import java.util.Optional;

/** Reads product_view; the result lags the write side until the projection catches up. */
public class GetProductByIdHandler
    implements RequestHandler<GetProductByIdQuery, Optional<ProductReadModel>> {
  private final JdbcProductReadStore views;

  public GetProductByIdHandler(JdbcProductReadStore views) {
    this.views = views;
  }

  @Override
  public Optional<ProductReadModel> handle(RequestContext ctx, GetProductByIdQuery query) {
    return views.findById(query.productId());
  }
}
