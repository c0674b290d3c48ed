package com.acme.commerce.application.query;

import com.acme.commerce.infrastructure.readmodel.ProductReadModel;
import com.acme.store.cqrs.Query;
import java.util.List;
import java.util.Optional;

public record GetProductByIdQuery(String productId) implements Query<Optional<ProductReadModel>> {

  @Override
  public List<String> validate() {
    return productId == null || productId.isBlank() ? List.of("productId is required") : List.of();
  }
}
