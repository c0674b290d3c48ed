package com.acme.commerce.application.query;

import com.acme.commerce.infrastructure.readmodel.OrderReadModel;
import com.acme.store.cqrs.Query;
import java.util.List;
import java.util.Optional;

public record GetOrderByIdQuery(String orderId) implements Query<Optional<OrderReadModel>> {

  @Override
  public List<String> validate() {
    return orderId == null || orderId.isBlank() ? List.of("orderId is required") : List.of();
  }
}
