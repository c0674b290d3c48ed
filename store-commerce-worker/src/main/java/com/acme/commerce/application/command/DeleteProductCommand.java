package com.acme.commerce.application.command;

import com.acme.store.cqrs.Command;
import java.util.List;

public record DeleteProductCommand(String productId) implements Command<Void> {

  @Override
  public List<String> validate() {
    return productId == null || productId.isBlank() ? List.of("productId is required") : List.of();
  }
}
