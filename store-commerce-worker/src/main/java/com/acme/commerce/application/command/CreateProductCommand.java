package com.acme.commerce.application.command;

import com.acme.store.cqrs.Command;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Register a new catalog product. Returns the product id. */
public record CreateProductCommand(
    String productId, String name, String description, BigDecimal price)
    implements Command<String> {

  @Override
  public List<String> validate() {
    List<String> violations = new ArrayList<>();
    if (productId == null || productId.isBlank()) {
      violations.add("productId is required");
    }
    if (name == null || name.isBlank()) {
      violations.add("name is required");
    }
    if (price == null || price.signum() <= 0) {
      violations.add("price must be positive");
    }
    return violations;
  }
}
