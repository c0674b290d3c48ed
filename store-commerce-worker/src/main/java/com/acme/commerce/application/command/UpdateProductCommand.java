package com.acme.commerce.application.command;

import com.acme.store.cqrs.Command;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Change a product's name, description and price. Returns the product's new version.
 *
 * @param expectedVersion version the caller last saw, or null to skip the check
 */
public record UpdateProductCommand(
    String productId, String name, String description, BigDecimal price, Long expectedVersion)
    implements Command<Long> {

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
