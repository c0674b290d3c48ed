package com.acme.commerce.domain.model;

import java.math.BigDecimal;

/** One line of an order. */
public record ShopItem(String title, String description, int quantity, BigDecimal price) {

  public ShopItem {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("Shop item title cannot be blank");
    }
    if (quantity < 1) {
      throw new IllegalArgumentException("Shop item quantity must be positive");
    }
    if (price == null || price.signum() < 0) {
      throw new IllegalArgumentException("Shop item price cannot be negative");
    }
  }

  public BigDecimal lineTotal() {
    return price.multiply(BigDecimal.valueOf(quantity));
  }
}
