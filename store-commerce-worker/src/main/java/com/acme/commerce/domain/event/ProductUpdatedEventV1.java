package com.acme.commerce.domain.event;

import java.math.BigDecimal;
import java.time.Instant;

public record ProductUpdatedEventV1(
    String productId, String name, String description, BigDecimal price, Instant updatedAt) {
  public static final String TYPE = "ProductUpdatedEventV1";
}
