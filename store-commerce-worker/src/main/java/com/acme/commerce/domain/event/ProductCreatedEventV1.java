package com.acme.commerce.domain.event;

import java.math.BigDecimal;
import java.time.Instant;

public record ProductCreatedEventV1(
    String productId, String name, String description, BigDecimal price, Instant createdAt) {
  public static final String TYPE = "ProductCreatedEventV1";
}
