package com.acme.commerce.domain.event;

public record ProductDeletedEventV1(String productId) {
  public static final String TYPE = "ProductDeletedEventV1";
}
