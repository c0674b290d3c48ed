package com.acme.commerce.domain.event;

import com.acme.commerce.domain.model.ShopItem;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record OrderCreatedEventV1(
    String orderId,
    List<ShopItem> shopItems,
    String accountEmail,
    String deliveryAddress,
    Instant deliveredTime,
    BigDecimal totalPrice,
    Instant createdAt) {
  public static final String TYPE = "OrderCreatedEventV1";
}
