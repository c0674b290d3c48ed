package com.acme.commerce.domain.model;

import com.acme.commerce.domain.event.OrderCreatedEventV1;
import com.acme.store.core.ValidationException;
import com.acme.store.domain.AggregateRoot;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.Getter;

/** Aggregate root for a customer order. Orders are created once and not edited afterwards. */
@Getter
public class Order extends AggregateRoot {
  private final List<ShopItem> shopItems;
  private final String accountEmail;
  private final String deliveryAddress;
  private final Instant deliveredTime;

  public Order(
      String orderId,
      long version,
      List<ShopItem> shopItems,
      String accountEmail,
      String deliveryAddress,
      Instant deliveredTime,
      Clock clock) {
    super(orderId, version, clock);
    this.shopItems = List.copyOf(shopItems);
    this.accountEmail = accountEmail;
    this.deliveryAddress = deliveryAddress;
    this.deliveredTime = deliveredTime;
  }

  public static Order create(
      String orderId,
      List<ShopItem> shopItems,
      String accountEmail,
      String deliveryAddress,
      Instant deliveredTime,
      Clock clock) {
    if (shopItems == null || shopItems.isEmpty()) {
      throw new ValidationException("Order must contain at least one shop item");
    }
    if (accountEmail == null || !accountEmail.contains("@")) {
      throw new ValidationException("Order account email is invalid");
    }
    Order order =
        new Order(orderId, 0, shopItems, accountEmail, deliveryAddress, deliveredTime, clock);
    order.raise(
        OrderCreatedEventV1.TYPE,
        new OrderCreatedEventV1(
            orderId,
            order.shopItems,
            accountEmail,
            deliveryAddress,
            deliveredTime,
            order.getTotalPrice(),
            clock.instant()));
    return order;
  }

  public BigDecimal getTotalPrice() {
    return shopItems.stream().map(ShopItem::lineTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
