package com.acme.commerce.application.command;

import com.acme.commerce.domain.model.ShopItem;
import com.acme.store.cqrs.Command;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Place an order. Returns the order id.
 *
 * @param requestKey caller-chosen key copied onto the raised events, may be null
 */
public record CreateOrderCommand(
    String orderId,
    List<ShopItem> shopItems,
    String accountEmail,
    String deliveryAddress,
    Instant deliveredTime,
    String requestKey)
    implements Command<String> {

  @Override
  public Optional<String> idempotencyKey() {
    return Optional.ofNullable(requestKey);
  }

  @Override
  public List<String> validate() {
    List<String> violations = new ArrayList<>();
    if (orderId == null || orderId.isBlank()) {
      violations.add("orderId is required");
    }
    if (shopItems == null || shopItems.isEmpty()) {
      violations.add("at least one shop item is required");
    }
    if (accountEmail == null || accountEmail.isBlank()) {
      violations.add("accountEmail is required");
    }
    if (deliveryAddress == null || deliveryAddress.isBlank()) {
      violations.add("deliveryAddress is required");
    }
    return violations;
  }
}
