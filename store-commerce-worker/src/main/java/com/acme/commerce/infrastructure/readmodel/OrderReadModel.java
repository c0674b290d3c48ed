package com.acme.commerce.infrastructure.readmodel;

import com.acme.commerce.domain.model.ShopItem;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Row of the order_view table, with its shop items already decoded. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OrderReadModel {
  private String orderId;
  private String accountEmail;
  private String deliveryAddress;
  private Instant deliveredTime;
  private List<ShopItem> shopItems;
  private int itemCount;
  private BigDecimal totalPrice;
  private Instant createdAt;
}
