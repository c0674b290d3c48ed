package com.acme.commerce.infrastructure.readmodel;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Row of the product_view table. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ProductReadModel {
  private String productId;
  private String name;
  private String description;
  private BigDecimal price;
  private Instant createdAt;
  private Instant updatedAt;
}
