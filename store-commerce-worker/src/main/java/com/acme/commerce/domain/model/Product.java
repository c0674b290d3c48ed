package com.acme.commerce.domain.model;

import com.acme.commerce.domain.event.ProductCreatedEventV1;
import com.acme.commerce.domain.event.ProductDeletedEventV1;
import com.acme.commerce.domain.event.ProductUpdatedEventV1;
import com.acme.store.core.ValidationException;
import com.acme.store.domain.AggregateRoot;
import java.math.BigDecimal;
import java.time.Clock;
import lombok.Getter;

/** Aggregate root for a catalog product. */
@Getter
public class Product extends AggregateRoot {
  private String name;
  private String description;
  private BigDecimal price;
  private boolean deleted;

  /** Rehydrate a stored product. */
  public Product(
      String productId,
      long version,
      String name,
      String description,
      BigDecimal price,
      boolean deleted,
      Clock clock) {
    super(productId, version, clock);
    this.name = name;
    this.description = description;
    this.price = price;
    this.deleted = deleted;
  }

  public static Product create(
      String productId, String name, String description, BigDecimal price, Clock clock) {
    requireValid(name, price);
    Product product = new Product(productId, 0, null, null, null, false, clock);
    product.name = name;
    product.description = description;
    product.price = price;
    product.raise(
        ProductCreatedEventV1.TYPE,
        new ProductCreatedEventV1(productId, name, description, price, clock.instant()));
    return product;
  }

  public void update(String newName, String newDescription, BigDecimal newPrice) {
    ensureNotDeleted();
    requireValid(newName, newPrice);
    this.name = newName;
    this.description = newDescription;
    this.price = newPrice;
    raise(
        ProductUpdatedEventV1.TYPE,
        new ProductUpdatedEventV1(getId(), newName, newDescription, newPrice, getClock().instant()));
  }

  public void delete() {
    ensureNotDeleted();
    this.deleted = true;
    raise(ProductDeletedEventV1.TYPE, new ProductDeletedEventV1(getId()));
  }

  private void ensureNotDeleted() {
    if (deleted) {
      throw new ValidationException("Product " + getId() + " is deleted");
    }
  }

  private static void requireValid(String name, BigDecimal price) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Product name cannot be blank");
    }
    if (price == null || price.signum() <= 0) {
      throw new ValidationException("Product price must be positive");
    }
  }
}
