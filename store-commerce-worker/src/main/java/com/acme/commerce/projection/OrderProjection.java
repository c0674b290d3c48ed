package com.acme.commerce.projection;

import com.acme.commerce.domain.event.OrderCreatedEventV1;
import com.acme.commerce.domain.model.ShopItem;
import com.acme.commerce.infrastructure.readmodel.JdbcOrderReadStore;
import com.acme.commerce.infrastructure.readmodel.OrderReadModel;
import com.acme.store.event.EventEnvelope;
import com.acme.store.processor.projection.CheckpointedProjection;
import com.acme.store.repository.CheckpointRepository;
import com.acme.store.spi.TransactionalStore;

/** Builds order_view from OrderCreatedEventV1. */
public class OrderProjection extends CheckpointedProjection {
  public static final String NAME = "order-read-model";

  private final JdbcOrderReadStore views;

  public OrderProjection(
      TransactionalStore store, CheckpointRepository checkpoints, JdbcOrderReadStore views) {
    super(NAME, store, checkpoints);
    this.views = views;
    on(OrderCreatedEventV1.TYPE, OrderCreatedEventV1.class, this::onCreated);
  }

  private void onCreated(EventEnvelope envelope, OrderCreatedEventV1 event) {
    int itemCount = event.shopItems().stream().mapToInt(ShopItem::quantity).sum();
    views.insert(
        new OrderReadModel(
            event.orderId(),
            event.accountEmail(),
            event.deliveryAddress(),
            event.deliveredTime(),
            event.shopItems(),
            itemCount,
            event.totalPrice(),
            event.createdAt()));
  }
}
