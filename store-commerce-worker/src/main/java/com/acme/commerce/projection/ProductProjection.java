package com.acme.commerce.projection;

import com.acme.commerce.domain.event.ProductCreatedEventV1;
import com.acme.commerce.domain.event.ProductDeletedEventV1;
import com.acme.commerce.domain.event.ProductUpdatedEventV1;
import com.acme.commerce.infrastructure.readmodel.JdbcProductReadStore;
import com.acme.commerce.infrastructure.readmodel.ProductReadModel;
import com.acme.store.core.ProjectionException;
import com.acme.store.event.EventEnvelope;
import com.acme.store.processor.projection.CheckpointedProjection;
import com.acme.store.repository.CheckpointRepository;
import com.acme.store.spi.TransactionalStore;
import lombok.extern.slf4j.Slf4j;

/** Keeps product_view in step with the product event stream. */
@Slf4j
public class ProductProjection extends CheckpointedProjection {
  public static final String NAME = "product-read-model";

  private final JdbcProductReadStore views;

  public ProductProjection(
      TransactionalStore store, CheckpointRepository checkpoints, JdbcProductReadStore views) {
    super(NAME, store, checkpoints);
    this.views = views;
    on(ProductCreatedEventV1.TYPE, ProductCreatedEventV1.class, this::onCreated);
    on(ProductUpdatedEventV1.TYPE, ProductUpdatedEventV1.class, this::onUpdated);
    on(ProductDeletedEventV1.TYPE, ProductDeletedEventV1.class, this::onDeleted);
  }

  private void onCreated(EventEnvelope envelope, ProductCreatedEventV1 event) {
    views.insert(
        new ProductReadModel(
            event.productId(),
            event.name(),
            event.description(),
            event.price(),
            event.createdAt(),
            event.createdAt()));
    log.debug("Product view created: {}", event.productId());
  }

  private void onUpdated(EventEnvelope envelope, ProductUpdatedEventV1 event) {
    ProductReadModel view =
        views
            .findById(event.productId())
            .orElseThrow(
                () ->
                    new ProjectionException(
                        "No product view to update for " + event.productId(),
                        envelope.eventType(),
                        envelope.aggregateId(),
                        null));
    view.setName(event.name());
    view.setDescription(event.description());
    view.setPrice(event.price());
    view.setUpdatedAt(event.updatedAt());
    views.update(view);
  }

  private void onDeleted(EventEnvelope envelope, ProductDeletedEventV1 event) {
    views.delete(event.productId());
    log.debug("Product view removed: {}", event.productId());
  }
}
