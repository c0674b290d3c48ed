package com.acme.commerce.application.command;

import com.acme.commerce.application.NotFoundException;
import com.acme.commerce.domain.model.Product;
import com.acme.commerce.domain.repository.ProductRepository;
import com.acme.store.core.ConflictException;
import com.acme.store.core.RequestContext;
import com.acme.store.cqrs.RequestHandler;
import com.acme.store.uow.UnitOfWork;

public class UpdateProductHandler implements RequestHandler<UpdateProductCommand, Long> {
  private final UnitOfWork unitOfWork;

  public UpdateProductHandler(UnitOfWork unitOfWork) {
    this.unitOfWork = unitOfWork;
  }

  @Override
  public Long handle(RequestContext ctx, UpdateProductCommand command) {
    return unitOfWork.execute(
        ctx,
        scope -> {
          ProductRepository products = scope.repository(ProductRepository.class);
          Product product =
              products
                  .load(command.productId())
                  .orElseThrow(() -> new NotFoundException("Product", command.productId()));
          if (command.expectedVersion() != null
              && command.expectedVersion() != product.getVersion()) {
            throw new ConflictException(
                "Product " + product.getId() + " is at version " + product.getVersion()
                    + ", expected " + command.expectedVersion());
          }
          product.update(command.name(), command.description(), command.price());
          products.save(product);
          return product.getVersion();
        });
  }
}
