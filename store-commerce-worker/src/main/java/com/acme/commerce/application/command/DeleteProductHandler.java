package com.acme.commerce.application.command;

import com.acme.commerce.application.NotFoundException;
import com.acme.commerce.domain.model.Product;
import com.acme.commerce.domain.repository.ProductRepository;
import com.acme.store.core.RequestContext;
import com.acme.store.cqrs.RequestHandler;
import com.acme.store.uow.UnitOfWork;

public class DeleteProductHandler implements RequestHandler<DeleteProductCommand, Void> {
  private final UnitOfWork unitOfWork;

  public DeleteProductHandler(UnitOfWork unitOfWork) {
    this.unitOfWork = unitOfWork;
  }

  @Override
  public Void handle(RequestContext ctx, DeleteProductCommand command) {
    return unitOfWork.execute(
        ctx,
        scope -> {
          ProductRepository products = scope.repository(ProductRepository.class);
          Product product =
              products
                  .load(command.productId())
                  .orElseThrow(() -> new NotFoundException("Product", command.productId()));
          product.delete();
          products.save(product);
          return null;
        });
  }
}
