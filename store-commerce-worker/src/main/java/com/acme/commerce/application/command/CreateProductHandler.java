package com.acme.commerce.application.command;

import com.acme.commerce.domain.model.Product;
import com.acme.commerce.domain.repository.ProductRepository;
import com.acme.store.core.RequestContext;
import com.acme.store.cqrs.RequestHandler;
import com.acme.store.uow.UnitOfWork;
import java.time.Clock;

public class CreateProductHandler implements RequestHandler<CreateProductCommand, String> {
  private final UnitOfWork unitOfWork;
  private final Clock clock;

  public CreateProductHandler(UnitOfWork unitOfWork, Clock clock) {
    this.unitOfWork = unitOfWork;
    this.clock = clock;
  }

  @Override
  public String handle(RequestContext ctx, CreateProductCommand command) {
    return unitOfWork.execute(
        ctx,
        scope -> {
          Product product =
              Product.create(
                  command.productId(),
                  command.name(),
                  command.description(),
                  command.price(),
                  clock);
          scope.repository(ProductRepository.class).save(product);
          return product.getId();
        });
  }
}
