package com.acme.commerce.config;

import com.acme.commerce.application.command.CreateOrderCommand;
import com.acme.commerce.application.command.CreateOrderHandler;
import com.acme.commerce.application.command.CreateProductCommand;
import com.acme.commerce.application.command.CreateProductHandler;
import com.acme.commerce.application.command.DeleteProductCommand;
import com.acme.commerce.application.command.DeleteProductHandler;
import com.acme.commerce.application.command.UpdateProductCommand;
import com.acme.commerce.application.command.UpdateProductHandler;
import com.acme.commerce.application.query.GetOrderByIdHandler;
import com.acme.commerce.application.query.GetOrderByIdQuery;
import com.acme.commerce.application.query.GetProductByIdHandler;
import com.acme.commerce.application.query.GetProductByIdQuery;
import com.acme.commerce.infrastructure.readmodel.JdbcOrderReadStore;
import com.acme.commerce.infrastructure.readmodel.JdbcProductReadStore;
import com.acme.commerce.projection.OrderProjection;
import com.acme.commerce.projection.ProductProjection;
import com.acme.store.processor.mediator.HandlerRegistry;
import com.acme.store.processor.projection.ProjectionDispatcher;
import com.acme.store.projection.Projection;
import com.acme.store.uow.UnitOfWork;
import java.time.Clock;
import java.util.List;

/**
 * Everything the commerce context contributes at startup: its command and query handlers and its
 * projections. {@link #registerWith} must run before the first dispatch seals the registry.
 */
public class CommerceModule {
  private final UnitOfWork unitOfWork;
  private final JdbcProductReadStore productViews;
  private final JdbcOrderReadStore orderViews;
  private final ProductProjection productProjection;
  private final OrderProjection orderProjection;
  private final Clock clock;

  public CommerceModule(
      UnitOfWork unitOfWork,
      JdbcProductReadStore productViews,
      JdbcOrderReadStore orderViews,
      ProductProjection productProjection,
      OrderProjection orderProjection,
      Clock clock) {
    this.unitOfWork = unitOfWork;
    this.productViews = productViews;
    this.orderViews = orderViews;
    this.productProjection = productProjection;
    this.orderProjection = orderProjection;
    this.clock = clock;
  }

  public void registerWith(HandlerRegistry registry, ProjectionDispatcher dispatcher) {
    registry.register(CreateProductCommand.class, new CreateProductHandler(unitOfWork, clock));
    registry.register(UpdateProductCommand.class, new UpdateProductHandler(unitOfWork));
    registry.register(DeleteProductCommand.class, new DeleteProductHandler(unitOfWork));
    registry.register(CreateOrderCommand.class, new CreateOrderHandler(unitOfWork, clock));
    registry.register(GetProductByIdQuery.class, new GetProductByIdHandler(productViews));
    registry.register(GetOrderByIdQuery.class, new GetOrderByIdHandler(orderViews));

    projections().forEach(dispatcher::register);
  }

  public List<Projection> projections() {
    return List.of(productProjection, orderProjection);
  }
}
