package com.acme.commerce.application.command;

import com.acme.commerce.domain.model.Order;
import com.acme.commerce.domain.repository.OrderRepository;
import com.acme.store.core.RequestContext;
import com.acme.store.cqrs.RequestHandler;
import com.acme.store.uow.UnitOfWork;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CreateOrderHandler implements RequestHandler<CreateOrderCommand, String> {
  private final UnitOfWork unitOfWork;
  private final Clock clock;

  public CreateOrderHandler(UnitOfWork unitOfWork, Clock clock) {
    this.unitOfWork = unitOfWork;
    this.clock = clock;
  }

  @Override
  public String handle(RequestContext ctx, CreateOrderCommand command) {
    String orderId =
        unitOfWork.execute(
            ctx,
            scope -> {
              Order order =
                  Order.create(
                      command.orderId(),
                      command.shopItems(),
                      command.accountEmail(),
                      command.deliveryAddress(),
                      command.deliveredTime(),
                      clock);
              scope.repository(OrderRepository.class).save(order);
              return order.getId();
            });
    log.info("Order {} created with {} item line(s)", orderId, command.shopItems().size());
    return orderId;
  }
}
