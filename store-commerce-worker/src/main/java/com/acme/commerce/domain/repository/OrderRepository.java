package com.acme.commerce.domain.repository;

import com.acme.commerce.domain.model.Order;
import com.acme.store.uow.AggregateRepository;

/** Write-side repository for orders. */
public interface OrderRepository extends AggregateRepository<Order> {}
