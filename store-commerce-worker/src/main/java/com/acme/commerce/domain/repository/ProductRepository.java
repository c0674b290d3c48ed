package com.acme.commerce.domain.repository;

import com.acme.commerce.domain.model.Product;
import com.acme.store.uow.AggregateRepository;

/** Write-side repository for products. */
public interface ProductRepository extends AggregateRepository<Product> {}
