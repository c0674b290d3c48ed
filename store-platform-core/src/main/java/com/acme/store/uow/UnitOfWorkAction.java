package com.acme.store.uow;

@FunctionalInterface
public interface UnitOfWorkAction<T> {
  T apply(TransactionScope scope) throws Exception;
}
