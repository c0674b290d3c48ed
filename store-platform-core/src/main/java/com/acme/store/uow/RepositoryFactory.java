package com.acme.store.uow;

/** Creates the repository instance of one unit of work. */
@FunctionalInterface
public interface RepositoryFactory<R> {
  R create(EventCollector collector);
}
