package com.acme.store.uow;

import com.acme.store.domain.AggregateRoot;
import java.util.Optional;

/**
 * Write-side repository bound to one unit of work.
 *
 * @param <A> aggregate type
 */
public interface AggregateRepository<A extends AggregateRoot> {

  Optional<A> load(String id);

  /**
   * Persist {@code aggregate} and hand its pending events to the unit of work.
   *
   * @throws com.acme.store.core.ConflictException if the stored version moved since load
   */
  void save(A aggregate);
}
