package com.acme.store.uow;

import com.acme.store.core.RequestContext;

/**
 * Runs an action atomically. Either the action's writes commit and its events are published
 * afterwards, or nothing is persisted and nothing is published.
 */
public interface UnitOfWork {

  /**
   * @throws IllegalStateException when called from inside another unit of work on this thread
   * @throws com.acme.store.core.RequestCancelledException if {@code ctx} is cancelled before
   *     commit
   * @throws com.acme.store.core.PublishAfterCommitException if the commit succeeded but the
   *     events could not be published
   */
  <T> T execute(RequestContext ctx, UnitOfWorkAction<T> action);
}
