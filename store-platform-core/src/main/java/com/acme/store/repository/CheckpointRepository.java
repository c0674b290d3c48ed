package com.acme.store.repository;

import java.util.OptionalLong;

/**
 * Per-projection, per-aggregate record of the last applied stream position. Reads and writes
 * join the caller's transaction so a checkpoint moves together with the read model it guards.
 */
public interface CheckpointRepository {

  OptionalLong findPosition(String projection, String aggregateId);

  /**
   * Move the checkpoint forward to {@code position}.
   *
   * @return false when the stored position is already at or past {@code position}
   */
  boolean advance(String projection, String aggregateId, long position);
}
