package com.acme.store.repository;

import com.acme.store.domain.Dlq;
import java.util.List;

/** Dead-letter store for envelopes that exhausted their delivery attempts. */
public interface DlqRepository {

  void insert(Dlq entry);

  List<Dlq> findByQueue(String queue);
}
