package com.acme.store.cqrs;

/** Intent to read state. Query handlers never mutate and never raise events. */
public interface Query<R> extends Request<R> {}
