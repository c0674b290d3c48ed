package com.acme.store.cqrs;

/** Fire-and-forget in-process message with zero or more subscribers. */
public interface Notification {}
