package com.acme.store.spi;

import com.acme.store.event.EventEnvelope;

/**
 * One delivery attempt of an envelope.
 *
 * @param attempt 1 for the first delivery, incremented on every redelivery
 */
public record Delivery(String queue, EventEnvelope envelope, int attempt) {}
