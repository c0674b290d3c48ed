package com.acme.store.core;

/** Header names carried on every event envelope. */
public final class EnvelopeHeaders {
  public static final String CORRELATION_ID = "correlationId";
  public static final String IDEMPOTENCY_KEY = "idempotencyKey";
  public static final String REQUEST_TYPE = "requestType";

  private EnvelopeHeaders() {}
}
