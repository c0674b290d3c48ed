package com.acme.store.domain;

import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Envelope parked after exhausting its delivery attempts, kept for manual replay. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Dlq {

  private UUID id;
  private UUID messageId;
  private String queue;
  private String eventType;
  private String aggregateId;
  private long streamPosition;
  private String payload;
  private String headers;
  private String errorClass;
  private String errorMessage;
  private int attempts;
  private String parkedBy;
  private Instant parkedAt;
}
