package com.acme.store.config;

import java.time.Duration;

/**
 * Retry, redelivery and outbox timing settings. Pure POJO - no framework dependencies.
 */
public class TimeoutConfig {

  private int maxDeliveryAttempts = 5;
  private Duration maxBackoff = Duration.ofMinutes(5);
  private Duration outboxSweepInterval = Duration.ofSeconds(1);
  private int outboxBatchSize = 500;
  private Duration outboxClaimTimeout = Duration.ofSeconds(30);
  private Duration workerShutdownTimeout = Duration.ofSeconds(30);

  public int getMaxDeliveryAttempts() {
    return maxDeliveryAttempts;
  }

  public void setMaxDeliveryAttempts(int maxDeliveryAttempts) {
    if (maxDeliveryAttempts < 1) {
      throw new IllegalArgumentException("maxDeliveryAttempts must be >= 1");
    }
    this.maxDeliveryAttempts = maxDeliveryAttempts;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public long getMaxBackoffMillis() {
    return maxBackoff.toMillis();
  }

  public Duration getOutboxSweepInterval() {
    return outboxSweepInterval;
  }

  public void setOutboxSweepInterval(Duration outboxSweepInterval) {
    this.outboxSweepInterval = outboxSweepInterval;
  }

  public int getOutboxBatchSize() {
    return outboxBatchSize;
  }

  public void setOutboxBatchSize(int outboxBatchSize) {
    this.outboxBatchSize = outboxBatchSize;
  }

  public Duration getOutboxClaimTimeout() {
    return outboxClaimTimeout;
  }

  public void setOutboxClaimTimeout(Duration outboxClaimTimeout) {
    this.outboxClaimTimeout = outboxClaimTimeout;
  }

  public Duration getWorkerShutdownTimeout() {
    return workerShutdownTimeout;
  }

  public void setWorkerShutdownTimeout(Duration workerShutdownTimeout) {
    this.workerShutdownTimeout = workerShutdownTimeout;
  }
}
