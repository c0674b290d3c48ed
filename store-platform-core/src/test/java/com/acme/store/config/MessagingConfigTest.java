package com.acme.store.config;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for MessagingConfig and TimeoutConfig */
class MessagingConfigTest {

  @Test
  @DisplayName("should publish directly to the bus by default")
  void testDefaults() {
    MessagingConfig config = new MessagingConfig();

    assertThat(config.getPublishMode()).isEqualTo(MessagingConfig.PublishMode.DIRECT);
    assertThat(config.getEventTopic()).isEqualTo("store.events");
    assertThat(config.getProjectionQueues()).isEmpty();
  }

  @Test
  @DisplayName("should build upper-cased projection queue names")
  void testBuildProjectionQueue() {
    MessagingConfig.QueueNaming naming = new MessagingConfig.QueueNaming();

    assertThat(naming.buildProjectionQueue("order-read-model"))
        .isEqualTo("STORE.PROJ.ORDER-READ-MODEL.Q");

    naming.setProjectionPrefix("TEST.");
    naming.setQueueSuffix("");
    assertThat(naming.buildProjectionQueue("products")).isEqualTo("TEST.PRODUCTS");
  }

  @Test
  @DisplayName("should reject a delivery budget below one attempt")
  void testMaxDeliveryAttemptsValidated() {
    TimeoutConfig config = new TimeoutConfig();

    assertThat(config.getMaxDeliveryAttempts()).isEqualTo(5);
    assertThatThrownBy(() -> config.setMaxDeliveryAttempts(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
