package com.acme.store.processor.bus;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

import com.acme.store.core.TransientException;
import com.acme.store.event.EventEnvelope;
import com.acme.store.spi.Delivery;
import com.acme.store.spi.Subscription;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryMessageBus Tests")
class InMemoryMessageBusTest {

  private static final String QUEUE = "STORE.PROJ.TEST.Q";

  private InMemoryMessageBus bus;

  @BeforeEach
  void setup() {
    bus = new InMemoryMessageBus();
    bus.declareQueue(QUEUE);
  }

  @AfterEach
  void tearDown() {
    bus.close();
  }

  private static EventEnvelope envelope(String aggregateId, long position) {
    return new EventEnvelope(
        UUID.randomUUID(),
        "ProductCreatedEventV1",
        aggregateId,
        position,
        Instant.parse("2024-05-01T12:00:00Z"),
        "{}",
        Map.of());
  }

  @Test
  @DisplayName("should deliver in publish order and drain once acked")
  void testOrderedDelivery() {
    List<Long> seen = new CopyOnWriteArrayList<>();
    bus.subscribe(
        QUEUE,
        d -> {
          seen.add(d.envelope().streamPosition());
          bus.ack(QUEUE, d.envelope().messageId());
        });

    for (long i = 1; i <= 5; i++) {
      bus.publish(envelope("p-1", i));
    }

    await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 5);
    assertThat(seen).containsExactly(1L, 2L, 3L, 4L, 5L);
    await().atMost(Duration.ofSeconds(5)).until(() -> bus.depth(QUEUE) == 0);
  }

  @Test
  @DisplayName("should copy each envelope to every declared queue")
  void testFanOut() {
    bus.declareQueue("OTHER.Q");
    List<String> seen = new CopyOnWriteArrayList<>();
    bus.subscribe(
        QUEUE,
        d -> {
          seen.add(d.queue());
          bus.ack(QUEUE, d.envelope().messageId());
        });
    bus.subscribe(
        "OTHER.Q",
        d -> {
          seen.add(d.queue());
          bus.ack("OTHER.Q", d.envelope().messageId());
        });

    bus.publish(envelope("p-1", 1));

    await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 2);
    assertThat(seen).containsExactlyInAnyOrder(QUEUE, "OTHER.Q");
  }

  @Test
  @DisplayName("should redeliver a requeued message before later ones with a higher attempt")
  void testRequeueAtHead() {
    List<String> seen = new CopyOnWriteArrayList<>();
    EventEnvelope first = envelope("p-1", 1);
    EventEnvelope second = envelope("p-1", 2);
    bus.subscribe(
        QUEUE,
        d -> {
          seen.add(d.envelope().streamPosition() + "#" + d.attempt());
          boolean failFirstTime = d.envelope().streamPosition() == 1 && d.attempt() == 1;
          if (failFirstTime) {
            bus.nack(QUEUE, d.envelope().messageId(), true);
          } else {
            bus.ack(QUEUE, d.envelope().messageId());
          }
        });

    bus.publish(first);
    bus.publish(second);

    await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 3);
    assertThat(seen).containsExactly("1#1", "1#2", "2#1");
  }

  @Test
  @DisplayName("should drop a message nacked without requeue")
  void testNackWithoutRequeue() {
    List<Delivery> seen = new CopyOnWriteArrayList<>();
    bus.subscribe(
        QUEUE,
        d -> {
          seen.add(d);
          bus.nack(QUEUE, d.envelope().messageId(), false);
        });

    bus.publish(envelope("p-1", 1));

    await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 1);
    await().atMost(Duration.ofSeconds(5)).until(() -> bus.depth(QUEUE) == 0);
    assertThat(seen).hasSize(1);
  }

  @Test
  @DisplayName("should requeue a delivery the handler left unsettled")
  void testUnsettledRequeued() {
    List<Integer> attempts = new CopyOnWriteArrayList<>();
    bus.subscribe(
        QUEUE,
        d -> {
          attempts.add(d.attempt());
          if (d.attempt() >= 2) {
            bus.ack(QUEUE, d.envelope().messageId());
          }
        });

    bus.publish(envelope("p-1", 1));

    await().atMost(Duration.ofSeconds(5)).until(() -> attempts.size() == 2);
    assertThat(attempts).containsExactly(1, 2);
  }

  @Test
  @DisplayName("should reject settling a message that is not in flight")
  void testSettleUnknown() {
    assertThatThrownBy(() -> bus.ack(QUEUE, UUID.randomUUID()))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> bus.ack("NOPE.Q", UUID.randomUUID()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("cancel should wait for the in-flight delivery and stop further deliveries")
  void testCancelStopsDelivery() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    List<Long> seen = new CopyOnWriteArrayList<>();
    Subscription subscription =
        bus.subscribe(
            QUEUE,
            d -> {
              entered.countDown();
              try {
                release.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              seen.add(d.envelope().streamPosition());
              bus.ack(QUEUE, d.envelope().messageId());
            });
    bus.publish(envelope("p-1", 1));
    bus.publish(envelope("p-1", 2));
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    Thread releaser =
        new Thread(
            () -> {
              sleepQuietly(200);
              release.countDown();
            });
    releaser.start();
    subscription.cancel();

    assertThat(subscription.isActive()).isFalse();
    assertThat(seen).containsExactly(1L);
    sleepQuietly(300);
    assertThat(seen).containsExactly(1L);
    assertThat(bus.depth(QUEUE)).isEqualTo(1);
  }

  @Test
  @DisplayName("should refuse publishing after close")
  void testClosed() {
    bus.close();

    assertThatThrownBy(() -> bus.publish(envelope("p-1", 1)))
        .isInstanceOf(TransientException.class);
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
