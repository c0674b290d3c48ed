package com.acme.store.processor.projection;

import static org.assertj.core.api.Assertions.*;

import com.acme.store.core.Jsons;
import com.acme.store.core.ProjectionException;
import com.acme.store.event.EventEnvelope;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AbstractProjection Tests")
class AbstractProjectionTest {

  record Renamed(String name) {}

  static final class NameProjection extends AbstractProjection {
    final List<String> names = new ArrayList<>();

    NameProjection() {
      super("names");
      on("Renamed", Renamed.class, (envelope, payload) -> names.add(payload.name()));
    }

    void bindTwice() {
      on("Renamed", Renamed.class, (envelope, payload) -> {});
    }
  }

  static EventEnvelope envelope(String type, String payload) {
    return new EventEnvelope(
        UUID.randomUUID(), type, "agg-1", 1, Instant.EPOCH, payload, Map.of());
  }

  @Test
  @DisplayName("should decode the payload into the bound type and apply it")
  void testApplyBound() {
    NameProjection projection = new NameProjection();

    projection.processEvent(envelope("Renamed", Jsons.toJson(new Renamed("Lamp"))));

    assertThat(projection.names).containsExactly("Lamp");
    assertThat(projection.eventTypes()).containsExactly("Renamed");
    assertThat(projection.name()).isEqualTo("names");
  }

  @Test
  @DisplayName("should ignore event types it has no binding for")
  void testUnknownTypeIgnored() {
    NameProjection projection = new NameProjection();

    projection.processEvent(envelope("Deleted", "{}"));

    assertThat(projection.names).isEmpty();
  }

  @Test
  @DisplayName("should raise a projection error for a payload that cannot be decoded")
  void testMalformedPayload() {
    NameProjection projection = new NameProjection();

    assertThatThrownBy(() -> projection.processEvent(envelope("Renamed", "{not json")))
        .isInstanceOfSatisfying(
            ProjectionException.class,
            e -> {
              assertThat(e.getEventType()).isEqualTo("Renamed");
              assertThat(e.getAggregateId()).isEqualTo("agg-1");
            });
    assertThat(projection.names).isEmpty();
  }

  @Test
  @DisplayName("should reject two bindings for one event type")
  void testDuplicateBinding() {
    NameProjection projection = new NameProjection();

    assertThatThrownBy(projection::bindTwice).isInstanceOf(IllegalStateException.class);
  }
}
