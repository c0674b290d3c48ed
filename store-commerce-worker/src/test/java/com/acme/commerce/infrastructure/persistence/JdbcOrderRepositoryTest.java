package com.acme.commerce.infrastructure.persistence;

import static org.assertj.core.api.Assertions.*;

import com.acme.commerce.H2CommerceTestBase;
import com.acme.commerce.domain.model.Order;
import com.acme.commerce.domain.model.ShopItem;
import com.acme.store.core.ConflictException;
import com.acme.store.uow.EventCollector;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JdbcOrderRepositoryTest extends H2CommerceTestBase {

  private final Clock clock = Clock.systemUTC();
  private EventCollector collector;
  private JdbcOrderRepository repository;

  @BeforeEach
  void setUp() throws Exception {
    truncate("customer_order");
    collector = new EventCollector();
    repository = new JdbcOrderRepository(transactionOps, collector, clock);
  }

  @Test
  @DisplayName("shop items survive the JSON column")
  void testRoundTrip() {
    List<ShopItem> items =
        List.of(
            new ShopItem("Lamp", "Desk lamp", 2, new BigDecimal("19.90")),
            new ShopItem("Chair", null, 1, new BigDecimal("80.00")));
    Instant delivery = Instant.parse("2026-03-05T12:00:00Z");

    repository.save(Order.create("o-1", items, "a@b.com", "1 Main St", delivery, clock));

    Order loaded = repository.load("o-1").orElseThrow();
    assertThat(loaded.getShopItems()).containsExactlyElementsOf(items);
    assertThat(loaded.getAccountEmail()).isEqualTo("a@b.com");
    assertThat(loaded.getDeliveryAddress()).isEqualTo("1 Main St");
    assertThat(loaded.getDeliveredTime()).isEqualTo(delivery);
    assertThat(loaded.getVersion()).isEqualTo(1);
    assertThat(collector.events()).hasSize(1);
  }

  @Test
  @DisplayName("an order id can only be used once")
  void testDuplicateOrder() {
    List<ShopItem> items = List.of(new ShopItem("Lamp", null, 1, BigDecimal.TEN));
    repository.save(Order.create("o-2", items, "a@b.com", "addr", null, clock));

    Order again = Order.create("o-2", items, "c@d.com", "addr", null, clock);
    assertThatThrownBy(() -> repository.save(again)).isInstanceOf(ConflictException.class);
    assertThat(repository.load("o-2").orElseThrow().getAccountEmail()).isEqualTo("a@b.com");
  }
}
