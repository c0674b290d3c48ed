package com.acme.commerce.infrastructure.persistence;

import static org.assertj.core.api.Assertions.*;

import com.acme.commerce.H2CommerceTestBase;
import com.acme.commerce.domain.event.ProductCreatedEventV1;
import com.acme.commerce.domain.event.ProductUpdatedEventV1;
import com.acme.commerce.domain.model.Product;
import com.acme.store.core.ConflictException;
import com.acme.store.event.DomainEvent;
import com.acme.store.uow.EventCollector;
import java.math.BigDecimal;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JdbcProductRepositoryTest extends H2CommerceTestBase {

  private final Clock clock = Clock.systemUTC();
  private EventCollector collector;
  private JdbcProductRepository repository;

  @BeforeEach
  void setUp() throws Exception {
    truncate("product");
    collector = new EventCollector();
    repository = new JdbcProductRepository(transactionOps, collector, clock);
  }

  @Test
  @DisplayName("a new product is inserted and its events handed to the collector")
  void testInsertAndLoad() {
    Product product = Product.create("p-1", "Lamp", "Desk lamp", new BigDecimal("19.90"), clock);

    repository.save(product);

    assertThat(collector.events())
        .extracting(DomainEvent::eventType)
        .containsExactly(ProductCreatedEventV1.TYPE);
    assertThat(product.getPendingEvents()).isEmpty();

    Product loaded = repository.load("p-1").orElseThrow();
    assertThat(loaded.getName()).isEqualTo("Lamp");
    assertThat(loaded.getDescription()).isEqualTo("Desk lamp");
    assertThat(loaded.getPrice()).isEqualByComparingTo("19.90");
    assertThat(loaded.getVersion()).isEqualTo(1);
    assertThat(loaded.isDeleted()).isFalse();
  }

  @Test
  @DisplayName("unknown product loads as empty")
  void testLoadMissing() {
    assertThat(repository.load("nope")).isEmpty();
  }

  @Test
  @DisplayName("an update moves the stored version forward")
  void testUpdate() {
    repository.save(Product.create("p-2", "Chair", null, new BigDecimal("80"), clock));

    Product loaded = repository.load("p-2").orElseThrow();
    loaded.update("Chair", "Walnut", new BigDecimal("95"));
    repository.save(loaded);

    Product reloaded = repository.load("p-2").orElseThrow();
    assertThat(reloaded.getVersion()).isEqualTo(2);
    assertThat(reloaded.getDescription()).isEqualTo("Walnut");
    assertThat(collector.events())
        .extracting(DomainEvent::eventType)
        .containsExactly(ProductCreatedEventV1.TYPE, ProductUpdatedEventV1.TYPE);
  }

  @Test
  @DisplayName("saving a stale copy fails with ConflictException and keeps the winner's write")
  void testStaleVersionConflicts() {
    repository.save(Product.create("p-3", "Desk", null, new BigDecimal("200"), clock));
    Product first = repository.load("p-3").orElseThrow();
    Product second = repository.load("p-3").orElseThrow();

    first.update("Desk", "Pine", new BigDecimal("210"));
    repository.save(first);

    second.update("Desk", "Teak", new BigDecimal("250"));
    assertThatThrownBy(() -> repository.save(second))
        .isInstanceOf(ConflictException.class)
        .hasMessageContaining("p-3");
    assertThat(repository.load("p-3").orElseThrow().getDescription()).isEqualTo("Pine");
  }

  @Test
  @DisplayName("creating the same product twice is a conflict")
  void testDuplicateInsert() {
    repository.save(Product.create("p-4", "Rug", null, BigDecimal.TEN, clock));

    Product duplicate = Product.create("p-4", "Rug", null, BigDecimal.TEN, clock);
    assertThatThrownBy(() -> repository.save(duplicate)).isInstanceOf(ConflictException.class);
  }

  @Test
  @DisplayName("writes join the caller's transaction")
  void testJoinsTransaction() {
    assertThatThrownBy(
            () ->
                transactions.executeWrite(
                    () -> {
                      repository.save(Product.create("p-5", "Shelf", null, BigDecimal.ONE, clock));
                      throw new IllegalStateException("abort");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(repository.load("p-5")).isEmpty();
  }
}
