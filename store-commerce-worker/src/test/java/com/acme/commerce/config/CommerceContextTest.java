package com.acme.commerce.config;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

import com.acme.commerce.application.command.CreateProductCommand;
import com.acme.commerce.application.query.GetProductByIdQuery;
import com.acme.store.config.MessagingConfig;
import com.acme.store.config.TimeoutConfig;
import com.acme.store.core.RequestContext;
import com.acme.store.cqrs.Mediator;
import com.acme.store.event.EventPublisher;
import com.acme.store.processor.bus.InMemoryMessageBus;
import com.acme.store.processor.consumer.ProjectionWorker;
import com.acme.store.processor.publish.BusEventPublisher;
import com.acme.store.spi.MessageBus;
import io.micronaut.context.ApplicationContext;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Boots the worker's bean graph against a private H2 database. */
class CommerceContextTest {

  private ApplicationContext context;

  @BeforeEach
  void startContext() {
    context =
        ApplicationContext.run(
            Map.of(
                "datasource.url",
                "jdbc:h2:mem:CommerceContextTest;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE",
                "db.dialect", "H2",
                "messaging.transport", "in-memory",
                "timeout.max-delivery-attempts", "2"));
  }

  @AfterEach
  void stopContext() {
    if (context != null) {
      context.close();
    }
  }

  @Test
  @DisplayName("configuration is bound and the in-memory bus is selected")
  void testWiring() {
    assertThat(context.getBean(TimeoutConfig.class).getMaxDeliveryAttempts()).isEqualTo(2);
    assertThat(context.getBean(MessagingConfig.class).getPublishMode())
        .isEqualTo(MessagingConfig.PublishMode.DIRECT);
    assertThat(context.getBean(MessageBus.class)).isInstanceOf(InMemoryMessageBus.class);
    assertThat(context.getBean(EventPublisher.class)).isInstanceOf(BusEventPublisher.class);
    assertThat(context.getBean(ProjectionWorker.class).isRunning()).isTrue();
    assertThat(context.getBean(ProjectionWorker.class).getQueue())
        .isEqualTo("STORE.PROJ.COMMERCE.Q");
  }

  @Test
  @DisplayName("a command sent through the mediator reaches the product read model")
  void testCommandToReadModel() {
    Mediator mediator = context.getBean(Mediator.class);

    mediator.send(
        RequestContext.create(),
        new CreateProductCommand("ctx-1", "Lamp", "Desk lamp", new BigDecimal("19.90")));

    await()
        .atMost(Duration.ofSeconds(10))
        .until(
            () ->
                mediator
                    .send(RequestContext.create(), new GetProductByIdQuery("ctx-1"))
                    .isPresent());
  }
}
