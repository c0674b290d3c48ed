package com.acme.store.spi;

/** Receives deliveries from a subscription. The handler must ack or nack each one. */
@FunctionalInterface
public interface DeliveryHandler {
  void onDelivery(Delivery delivery);
}
