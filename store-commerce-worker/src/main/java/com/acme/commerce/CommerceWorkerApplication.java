package com.acme.commerce;

import io.micronaut.runtime.Micronaut;

/**
 * Commerce worker. Runs the product and order command handlers and the projections that keep
 * their read models up to date.
 */
public class CommerceWorkerApplication {
  public static void main(String[] args) {
    Micronaut.run(CommerceWorkerApplication.class, args);
  }
}
