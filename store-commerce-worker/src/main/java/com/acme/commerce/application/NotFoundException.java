package com.acme.commerce.application;

/** The aggregate a command targets does not exist. */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String aggregateType, String id) {
    super(aggregateType + " " + id + " not found");
  }
}
