package com.acme.store.core;

import java.util.List;

/** A request failed its preconditions before any handler or transaction ran. */
public class ValidationException extends RuntimeException {
  private final List<String> violations;

  public ValidationException(String message) {
    this(List.of(message));
  }

  public ValidationException(List<String> violations) {
    super(String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
