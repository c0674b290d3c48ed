package com.acme.store.persistence.jdbc;

import com.acme.store.core.ConflictException;
import com.acme.store.core.PermanentException;
import com.acme.store.core.TransientException;
import java.sql.SQLException;
import java.util.Locale;
import org.slf4j.Logger;

/**
 * Utility class for translating SQLException to store exceptions. Decides whether a failure is a
 * conflict (unique key clash), transient (retryable) or permanent.
 */
public final class ExceptionTranslator {

  private static final String UNIQUE_VIOLATION = "23505";

  private ExceptionTranslator() {
    // Utility class - no instantiation
  }

  /**
   * Translates a SQLException to ConflictException, TransientException or PermanentException.
   *
   * @param originalException The SQLException that occurred
   * @param operation Description of the operation that failed
   * @param logger Logger for error reporting
   * @return the runtime exception to throw
   */
  public static RuntimeException translateException(
      SQLException originalException, String operation, Logger logger) {

    if (isUniqueViolation(originalException)) {
      logger.warn("Unique constraint violated during {}: {}", operation,
          originalException.getMessage());
      return new ConflictException(
          String.format("Conflict during %s: %s", operation, originalException.getMessage()),
          originalException);
    }

    logger.error("Database operation failed: {}", operation, originalException);

    if (isTransientError(originalException)) {
      return new TransientException(
          String.format(
              "Transient database error during %s: %s", operation,
              originalException.getMessage()),
          originalException);
    }

    if (isPermanentError(originalException)) {
      return new PermanentException(
          String.format(
              "Permanent database error during %s: %s", operation,
              originalException.getMessage()),
          originalException);
    }

    // Default to TransientException when in doubt
    return new TransientException(
        String.format("Database error during %s: %s", operation, originalException.getMessage()),
        originalException);
  }

  static boolean isUniqueViolation(SQLException exception) {
    return UNIQUE_VIOLATION.equals(exception.getSQLState())
        || exception.getErrorCode() == 23505
        || lowerMessage(exception).contains("unique constraint")
        || lowerMessage(exception).contains("unique index or primary key violation");
  }

  /**
   * Transient errors: connection failures, lock and statement timeouts, deadlocks, pool
   * exhaustion, transaction rollbacks (serialization failures).
   */
  private static boolean isTransientError(SQLException exception) {
    String message = lowerMessage(exception);
    if (message.contains("timeout")
        || message.contains("connection refused")
        || message.contains("deadlock")
        || message.contains("too many connections")
        || message.contains("pool exhausted")) {
      return true;
    }

    String sqlState = exception.getSQLState();
    if (sqlState != null) {
      // 08xxx connection exception, 40xxx transaction rollback
      if (sqlState.startsWith("08") || sqlState.startsWith("40")) {
        return true;
      }
      // PostgreSQL: cannot connect now
      if (sqlState.equals("57P03")) {
        return true;
      }
    }

    int errorCode = exception.getErrorCode();
    // H2: 50200 lock timeout, 40001 deadlock, 90008 invalid value / timeout
    return errorCode == 50200 || errorCode == 40001 || errorCode == 90008;
  }

  /**
   * Permanent errors: missing tables or columns, syntax errors, data and integrity violations
   * other than unique keys.
   */
  private static boolean isPermanentError(SQLException exception) {
    String message = lowerMessage(exception);
    if (message.contains("syntax error")
        || message.contains("table not found")
        || message.contains("column not found")
        || message.contains("does not exist")
        || message.contains("schema not found")
        || message.contains("foreign key")
        || message.contains("type mismatch")) {
      return true;
    }

    String sqlState = exception.getSQLState();
    if (sqlState != null
        && (sqlState.startsWith("22")
            || sqlState.startsWith("23")
            || sqlState.startsWith("42")
            || sqlState.startsWith("3D")
            || sqlState.startsWith("3F"))) {
      return true;
    }

    int errorCode = exception.getErrorCode();
    // H2: 42102 table not found, 42122 column not found, 90007 closed object
    return errorCode == 42102 || errorCode == 42122 || errorCode == 90007;
  }

  private static String lowerMessage(SQLException exception) {
    String message = exception.getMessage();
    return message == null ? "" : message.toLowerCase(Locale.ROOT);
  }
}
