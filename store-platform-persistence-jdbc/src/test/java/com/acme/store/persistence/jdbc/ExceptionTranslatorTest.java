package com.acme.store.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.store.core.ConflictException;
import com.acme.store.core.PermanentException;
import com.acme.store.core.TransientException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ExceptionTranslatorTest {

  private static final Logger LOG = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

  private RuntimeException translate(SQLException e) {
    return ExceptionTranslator.translateException(e, "test operation", LOG);
  }

  @Nested
  @DisplayName("Conflict")
  class ConflictTests {

    @Test
    @DisplayName("unique violation SQLState maps to ConflictException")
    void testUniqueViolationState() {
      RuntimeException result = translate(new SQLException("duplicate key", "23505"));

      assertThat(result).isInstanceOf(ConflictException.class).hasMessageContaining("test operation");
      assertThat(result.getCause()).isInstanceOf(SQLException.class);
    }

    @Test
    @DisplayName("H2 primary key message maps to ConflictException")
    void testH2Message() {
      assertThat(translate(new SQLException("Unique index or primary key violation: PK_X")))
          .isInstanceOf(ConflictException.class);
    }
  }

  @Nested
  @DisplayName("Transient")
  class TransientTests {

    @Test
    @DisplayName("connection exceptions are transient")
    void testConnectionState() {
      assertThat(translate(new SQLException("Connection reset", "08006")))
          .isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("serialization failures are transient")
    void testSerializationFailure() {
      assertThat(translate(new SQLException("could not serialize access", "40001")))
          .isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("H2 lock timeout is transient")
    void testH2LockTimeout() {
      assertThat(translate(new SQLException("Lock wait", "HYT00", 50200)))
          .isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("unclassified errors default to transient")
    void testDefault() {
      assertThat(translate(new SQLException("something odd")))
          .isInstanceOf(TransientException.class);
    }
  }

  @Nested
  @DisplayName("Permanent")
  class PermanentTests {

    @Test
    @DisplayName("missing table is permanent")
    void testMissingTable() {
      assertThat(translate(new SQLException("Table \"OUTBOX\" not found", "42S02", 42102)))
          .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("foreign key violation is permanent")
    void testForeignKey() {
      assertThat(translate(new SQLException("violates foreign key", "23503")))
          .isInstanceOf(PermanentException.class);
    }
  }
}
