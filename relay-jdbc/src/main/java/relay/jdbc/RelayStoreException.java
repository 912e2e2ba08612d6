package relay.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcTemplate} and the stores
 * built on it.
 */
public final class RelayStoreException extends RuntimeException {
  public RelayStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns {@code true} if the underlying error is an integrity constraint violation
   * (SQLSTATE class {@code 23}), such as a duplicate key.
   */
  public boolean isConstraintViolation() {
    return getCause() instanceof SQLException e
        && e.getSQLState() != null
        && e.getSQLState().startsWith("23");
  }
}
