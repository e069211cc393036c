package lexicon.jdbc;

import lexicon.ConflictException;
import lexicon.ConnectivityException;
import lexicon.LexiconException;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

/**
 * Maps {@link SQLException}s onto the {@link LexiconException} hierarchy.
 *
 * <ul>
 *   <li>unique violation ({@code 23505}, or MySQL {@code 23000} with error 1062) -
 *       {@link ConflictException}</li>
 *   <li>connection exception (class {@code 08}) or pool timeout -
 *       {@link ConnectivityException}</li>
 *   <li>anything else - {@link StoreException}</li>
 * </ul>
 */
public final class SqlErrors {
  static final String UNIQUE_VIOLATION = "23505";
  static final String INTEGRITY_VIOLATION = "23000";
  static final int MYSQL_DUPLICATE_ENTRY = 1062;
  static final String CONNECTION_EXCEPTION_CLASS = "08";

  private SqlErrors() {}

  public static LexiconException translate(String action, SQLException e) {
    String message = action + ": " + e.getMessage();
    if (isUniqueViolation(e)) {
      return new ConflictException(message, e);
    }
    if (isConnectivity(e)) {
      return new ConnectivityException(message, e);
    }
    return new StoreException(message, e);
  }

  static boolean isUniqueViolation(SQLException e) {
    String state = e.getSQLState();
    return UNIQUE_VIOLATION.equals(state)
        || (INTEGRITY_VIOLATION.equals(state) && e.getErrorCode() == MYSQL_DUPLICATE_ENTRY);
  }

  static boolean isConnectivity(SQLException e) {
    if (e instanceof SQLTransientConnectionException) {
      return true;
    }
    String state = e.getSQLState();
    return state != null && state.startsWith(CONNECTION_EXCEPTION_CLASS);
  }
}
