package lexicon.jdbc.dialect;

import lexicon.ConnectivityException;
import lexicon.jdbc.TestDatabase;
import lexicon.jdbc.spi.Dialect;
import lexicon.spi.ConnectionProvider;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DialectsTest {

  @Test
  void builtInDialectsAreRegisteredOnce() {
    List<String> names = Dialects.registered().stream().map(Dialect::name).toList();

    assertTrue(names.containsAll(List.of("h2", "postgresql", "mysql")));
    assertEquals(names.size(), names.stream().distinct().count());
  }

  @Test
  void urlMatchingIgnoresCase() {
    assertInstanceOf(MySqlDialect.class, Dialects.forUrl("jdbc:mariadb://db:3306/lexicon"));
    assertInstanceOf(PostgresDialect.class, Dialects.forUrl("JDBC:PostgreSQL://db/lexicon"));
    assertInstanceOf(H2Dialect.class, Dialects.forUrl("jdbc:h2:mem:words"));
  }

  @Test
  void unhandledUrlNamesTheRegisteredDialects() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.forUrl("jdbc:sqlite:lexicon.db"));

    assertTrue(ex.getMessage().contains("jdbc:sqlite:lexicon.db"));
    assertTrue(ex.getMessage().contains("postgresql"));
    assertThrows(IllegalArgumentException.class, () -> Dialects.forUrl("  "));
  }

  @Test
  void poolIsMatchedWithoutBorrowingAConnection() {
    try (TestDatabase db = TestDatabase.open()) {
      int leasedBefore = db.pool().activeConnections();

      assertInstanceOf(H2Dialect.class, Dialects.detect(db.pool()));
      assertEquals(leasedBefore, db.pool().activeConnections());
    }
  }

  @Test
  void otherProvidersAreAskedForTheirUrl() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dialect_detect;DB_CLOSE_DELAY=-1");
    AtomicInteger opened = new AtomicInteger();
    ConnectionProvider provider = () -> {
      opened.incrementAndGet();
      return ds.getConnection();
    };

    assertInstanceOf(H2Dialect.class, Dialects.detect(provider));
    assertEquals(1, opened.get());
  }

  @Test
  void unreachableStoreIsAConnectivityFailure() {
    ConnectionProvider down = () -> {
      throw new SQLTransientConnectionException("refused");
    };

    assertThrows(ConnectivityException.class, () -> Dialects.detect(down));
  }

  @Test
  void configuredNameWinsOverDetection() {
    ConnectionProvider untouched = () -> {
      throw new AssertionError("store must not be contacted");
    };

    assertInstanceOf(PostgresDialect.class, Dialects.resolve(" PostgreSQL ", untouched));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.resolve("oracle", untouched));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void blankNameFallsBackToDetection() {
    try (TestDatabase db = TestDatabase.open()) {
      assertInstanceOf(H2Dialect.class, Dialects.resolve(null, db.pool()));
      assertInstanceOf(H2Dialect.class, Dialects.resolve("", db.pool()));
    }
  }

  @Test
  void schemaScriptIsNamedAfterTheDialect() {
    assertEquals("lexicon/schema/mysql.sql", Dialects.named("mysql").schemaResource());
  }
}
