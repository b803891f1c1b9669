package com.gentoro.contextmcp;

import com.gentoro.contextmcp.store.H2Dialect;
import com.gentoro.contextmcp.store.StoreGateway;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import org.h2.jdbcx.JdbcDataSource;

/** Fresh, isolated in-memory H2 stores carrying the application schema. */
public final class TestStores {
  private static final String SCHEMA = "db/h2-schema.sql";

  private TestStores() {}

  public static StoreGateway h2() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL(
        "jdbc:h2:mem:"
            + UUID.randomUUID()
            + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    ds.setPassword("");
    applySchema(ds);
    return new StoreGateway(ds, new H2Dialect(), 10);
  }

  private static void applySchema(JdbcDataSource ds) {
    try (InputStream in = TestStores.class.getClassLoader().getResourceAsStream(SCHEMA)) {
      if (in == null) throw new IllegalStateException("Missing test resource " + SCHEMA);
      String script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      try (Connection c = ds.getConnection();
          Statement st = c.createStatement()) {
        for (String statement : script.split(";")) {
          if (!statement.isBlank()) st.execute(statement);
        }
      }
    } catch (IOException | SQLException e) {
      throw new IllegalStateException("Could not create test schema", e);
    }
  }
}
