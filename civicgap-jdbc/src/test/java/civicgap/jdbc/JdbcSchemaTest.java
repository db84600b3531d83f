package civicgap.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSchemaTest {

  @Test
  void splitsOnTrailingSemicolonAndSkipsComments() {
    List<String> statements = JdbcSchema.statements(
        "-- header\n"
            + "CREATE TABLE a (\n  id INT\n);\n"
            + "\n"
            + "CREATE INDEX i ON a (id);\n"
            + "SELECT 1");

    assertEquals(3, statements.size());
    assertEquals("CREATE TABLE a (\n  id INT\n)", statements.get(0));
    assertEquals("CREATE INDEX i ON a (id)", statements.get(1));
    assertEquals("SELECT 1", statements.get(2));
  }

  @Test
  void applyingTwiceIsHarmless() throws Exception {
    JdbcDataSource dataSource = H2Databases.create("schema");

    try (Connection conn = dataSource.getConnection()) {
      JdbcSchema.apply(conn, "civicgap/jdbc/schema-h2.sql");
      assertEquals(0, JdbcTemplate.count(conn, "SELECT COUNT(*) FROM gap_metric_cache"));
    }
  }

  @Test
  void missingResourceIsRejected() throws Exception {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL(H2Databases.url("missing"));

    try (Connection conn = dataSource.getConnection()) {
      IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
          () -> JdbcSchema.apply(conn, "civicgap/jdbc/schema-oracle.sql"));
      assertTrue(e.getMessage().contains("schema-oracle.sql"));
    }
  }
}
