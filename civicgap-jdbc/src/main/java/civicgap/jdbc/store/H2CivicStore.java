package civicgap.jdbc.store;

import java.time.Clock;
import java.util.List;

/**
 * H2 civic store. Primarily for testing; run H2 with {@code MODE=PostgreSQL}.
 */
public final class H2CivicStore extends AbstractJdbcCivicStore {

  public H2CivicStore() {
    super();
  }

  public H2CivicStore(Clock clock) {
    super(clock);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
