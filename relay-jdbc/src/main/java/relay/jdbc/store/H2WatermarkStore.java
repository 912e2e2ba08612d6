package relay.jdbc.store;

import java.util.List;

/**
 * H2 watermark store. Primarily for testing.
 *
 * <p>Uses the update-then-insert upsert from {@link AbstractJdbcWatermarkStore}.
 */
public final class H2WatermarkStore extends AbstractJdbcWatermarkStore {

  public H2WatermarkStore() {
    super();
  }

  public H2WatermarkStore(String tableName) {
    super(tableName);
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
