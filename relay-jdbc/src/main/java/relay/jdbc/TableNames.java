package relay.jdbc;

import java.util.Objects;

/**
 * Default table names and validation for identifiers spliced into SQL.
 */
public final class TableNames {
  public static final String SOURCE = "relay_source";
  public static final String SUBSCRIPTION = "relay_subscription";
  public static final String CONFIG = "relay_config";
  public static final String WATERMARK = "relay_watermark";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
