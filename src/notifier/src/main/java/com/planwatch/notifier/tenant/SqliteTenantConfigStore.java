package com.planwatch.notifier.tenant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite implementation of {@link TenantConfigStore} over the {@code server_configs} table.
 *
 * <p>The repository:
 * <ul>
 *   <li>creates the table on first open</li>
 *   <li>adds appearance columns missing from databases created by older versions</li>
 *   <li>stores callsign prefixes as a JSON array</li>
 * </ul>
 *
 * <p>One connection is shared; access is serialized on this instance.
 */
public class SqliteTenantConfigStore implements TenantConfigStore, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SqliteTenantConfigStore.class);
  private static final TypeReference<List<String>> PREFIX_LIST = new TypeReference<>() {};

  private static final String CREATE_TABLE_SQL = """
      CREATE TABLE IF NOT EXISTS server_configs (
          guild_id INTEGER PRIMARY KEY,
          channel_id INTEGER,
          callsign_prefixes TEXT,
          created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
          updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
      )
      """;

  private static final Map<String, String> APPEARANCE_COLUMNS = appearanceColumns();

  private final Connection connection;
  private final ObjectMapper objectMapper;

  /**
   * Opens (and creates when needed) the tenant database.
   *
   * @param sqlitePath path to the SQLite file; parent directories are created
   * @param objectMapper mapper used for the prefix column
   */
  public SqliteTenantConfigStore(Path sqlitePath, ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    try {
      Path parent = sqlitePath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      this.connection = DriverManager.getConnection("jdbc:sqlite:" + sqlitePath.toAbsolutePath());
      initSchema();
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to open tenant SQLite DB at " + sqlitePath, ex);
    }
    log.info("Tenant configuration store opened at {}", sqlitePath.toAbsolutePath());
  }

  @Override
  public synchronized Map<Long, TenantConfig> getAll() {
    String sql = "SELECT * FROM server_configs ORDER BY guild_id";
    Map<Long, TenantConfig> configs = new LinkedHashMap<>();
    try (PreparedStatement stmt = connection.prepareStatement(sql);
         ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        TenantConfig config = readRow(rs);
        configs.put(config.guildId(), config);
      }
    } catch (SQLException ex) {
      throw new ConfigurationUnavailableException("Failed to read tenant configurations", ex);
    }
    return configs;
  }

  @Override
  public synchronized void upsert(long guildId, TenantConfigUpdate update) {
    TenantConfig merged = update.applyTo(guildId, find(guildId));
    String sql = """
        INSERT INTO server_configs (
            guild_id, channel_id, callsign_prefixes, embed_color, embed_title, embed_thumbnail,
            embed_image, show_callsign, show_pilot, show_aircraft, show_departure, show_arrival,
            show_flightlevel, show_flightrules, show_route, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
        ON CONFLICT(guild_id) DO UPDATE SET
            channel_id = excluded.channel_id,
            callsign_prefixes = excluded.callsign_prefixes,
            embed_color = excluded.embed_color,
            embed_title = excluded.embed_title,
            embed_thumbnail = excluded.embed_thumbnail,
            embed_image = excluded.embed_image,
            show_callsign = excluded.show_callsign,
            show_pilot = excluded.show_pilot,
            show_aircraft = excluded.show_aircraft,
            show_departure = excluded.show_departure,
            show_arrival = excluded.show_arrival,
            show_flightlevel = excluded.show_flightlevel,
            show_flightrules = excluded.show_flightrules,
            show_route = excluded.show_route,
            updated_at = CURRENT_TIMESTAMP
        """;
    try (PreparedStatement stmt = connection.prepareStatement(sql)) {
      TenantConfig.Appearance appearance = merged.appearance();
      stmt.setLong(1, guildId);
      stmt.setLong(2, merged.destinationId());
      stmt.setString(3, objectMapper.writeValueAsString(merged.prefixes()));
      stmt.setInt(4, appearance.color());
      stmt.setString(5, appearance.title());
      setNullableString(stmt, 6, appearance.thumbnailUrl());
      setNullableString(stmt, 7, appearance.imageUrl());
      int index = 8;
      for (NotificationField field : NotificationField.values()) {
        stmt.setInt(index++, appearance.isVisible(field) ? 1 : 0);
      }
      stmt.executeUpdate();
    } catch (SQLException | JsonProcessingException ex) {
      throw new ConfigurationUnavailableException("Failed to save configuration for tenant " + guildId, ex);
    }
    log.info("Saved configuration for tenant {} (prefixes: {})", guildId, merged.prefixes());
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException ex) {
      log.warn("Failed to close tenant SQLite DB", ex);
    }
  }

  private TenantConfig find(long guildId) {
    try (PreparedStatement stmt = connection.prepareStatement("SELECT * FROM server_configs WHERE guild_id = ?")) {
      stmt.setLong(1, guildId);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? readRow(rs) : null;
      }
    } catch (SQLException ex) {
      throw new ConfigurationUnavailableException("Failed to read configuration for tenant " + guildId, ex);
    }
  }

  private TenantConfig readRow(ResultSet rs) throws SQLException {
    long guildId = rs.getLong("guild_id");
    Set<NotificationField> visible = EnumSet.noneOf(NotificationField.class);
    for (NotificationField field : NotificationField.values()) {
      int shown = rs.getInt(field.column());
      // NULL flags come from rows written before the column existed; those default to visible.
      if (rs.wasNull() || shown != 0) {
        visible.add(field);
      }
    }
    int color = rs.getInt("embed_color");
    if (rs.wasNull()) {
      color = TenantConfig.Appearance.DEFAULT_COLOR;
    }
    TenantConfig.Appearance appearance = new TenantConfig.Appearance(
        color,
        rs.getString("embed_title"),
        rs.getString("embed_thumbnail"),
        rs.getString("embed_image"),
        visible);
    return new TenantConfig(
        guildId, rs.getLong("channel_id"), parsePrefixes(guildId, rs.getString("callsign_prefixes")), appearance);
  }

  private List<String> parsePrefixes(long guildId, String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, PREFIX_LIST);
    } catch (JsonProcessingException ex) {
      log.warn("Ignoring unreadable callsign prefixes for tenant {}: {}", guildId, json);
      return List.of();
    }
  }

  private void initSchema() throws SQLException {
    try (Statement stmt = connection.createStatement()) {
      stmt.execute(CREATE_TABLE_SQL);
    }
    Set<String> columns = existingColumns();
    for (Map.Entry<String, String> column : APPEARANCE_COLUMNS.entrySet()) {
      if (columns.contains(column.getKey())) {
        continue;
      }
      try (Statement stmt = connection.createStatement()) {
        stmt.execute("ALTER TABLE server_configs ADD COLUMN " + column.getKey() + " " + column.getValue());
      }
      log.info("Added column {} to server_configs", column.getKey());
    }
  }

  private Set<String> existingColumns() throws SQLException {
    Set<String> columns = new HashSet<>();
    try (PreparedStatement stmt = connection.prepareStatement("PRAGMA table_info(server_configs)");
         ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        String name = rs.getString("name");
        if (name != null) {
          columns.add(name);
        }
      }
    }
    return columns;
  }

  private static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
    if (value == null) {
      stmt.setNull(index, Types.VARCHAR);
    } else {
      stmt.setString(index, value);
    }
  }

  private static Map<String, String> appearanceColumns() {
    Map<String, String> columns = new LinkedHashMap<>();
    columns.put("embed_color", "INTEGER DEFAULT " + TenantConfig.Appearance.DEFAULT_COLOR);
    columns.put("embed_title", "TEXT DEFAULT '" + TenantConfig.Appearance.DEFAULT_TITLE + "'");
    columns.put("embed_thumbnail", "TEXT");
    columns.put("embed_image", "TEXT");
    for (NotificationField field : NotificationField.values()) {
      columns.put(field.column(), "BOOLEAN DEFAULT 1");
    }
    return columns;
  }
}
