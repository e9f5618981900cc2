/*
 * Where: Notification data access
 * What: Reads and upserts notification_devices rows
 * Why: Backs the device registry and the token collector
 */
package com.worshipteam.notification.repository;

import static com.worshipteam.common.JdbcTimestampUtils.toInstant;
import static com.worshipteam.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worshipteam.notification.config.StoreProperties;
import com.worshipteam.notification.model.DeviceRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeviceRepository {

  private static final TypeReference<Map<String, Boolean>> PREFERENCES_TYPE =
      new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final StoreProperties storeProperties;

  public Optional<DeviceRecord> findById(String deviceId) {
    final String sql =
        """
        SELECT device_id, token, user_id, role, enabled, preferences::text AS preferences_text,
               platform, created_at, updated_at
        FROM notification_devices
        WHERE device_id = :deviceId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("deviceId", deviceId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Last write wins; created_at is only written by the first insert. */
  public void upsert(DeviceRecord device) {
    final String sql =
        """
        INSERT INTO notification_devices (
          device_id,
          token,
          user_id,
          role,
          enabled,
          preferences,
          platform,
          created_at,
          updated_at
        ) VALUES (
          :deviceId,
          :token,
          :userId,
          :role,
          :enabled,
          :preferences::jsonb,
          :platform,
          :createdAt,
          :updatedAt
        )
        ON CONFLICT (device_id) DO UPDATE
        SET token = EXCLUDED.token,
            user_id = EXCLUDED.user_id,
            role = EXCLUDED.role,
            enabled = EXCLUDED.enabled,
            preferences = EXCLUDED.preferences,
            platform = EXCLUDED.platform,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deviceId", device.deviceId())
            .addValue("token", device.token())
            .addValue("userId", device.userId())
            .addValue("role", device.role())
            .addValue("enabled", device.enabled())
            .addValue("preferences", writePreferences(device.preferences()))
            .addValue("platform", device.platform())
            .addValue("createdAt", toTimestamp(device.createdAt()))
            .addValue("updatedAt", toTimestamp(device.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  /**
   * Enabled devices owned by any of {@code userIds}. The caller batches; more values than the
   * store's IN-list limit are rejected.
   */
  public List<DeviceRecord> findEnabledByUserIds(Collection<String> userIds) {
    StoreLimits.checkInValues(userIds, storeProperties);
    if (userIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT device_id, token, user_id, role, enabled, preferences::text AS preferences_text,
               platform, created_at, updated_at
        FROM notification_devices
        WHERE enabled = TRUE
          AND user_id IN (:userIds)
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userIds", userIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private DeviceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeviceRecord(
        rs.getString("device_id"),
        rs.getString("token"),
        rs.getString("user_id"),
        rs.getString("role"),
        rs.getBoolean("enabled"),
        readPreferences(rs.getString("preferences_text")),
        rs.getString("platform"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private String writePreferences(Map<String, Boolean> preferences) {
    try {
      return objectMapper.writeValueAsString(preferences);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("device preferences serialization failure", ex);
    }
  }

  private Map<String, Boolean> readPreferences(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, PREFERENCES_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("device preferences parse failure", ex);
    }
  }
}
