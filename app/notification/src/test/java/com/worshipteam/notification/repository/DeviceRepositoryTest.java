/*
 * Where: Device repository integration tests
 * What: Upsert semantics, jsonb preferences and the IN-list cap against Postgres
 * Why: ON CONFLICT and jsonb casts only behave as expected on the real dialect
 */
package com.worshipteam.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.worshipteam.notification.AbstractPostgresContainerTest;
import com.worshipteam.notification.model.DeviceRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeviceRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-01T00:00:00Z");
  private static final Instant UPDATED_AT = Instant.parse("2026-02-01T00:00:00Z");

  @Autowired private DeviceRepository deviceRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_devices", new MapSqlParameterSource());
  }

  @Test
  void upsertInsertsAndReadsBackPreferences() {
    final DeviceRecord device =
        device("device-1", "token-1", "user-1", true, Map.of("catalog", false, "reminder", true));

    deviceRepository.upsert(device);

    assertThat(deviceRepository.findById("device-1")).contains(device);
  }

  @Test
  void upsertOverwritesFieldsButKeepsCreatedAt() {
    deviceRepository.upsert(device("device-1", "token-1", "user-1", true, Map.of()));

    deviceRepository.upsert(
        new DeviceRecord(
            "device-1",
            "token-1",
            "user-2",
            "minister",
            false,
            Map.of("assignment", false),
            "android",
            UPDATED_AT,
            UPDATED_AT));

    final DeviceRecord stored = deviceRepository.findById("device-1").orElseThrow();
    assertThat(stored.userId()).isEqualTo("user-2");
    assertThat(stored.role()).isEqualTo("minister");
    assertThat(stored.enabled()).isFalse();
    assertThat(stored.preferences()).containsOnly(Map.entry("assignment", false));
    assertThat(stored.createdAt()).isEqualTo(CREATED_AT);
    assertThat(stored.updatedAt()).isEqualTo(UPDATED_AT);
  }

  @Test
  void findEnabledByUserIdsSkipsDisabledDevices() {
    deviceRepository.upsert(device("device-1", "token-1", "user-1", true, Map.of()));
    deviceRepository.upsert(device("device-2", "token-2", "user-1", false, Map.of()));
    deviceRepository.upsert(device("device-3", "token-3", "user-3", true, Map.of()));

    assertThat(deviceRepository.findEnabledByUserIds(List.of("user-1", "user-2")))
        .extracting(DeviceRecord::token)
        .containsExactly("token-1");
  }

  @Test
  void findEnabledByUserIdsRejectsMoreThanTenValues() {
    final List<String> userIds =
        IntStream.range(0, 11).mapToObj(i -> "user-" + i).collect(Collectors.toList());

    assertThatThrownBy(() -> deviceRepository.findEnabledByUserIds(userIds))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private DeviceRecord device(
      String deviceId,
      String token,
      String userId,
      boolean enabled,
      Map<String, Boolean> preferences) {
    return new DeviceRecord(
        deviceId, token, userId, "member", enabled, preferences, "web", CREATED_AT, CREATED_AT);
  }
}
