/*
 * Where: Notification service layer
 * What: Registers, disables and updates push devices
 * Why: Keeps one record per physical token and lets users opt out per category
 */
package com.worshipteam.notification.service;

import com.worshipteam.notification.model.DeviceRecord;
import com.worshipteam.notification.model.UserRole;
import com.worshipteam.notification.repository.DeviceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Every operation is a read-modify-write in one transaction. Fields supplied by the caller
 * overwrite the stored value as a whole (a preference map is replaced, never deep-merged); omitted
 * optional fields keep what is stored. Concurrent writers converge by last write wins.
 */
@Service
@RequiredArgsConstructor
public class DeviceRegistryService {

  private static final Logger logger = LoggerFactory.getLogger(DeviceRegistryService.class);
  static final String DEFAULT_PLATFORM = "unknown";

  private final DeviceRepository deviceRepository;
  private final Clock clock;

  @Transactional
  public DeviceRecord registerDevice(
      String rawToken,
      String userId,
      String role,
      Map<String, Boolean> preferences,
      String platform) {
    requireToken(rawToken);
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("user id is required");
    }
    final String deviceId = DeviceKeys.deviceId(rawToken);
    final Instant now = Instant.now(clock);
    final Optional<DeviceRecord> existing = deviceRepository.findById(deviceId);
    final DeviceRecord merged =
        new DeviceRecord(
            deviceId,
            rawToken,
            userId,
            firstNonBlank(role, existing.map(DeviceRecord::role), UserRole.MEMBER.value()),
            true,
            preferences != null
                ? preferences
                : existing.map(DeviceRecord::preferences).orElse(Map.of()),
            firstNonBlank(platform, existing.map(DeviceRecord::platform), DEFAULT_PLATFORM),
            existing.map(DeviceRecord::createdAt).orElse(now),
            now);
    deviceRepository.upsert(merged);
    logger.info(
        "device registered deviceId={} userId={} platform={} reRegistration={}",
        deviceId,
        userId,
        merged.platform(),
        existing.isPresent());
    return merged;
  }

  /** Disables the device; an unknown token is not an error. */
  @Transactional
  public void unregisterDevice(String rawToken) {
    requireToken(rawToken);
    final String deviceId = DeviceKeys.deviceId(rawToken);
    final Optional<DeviceRecord> existing = deviceRepository.findById(deviceId);
    if (existing.isEmpty()) {
      logger.info("device unregister ignored, unknown deviceId={}", deviceId);
      return;
    }
    final DeviceRecord current = existing.get();
    deviceRepository.upsert(
        new DeviceRecord(
            current.deviceId(),
            current.token(),
            current.userId(),
            current.role(),
            false,
            current.preferences(),
            current.platform(),
            current.createdAt(),
            Instant.now(clock)));
    logger.info("device disabled deviceId={} userId={}", deviceId, current.userId());
  }

  /**
   * Replaces the preference map ({@code null} clears it) and sets the enabled flag, which stays
   * on unless {@code enabled} is explicitly {@code false}. An unknown token is not an error.
   */
  @Transactional
  public void updatePreferences(String rawToken, Map<String, Boolean> preferences, Boolean enabled) {
    requireToken(rawToken);
    final String deviceId = DeviceKeys.deviceId(rawToken);
    final Optional<DeviceRecord> existing = deviceRepository.findById(deviceId);
    if (existing.isEmpty()) {
      logger.info("device preference update ignored, unknown deviceId={}", deviceId);
      return;
    }
    final DeviceRecord current = existing.get();
    final boolean enabledFlag = !Boolean.FALSE.equals(enabled);
    deviceRepository.upsert(
        new DeviceRecord(
            current.deviceId(),
            current.token(),
            current.userId(),
            current.role(),
            enabledFlag,
            preferences == null ? Map.of() : preferences,
            current.platform(),
            current.createdAt(),
            Instant.now(clock)));
    logger.info(
        "device preferences updated deviceId={} enabled={} preferences={}",
        deviceId,
        enabledFlag,
        preferences == null ? Map.of() : preferences);
  }

  private void requireToken(String rawToken) {
    if (rawToken == null || rawToken.isBlank()) {
      throw new ValidationException("token is required");
    }
  }

  private String firstNonBlank(String supplied, Optional<String> stored, String fallback) {
    if (supplied != null && !supplied.isBlank()) {
      return supplied;
    }
    return stored.filter(value -> !value.isBlank()).orElse(fallback);
  }
}
