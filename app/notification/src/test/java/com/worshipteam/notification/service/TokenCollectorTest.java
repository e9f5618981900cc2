/*
 * Where: Token collector unit tests
 * What: Batched device lookups and the per-category preference gate
 * Why: The store rejects IN lists over ten values and opted-out devices must be skipped
 */
package com.worshipteam.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.worshipteam.notification.config.StoreProperties;
import com.worshipteam.notification.model.DeviceRecord;
import com.worshipteam.notification.model.NotificationCategory;
import com.worshipteam.notification.repository.DeviceRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TokenCollectorTest {

  private static final Instant NOW = Instant.parse("2026-03-10T08:00:00Z");

  @Mock private DeviceRepository deviceRepository;

  private TokenCollector collector;

  @BeforeEach
  void setUp() {
    collector = new TokenCollector(deviceRepository, new StoreProperties(10));
  }

  @Test
  void twentyFiveUsersAreLookedUpInThreeBatches() {
    final List<String> userIds =
        IntStream.range(0, 25).mapToObj(i -> "user-" + i).collect(Collectors.toList());
    when(deviceRepository.findEnabledByUserIds(anyCollection()))
        .thenAnswer(
            invocation -> {
              final Collection<String> chunk = invocation.getArgument(0);
              final List<DeviceRecord> devices = new ArrayList<>();
              for (String userId : chunk) {
                devices.add(device(userId, "token-" + userId, Map.of()));
              }
              // user-0 owns a second device registered with the same token
              if (chunk.contains("user-0")) {
                devices.add(device("user-0", "token-user-0", Map.of()));
              }
              return devices;
            });

    final Set<String> tokens = collector.collectTokens(userIds, NotificationCategory.ASSIGNMENT);

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<Collection<String>> captor = ArgumentCaptor.forClass(Collection.class);
    verify(deviceRepository, times(3)).findEnabledByUserIds(captor.capture());
    assertThat(captor.getAllValues()).extracting(Collection::size).containsExactly(10, 10, 5);
    assertThat(tokens).hasSize(25).doesNotHaveDuplicates();
  }

  @Test
  void deviceOptedOutOfCategoryIsExcludedOnlyForThatCategory() {
    when(deviceRepository.findEnabledByUserIds(List.of("user-1")))
        .thenReturn(List.of(device("user-1", "token-1", Map.of("catalog", false))));

    assertThat(collector.collectTokens(List.of("user-1"), NotificationCategory.CATALOG)).isEmpty();
    assertThat(collector.collectTokens(List.of("user-1"), NotificationCategory.ASSIGNMENT))
        .containsExactly("token-1");
  }

  @Test
  void explicitlyEnabledPreferenceAllowsDelivery() {
    when(deviceRepository.findEnabledByUserIds(List.of("user-1")))
        .thenReturn(List.of(device("user-1", "token-1", Map.of("reminder", true))));

    assertThat(collector.collectTokens(List.of("user-1"), NotificationCategory.REMINDER))
        .containsExactly("token-1");
  }

  @Test
  void blankTokensAreDropped() {
    when(deviceRepository.findEnabledByUserIds(List.of("user-1")))
        .thenReturn(List.of(device("user-1", " ", Map.of())));

    assertThat(collector.collectTokens(List.of("user-1"), NotificationCategory.REMINDER)).isEmpty();
  }

  @Test
  void emptyInputSkipsTheStore() {
    assertThat(collector.collectTokens(List.of(), NotificationCategory.REMINDER)).isEmpty();
    verifyNoInteractions(deviceRepository);
  }

  private DeviceRecord device(String userId, String token, Map<String, Boolean> preferences) {
    return new DeviceRecord(
        DeviceKeys.deviceId(token + userId),
        token,
        userId,
        "member",
        true,
        preferences,
        "web",
        NOW,
        NOW);
  }
}
