package com.worshipteam.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.worshipteam.notification.config.PushProperties;
import com.worshipteam.notification.model.DispatchResult;
import com.worshipteam.notification.model.NotificationCategory;
import com.worshipteam.notification.push.PushGateway;
import com.worshipteam.notification.push.PushGatewayException;
import com.worshipteam.notification.push.PushMessage;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PushDispatchServiceTest {

  private static final String BASE_URL = "https://worship.example.test";

  @Mock private PushGateway pushGateway;
  @Mock private NotificationMetrics metrics;

  private PushDispatchService service(int maxTokens) {
    return new PushDispatchService(
        pushGateway, new PushProperties(BASE_URL, maxTokens, null), metrics);
  }

  @Test
  void emptyTokenSetDoesNotCallGateway() {
    final DispatchResult result =
        service(500).dispatch(Set.of(), "t", "b", "/x", NotificationCategory.REMINDER);

    assertThat(result).isEqualTo(new DispatchResult(0, 0));
    verifyNoInteractions(pushGateway);
  }

  @Test
  void tokensWithinLimitAreSentInOneRequestWithResolvedPayload() {
    when(pushGateway.sendMulticast(any())).thenReturn(new DispatchResult(2, 1));

    final DispatchResult result =
        service(500)
            .dispatch(
                new LinkedHashSet<>(Set.of("a", "b", "c")),
                "Titolo",
                "Corpo",
                null,
                NotificationCategory.ANNOUNCEMENTS);

    final ArgumentCaptor<PushMessage> captor = ArgumentCaptor.forClass(PushMessage.class);
    verify(pushGateway).sendMulticast(captor.capture());
    assertThat(captor.getValue().tokens()).containsExactlyInAnyOrder("a", "b", "c");
    assertThat(captor.getValue().link()).isEqualTo(BASE_URL);
    assertThat(captor.getValue().category()).isEqualTo("announcements");
    assertThat(captor.getValue().title()).isEqualTo("Titolo");
    assertThat(result).isEqualTo(new DispatchResult(2, 1));
  }

  @Test
  void largeTokenSetsAreSplitAndCountsSummed() {
    final Set<String> tokens =
        IntStream.range(0, 5).mapToObj(i -> "t" + i).collect(Collectors.toCollection(LinkedHashSet::new));
    when(pushGateway.sendMulticast(any()))
        .thenReturn(new DispatchResult(2, 0), new DispatchResult(1, 1), new DispatchResult(0, 1));

    final DispatchResult result =
        service(2).dispatch(tokens, "t", "b", "/songs", NotificationCategory.CATALOG);

    verify(pushGateway, times(3)).sendMulticast(any());
    assertThat(result).isEqualTo(new DispatchResult(3, 2));
  }

  @Test
  void gatewayFailurePropagates() {
    when(pushGateway.sendMulticast(any()))
        .thenThrow(new PushGatewayException("fcm multicast failed: UNAVAILABLE", null));

    assertThatThrownBy(
            () ->
                service(500).dispatch(Set.of("a"), "t", "b", "/", NotificationCategory.REMINDER))
        .isInstanceOf(PushGatewayException.class);
  }
}
