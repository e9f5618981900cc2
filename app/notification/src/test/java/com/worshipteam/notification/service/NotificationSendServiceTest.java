package com.worshipteam.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.worshipteam.notification.model.DispatchResult;
import com.worshipteam.notification.model.NotificationCategory;
import com.worshipteam.notification.model.NotificationPlan;
import com.worshipteam.notification.model.RecipientTarget;
import com.worshipteam.notification.model.UserRole;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationSendServiceTest {

  @Mock private NotificationPlanner planner;
  @Mock private RecipientResolver recipientResolver;
  @Mock private TokenCollector tokenCollector;
  @Mock private PushDispatchService pushDispatchService;

  private NotificationSendService service;

  @BeforeEach
  void setUp() {
    service =
        new NotificationSendService(planner, recipientResolver, tokenCollector, pushDispatchService);
  }

  @Test
  void emitEventRunsThePlannedPipeline() {
    final NotificationPlan plan =
        new NotificationPlan(
            new RecipientTarget.All(),
            NotificationCategory.CATALOG,
            "Nuova canzone in catalogo",
            "Amazing Grace",
            "/songs");
    when(planner.plan("catalog_song_created", Map.of("title", "Amazing Grace"))).thenReturn(plan);
    when(recipientResolver.resolve(plan.target())).thenReturn(Set.of("u1", "u2", "u3"));
    when(tokenCollector.collectTokens(Set.of("u1", "u2", "u3"), NotificationCategory.CATALOG))
        .thenReturn(Set.of("t1", "t2"));
    when(pushDispatchService.dispatch(
            Set.of("t1", "t2"),
            "Nuova canzone in catalogo",
            "Amazing Grace",
            "/songs",
            NotificationCategory.CATALOG))
        .thenReturn(new DispatchResult(1, 1));

    final SendOutcome outcome =
        service.emitEvent("catalog_song_created", Map.of("title", "Amazing Grace"));

    assertThat(outcome.recipients()).isEqualTo(3);
    assertThat(outcome.result()).isEqualTo(new DispatchResult(1, 1));
  }

  @Test
  void adminSendByRoleResolvesTheRequestedRole() {
    when(recipientResolver.resolve(new RecipientTarget.ByRole(UserRole.MINISTER)))
        .thenReturn(Set.of());
    when(tokenCollector.collectTokens(Set.of(), NotificationCategory.ANNOUNCEMENTS))
        .thenReturn(Set.of());
    when(pushDispatchService.dispatch(
            Set.of(), "Prove", "Prove sabato", null, NotificationCategory.ANNOUNCEMENTS))
        .thenReturn(DispatchResult.EMPTY);

    final SendOutcome outcome =
        service.adminSend("role", "minister", null, "Prove", "Prove sabato", null, "announcements");

    assertThat(outcome.recipients()).isZero();
    assertThat(outcome.result()).isEqualTo(DispatchResult.EMPTY);
  }

  @Test
  void adminSendToUsersPassesIdsVerbatim() {
    when(recipientResolver.resolve(new RecipientTarget.ExplicitUsers(List.of("u9"))))
        .thenReturn(Set.of("u9"));
    when(tokenCollector.collectTokens(Set.of("u9"), NotificationCategory.REMINDER))
        .thenReturn(Set.of("t9"));
    when(pushDispatchService.dispatch(
            Set.of("t9"), "Ciao", "Messaggio", "/x", NotificationCategory.REMINDER))
        .thenReturn(new DispatchResult(1, 0));

    final SendOutcome outcome =
        service.adminSend("users", null, List.of("u9"), "Ciao", "Messaggio", "/x", "reminder");

    assertThat(outcome.recipients()).isEqualTo(1);
  }

  @Test
  void adminSendRejectsUnknownTargetMode() {
    assertThatThrownBy(
            () -> service.adminSend("everyone", null, null, "t", "b", null, "reminder"))
        .isInstanceOf(UnsupportedTargetException.class);
    verifyNoInteractions(recipientResolver);
  }

  @Test
  void adminSendRejectsUnknownCategoryAndRole() {
    assertThatThrownBy(() -> service.adminSend("all", null, null, "t", "b", null, "gossip"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> service.adminSend("role", "guest", null, "t", "b", null, "reminder"))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(recipientResolver, pushDispatchService);
  }
}
