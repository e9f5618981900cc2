package com.worshipteam.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.worshipteam.notification.AbstractPostgresContainerTest;
import com.worshipteam.notification.model.UserRecord;
import com.worshipteam.notification.model.UserRole;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class UserRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private UserRepository userRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void seed() {
    jdbcTemplate.update("DELETE FROM users", new MapSqlParameterSource());
    insertUser("root-1", true, "root", null);
    insertUser("minister-1", true, "minister", "person-m");
    insertUser("member-1", true, "member", "person-1");
    insertUser("member-2", false, "member", "person-2");
  }

  @Test
  void activeUsersExcludeInactiveOnes() {
    assertThat(userRepository.findActiveUserIds())
        .containsExactlyInAnyOrder("root-1", "minister-1", "member-1");
  }

  @Test
  void activeUsersByRole() {
    assertThat(userRepository.findActiveUserIdsByRole(UserRole.ROOT)).containsExactly("root-1");
    assertThat(userRepository.findActiveUserIdsByRole(UserRole.MEMBER))
        .containsExactly("member-1");
  }

  @Test
  void activeUsersByLinkedPersons() {
    assertThat(
            userRepository.findActiveUserIdsByLinkedPersonIds(
                List.of("person-1", "person-2", "person-m")))
        .containsExactlyInAnyOrder("member-1", "minister-1");
  }

  @Test
  void findByUserIdMapsRole() {
    assertThat(userRepository.findByUserId("minister-1"))
        .contains(new UserRecord("minister-1", true, UserRole.MINISTER));
    assertThat(userRepository.findByUserId("missing")).isEmpty();
  }

  private void insertUser(String userId, boolean active, String role, String linkedPersonId) {
    jdbcTemplate.update(
        """
        INSERT INTO users (user_id, active, role, linked_person_id)
        VALUES (:userId, :active, :role, :linkedPersonId)
        """,
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("active", active)
            .addValue("role", role)
            .addValue("linkedPersonId", linkedPersonId));
  }
}
