/*
 * Where: Notification data access
 * What: Read-only queries over the users table
 * Why: Recipient resolution and role-tier checks filter users by activity, role and linked person
 */
package com.worshipteam.notification.repository;

import com.worshipteam.notification.config.StoreProperties;
import com.worshipteam.notification.model.UserRecord;
import com.worshipteam.notification.model.UserRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final StoreProperties storeProperties;

  public Optional<UserRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, active, role
        FROM users
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<String> findActiveUserIds() {
    final String sql = "SELECT user_id FROM users WHERE active = TRUE";
    return jdbcTemplate.queryForList(sql, new MapSqlParameterSource(), String.class);
  }

  public List<String> findActiveUserIdsByRole(UserRole role) {
    final String sql =
        """
        SELECT user_id
        FROM users
        WHERE active = TRUE
          AND role = :role
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("role", role.value());
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  /** The caller batches person ids to the store's IN-list limit. */
  public List<String> findActiveUserIdsByLinkedPersonIds(Collection<String> personIds) {
    StoreLimits.checkInValues(personIds, storeProperties);
    if (personIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT user_id
        FROM users
        WHERE active = TRUE
          AND linked_person_id IN (:personIds)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("personIds", personIds);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getString("user_id"),
        rs.getBoolean("active"),
        UserRole.fromValue(rs.getString("role")).orElse(null));
  }
}
