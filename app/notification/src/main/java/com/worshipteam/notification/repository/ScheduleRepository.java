/*
 * Where: Notification data access
 * What: Read-only access to monthly schedules and their assignments
 * Why: Link-based targeting and the monthly reminder depend on the roster
 */
package com.worshipteam.notification.repository;

import com.worshipteam.notification.model.ScheduleAssignment;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduleRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean existsByMonth(String month) {
    final String sql = "SELECT EXISTS (SELECT 1 FROM schedules WHERE month = :month)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("month", month);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /** Assignments for one service in the schedule of {@code month}; empty if either is missing. */
  public List<ScheduleAssignment> findAssignments(String month, String serviceId) {
    final String sql =
        """
        SELECT a.service_id, a.person_id, a.position_id
        FROM schedule_assignments a
        JOIN schedules s ON s.schedule_id = a.schedule_id
        WHERE s.month = :month
          AND a.service_id = :serviceId
        ORDER BY a.position_id, a.person_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("month", month).addValue("serviceId", serviceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Assignments for one service, whichever schedule lists it. */
  public List<ScheduleAssignment> findAssignmentsByServiceId(String serviceId) {
    final String sql =
        """
        SELECT service_id, person_id, position_id
        FROM schedule_assignments
        WHERE service_id = :serviceId
        ORDER BY position_id, person_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("serviceId", serviceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private ScheduleAssignment mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ScheduleAssignment(
        rs.getString("service_id"), rs.getString("person_id"), rs.getString("position_id"));
  }
}
