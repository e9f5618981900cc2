/*
 * Where: Notification data access
 * What: Read-only access to services and their song entries
 * Why: Reminder eligibility is derived from the services scheduled on a date
 */
package com.worshipteam.notification.repository;

import com.worshipteam.notification.model.WorshipServiceRecord;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class WorshipServiceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<WorshipServiceRecord> findByDate(LocalDate date) {
    final String sql =
        """
        SELECT service_id, name, service_date, start_time
        FROM services
        WHERE service_date = :serviceDate
        ORDER BY start_time, service_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("serviceDate", Date.valueOf(date));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public boolean hasSongs(String serviceId) {
    final String sql =
        "SELECT EXISTS (SELECT 1 FROM service_songs WHERE service_id = :serviceId)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("serviceId", serviceId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  private WorshipServiceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new WorshipServiceRecord(
        rs.getString("service_id"),
        rs.getString("name"),
        rs.getDate("service_date").toLocalDate(),
        rs.getString("start_time"));
  }
}
