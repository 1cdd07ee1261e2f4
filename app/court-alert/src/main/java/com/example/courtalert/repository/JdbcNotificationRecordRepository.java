/*
 * Where: Court alert data access
 * What: notification_records table, covered windows kept as a jsonb array
 * Why: The gate reads a subscription's recent records once per cycle
 */
package com.example.courtalert.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.courtalert.model.ConsolidatedWindow;
import com.example.courtalert.model.NotificationRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationRecordRepository implements NotificationRecordRepository {

  private static final TypeReference<List<CoveredWindowJson>> COVERED_WINDOWS =
      new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @Override
  public void append(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notification_records (
          record_id,
          subscription_id,
          sent_at,
          covered_windows
        ) VALUES (
          :recordId,
          :subscriptionId,
          :sentAt,
          :coveredWindows::jsonb
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recordId", record.recordId())
            .addValue("subscriptionId", record.subscriptionId())
            .addValue("sentAt", toTimestamp(record.sentAt()))
            .addValue("coveredWindows", writeWindows(record));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<NotificationRecord> queryRecords(String subscriptionId, Instant since) {
    final String sql =
        """
        SELECT record_id, subscription_id, sent_at, covered_windows::text AS covered_windows_text
        FROM notification_records
        WHERE subscription_id = :subscriptionId
          AND sent_at >= :since
        ORDER BY sent_at, record_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriptionId", subscriptionId)
            .addValue("since", toTimestamp(since));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final UUID recordId = rs.getObject("record_id", UUID.class);
    return new NotificationRecord(
        recordId,
        rs.getString("subscription_id"),
        toInstant(rs.getTimestamp("sent_at")),
        readWindows(rs.getString("covered_windows_text"), recordId));
  }

  private String writeWindows(NotificationRecord record) {
    try {
      return objectMapper.writeValueAsString(
          record.coveredWindows().stream().map(CoveredWindowJson::from).toList());
    } catch (JsonProcessingException ex) {
      throw new RepositoryJsonException("covered windows serialization failure", ex);
    }
  }

  private List<ConsolidatedWindow> readWindows(String json, UUID recordId) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, COVERED_WINDOWS).stream()
          .map(CoveredWindowJson::toModel)
          .toList();
    } catch (JsonProcessingException ex) {
      throw new RepositoryJsonException("covered windows are malformed recordId=" + recordId, ex);
    }
  }

  record CoveredWindowJson(
      @JsonProperty("source_id") String sourceId,
      @JsonProperty("court_id") String courtId,
      @JsonProperty("start") String start,
      @JsonProperty("end") String end) {

    static CoveredWindowJson from(ConsolidatedWindow window) {
      return new CoveredWindowJson(
          window.sourceId(), window.courtId(), window.start().toString(), window.end().toString());
    }

    ConsolidatedWindow toModel() {
      return new ConsolidatedWindow(sourceId, courtId, Instant.parse(start), Instant.parse(end));
    }
  }
}
