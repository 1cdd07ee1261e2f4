/*
 * Where: Court alert data access
 * What: subscriptions table on PostgreSQL, preferences kept in jsonb columns
 */
package com.example.courtalert.repository;

import com.example.courtalert.model.PreferredTime;
import com.example.courtalert.model.SourcePreference;
import com.example.courtalert.model.Subscription;
import com.example.courtalert.model.SubscriptionStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcSubscriptionRepository implements SubscriptionRepository {

  private static final Logger logger = LoggerFactory.getLogger(JdbcSubscriptionRepository.class);

  private static final TypeReference<List<SourcePreferenceJson>> SOURCE_PREFERENCES =
      new TypeReference<>() {};
  private static final TypeReference<List<PreferredTimeJson>> PREFERRED_TIMES =
      new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @Override
  public List<Subscription> listActive() {
    final String sql =
        """
        SELECT subscription_id, owner_id, recipient,
               source_preferences::text AS source_preferences_text,
               preferred_times::text AS preferred_times_text,
               min_slot_duration_minutes, expiry_date,
               max_notifications_per_day, notification_frequency_hours, status
        FROM subscriptions
        WHERE status = 'ACTIVE'
        ORDER BY subscription_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapReadableRow).stream()
        .flatMap(Optional::stream)
        .toList();
  }

  @Override
  public int expireOverdue(LocalDate today) {
    final String sql =
        """
        UPDATE subscriptions
        SET status = 'EXPIRED',
            updated_at = CURRENT_TIMESTAMP
        WHERE status = 'ACTIVE'
          AND expiry_date IS NOT NULL
          AND expiry_date < :today
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("today", Date.valueOf(today)));
  }

  @Override
  public void insert(Subscription subscription) {
    final String sql =
        """
        INSERT INTO subscriptions (
          subscription_id,
          owner_id,
          recipient,
          source_preferences,
          preferred_times,
          min_slot_duration_minutes,
          expiry_date,
          max_notifications_per_day,
          notification_frequency_hours,
          status
        ) VALUES (
          :subscriptionId,
          :ownerId,
          :recipient,
          :sourcePreferences::jsonb,
          :preferredTimes::jsonb,
          :minSlotDurationMinutes,
          :expiryDate,
          :maxNotificationsPerDay,
          :notificationFrequencyHours,
          :status
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriptionId", subscription.id())
            .addValue("ownerId", subscription.ownerId())
            .addValue("recipient", subscription.recipient())
            .addValue("sourcePreferences", write(subscription.sourcePreferences().stream()
                .map(SourcePreferenceJson::from)
                .toList()))
            .addValue("preferredTimes", write(subscription.preferredTimes().stream()
                .map(PreferredTimeJson::from)
                .toList()))
            .addValue("minSlotDurationMinutes", subscription.minSlotDurationMinutes())
            .addValue(
                "expiryDate",
                subscription.expiryDate() == null ? null : Date.valueOf(subscription.expiryDate()))
            .addValue("maxNotificationsPerDay", subscription.maxNotificationsPerDay())
            .addValue("notificationFrequencyHours", subscription.notificationFrequencyHours())
            .addValue("status", subscription.status().name());
    jdbcTemplate.update(sql, params);
  }

  // a corrupt row is left out so the remaining subscriptions are still served
  private Optional<Subscription> mapReadableRow(ResultSet rs, int rowNum) throws SQLException {
    try {
      return Optional.of(mapRow(rs, rowNum));
    } catch (RepositoryJsonException | DateTimeException | IllegalArgumentException ex) {
      logger.error(
          "subscription row skipped, needs review subscriptionId={} error={}",
          rs.getString("subscription_id"),
          ex.getMessage(),
          ex);
      return Optional.empty();
    }
  }

  private Subscription mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String subscriptionId = rs.getString("subscription_id");
    final Set<SourcePreference> sourcePreferences = new LinkedHashSet<>();
    for (SourcePreferenceJson json :
        read(rs.getString("source_preferences_text"), SOURCE_PREFERENCES, subscriptionId)) {
      sourcePreferences.add(json.toModel());
    }
    final Set<PreferredTime> preferredTimes = new LinkedHashSet<>();
    for (PreferredTimeJson json :
        read(rs.getString("preferred_times_text"), PREFERRED_TIMES, subscriptionId)) {
      preferredTimes.add(json.toModel());
    }
    final Date expiryDate = rs.getDate("expiry_date");
    return new Subscription(
        subscriptionId,
        rs.getString("owner_id"),
        rs.getString("recipient"),
        sourcePreferences,
        preferredTimes,
        rs.getInt("min_slot_duration_minutes"),
        expiryDate == null ? null : expiryDate.toLocalDate(),
        rs.getInt("max_notifications_per_day"),
        rs.getInt("notification_frequency_hours"),
        SubscriptionStatus.valueOf(rs.getString("status")));
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new RepositoryJsonException("subscription json serialization failure", ex);
    }
  }

  private <T> List<T> read(String json, TypeReference<List<T>> type, String subscriptionId) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new RepositoryJsonException("subscription json is malformed id=" + subscriptionId, ex);
    }
  }

  record SourcePreferenceJson(
      @JsonProperty("source_id") String sourceId,
      @JsonProperty("court_ids") List<String> courtIds) {

    static SourcePreferenceJson from(SourcePreference preference) {
      return new SourcePreferenceJson(
          preference.sourceId(), preference.courtIds().stream().sorted().toList());
    }

    SourcePreference toModel() {
      return new SourcePreference(sourceId, courtIds == null ? Set.of() : Set.copyOf(courtIds));
    }
  }

  record PreferredTimeJson(
      @JsonProperty("day_of_week") String dayOfWeek,
      @JsonProperty("start_time") String startTime,
      @JsonProperty("end_time") String endTime) {

    static PreferredTimeJson from(PreferredTime preferredTime) {
      return new PreferredTimeJson(
          preferredTime.dayOfWeek().name(),
          preferredTime.startTime().toString(),
          preferredTime.endTime().toString());
    }

    PreferredTime toModel() {
      if (dayOfWeek == null || startTime == null || endTime == null) {
        throw new IllegalArgumentException("preferred time is incomplete");
      }
      return new PreferredTime(
          DayOfWeek.valueOf(dayOfWeek), LocalTime.parse(startTime), LocalTime.parse(endTime));
    }
  }
}
