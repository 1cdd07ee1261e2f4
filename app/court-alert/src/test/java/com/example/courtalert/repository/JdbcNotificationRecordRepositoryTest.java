package com.example.courtalert.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.courtalert.AbstractPostgresContainerTest;
import com.example.courtalert.model.ConsolidatedWindow;
import com.example.courtalert.model.NotificationRecord;
import com.example.courtalert.support.Fixtures;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcNotificationRecordRepositoryTest extends AbstractPostgresContainerTest {

    private static final Instant BASE_TIME = Instant.parse("2026-10-18T08:00:00Z");
    private static final Duration GAP = Duration.ofHours(1);

    @Autowired
    private NotificationRecordRepository recordRepository;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM notification_records", new MapSqlParameterSource());
        jdbcTemplate.update("DELETE FROM subscriptions", new MapSqlParameterSource());
        subscriptionRepository.insert(Fixtures.tuesdayMorning("sub-1"));
        subscriptionRepository.insert(Fixtures.tuesdayMorning("sub-2"));
    }

    @Test
    void appendedRecordKeepsCoveredWindows() {
        List<ConsolidatedWindow> windows = List.of(
                Fixtures.window("A1", "10:00", "11:00"),
                Fixtures.window("A2", "10:30", "12:00"));
        NotificationRecord record = new NotificationRecord(UUID.randomUUID(), "sub-1", BASE_TIME, windows);

        recordRepository.append(record);

        assertThat(recordRepository.queryRecords("sub-1", BASE_TIME)).containsExactly(record);
    }

    @Test
    void queryRecordsFiltersBySubscriptionAndSinceInclusive() {
        NotificationRecord older = record("sub-1", BASE_TIME.minus(GAP));
        NotificationRecord atBoundary = record("sub-1", BASE_TIME);
        NotificationRecord newer = record("sub-1", BASE_TIME.plus(GAP));
        NotificationRecord otherSubscription = record("sub-2", BASE_TIME.plus(GAP));
        recordRepository.append(newer);
        recordRepository.append(older);
        recordRepository.append(atBoundary);
        recordRepository.append(otherSubscription);

        List<NotificationRecord> records = recordRepository.queryRecords("sub-1", BASE_TIME);

        assertThat(records).containsExactly(atBoundary, newer);
    }

    private NotificationRecord record(String subscriptionId, Instant sentAt) {
        return new NotificationRecord(
                UUID.randomUUID(), subscriptionId, sentAt, List.of(Fixtures.window("A1", "10:00", "11:00")));
    }
}
