/*
 * Where: Court alert lease
 * What: Lease row in engine_leases claimed with a single upsert
 * Why: Another replica takes over once the holder stops renewing before the lease runs out
 */
package com.example.courtalert.lease;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.courtalert.config.LeaseProperties;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "court-alert.engine.lease.mode", havingValue = "jdbc")
public class JdbcCycleLease implements CycleLease {

  private static final Logger logger = LoggerFactory.getLogger(JdbcCycleLease.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final LeaseProperties properties;

  @Override
  public boolean tryAcquire(String holder, Instant now, Instant leaseUntil) {
    // the conflict branch only fires for an expired lease or a renewal by the same holder
    final String sql =
        """
        INSERT INTO engine_leases (lease_name, locked_by, locked_at, lease_until)
        VALUES (:leaseName, :holder, :now, :leaseUntil)
        ON CONFLICT (lease_name) DO UPDATE
        SET locked_by = EXCLUDED.locked_by,
            locked_at = EXCLUDED.locked_at,
            lease_until = EXCLUDED.lease_until
        WHERE engine_leases.lease_until <= :now
           OR engine_leases.locked_by = :holder
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("leaseName", properties.name())
            .addValue("holder", holder)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    final boolean acquired = jdbcTemplate.update(sql, params) > 0;
    if (!acquired) {
      logger.debug("cycle lease held by another instance lease={} holder={}", properties.name(), holder);
    }
    return acquired;
  }

  @Override
  public void release(String holder) {
    final String sql =
        """
        DELETE FROM engine_leases
        WHERE lease_name = :leaseName
          AND locked_by = :holder
        """;
    jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("leaseName", properties.name())
            .addValue("holder", holder));
  }
}
