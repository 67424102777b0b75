package io.upreview.backend.ledger;

import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** Aggregate queries over {@code recipient_actions}. */
@Repository
public class EngagementStatisticsRepository {

  private final JdbcClient jdbc;

  public EngagementStatisticsRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  public EngagementStatistics load(UUID businessId) {
    FunnelCounts funnel =
        jdbc.sql(
                """
                SELECT
                  (SELECT count(*) FROM recipients r WHERE r.business_id = :businessId)
                      AS total_recipients,
                  count(DISTINCT ra.recipient_id) FILTER (WHERE ra.action = 'INVITED') AS invited,
                  count(DISTINCT ra.recipient_id) FILTER (WHERE ra.action = 'CLICKED') AS clicked,
                  count(DISTINCT ra.recipient_id) FILTER (WHERE ra.action = 'SUBMITTED')
                      AS submitted
                FROM recipient_actions ra
                WHERE ra.business_id = :businessId
                """)
            .param("businessId", businessId)
            .query(
                (rs, rowNum) ->
                    new FunnelCounts(
                        rs.getLong("total_recipients"),
                        rs.getLong("invited"),
                        rs.getLong("clicked"),
                        rs.getLong("submitted")))
            .single();

    ClickLatency latency =
        jdbc.sql(
                """
                WITH latest_invite AS (
                  SELECT recipient_id, max(created_at) AS invited_at
                  FROM recipient_actions
                  WHERE business_id = :businessId AND action = 'INVITED'
                  GROUP BY recipient_id
                ),
                first_click AS (
                  SELECT li.recipient_id, li.invited_at, min(ra.created_at) AS clicked_at
                  FROM latest_invite li
                  JOIN recipient_actions ra
                    ON ra.business_id = :businessId
                   AND ra.recipient_id = li.recipient_id
                   AND ra.action = 'CLICKED'
                   AND ra.created_at >= li.invited_at
                  GROUP BY li.recipient_id, li.invited_at
                )
                SELECT count(*) AS considered,
                       avg(extract(EPOCH FROM (clicked_at - invited_at))) AS avg_seconds
                FROM first_click
                """)
            .param("businessId", businessId)
            .query(
                (rs, rowNum) -> {
                  double avg = rs.getDouble("avg_seconds");
                  return new ClickLatency(rs.getLong("considered"), rs.wasNull() ? null : avg);
                })
            .single();

    return new EngagementStatistics(
        funnel.total(),
        funnel.invited(),
        funnel.clicked(),
        funnel.submitted(),
        latency.considered(),
        latency.averageSeconds());
  }

  private record FunnelCounts(long total, long invited, long clicked, long submitted) {}

  private record ClickLatency(long considered, Double averageSeconds) {}
}
