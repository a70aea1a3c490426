/*
 * どこで: Notification データアクセス
 * 何を: notifications テーブルの範囲スキャンと insert-if-absent を担う
 * なぜ: 採番の排他を Postgres の主キー制約だけで成立させるため
 */
package com.inboxseq.notification.repository;

import static com.inboxseq.common.JdbcTimestampUtils.toInstant;
import static com.inboxseq.common.JdbcTimestampUtils.toTimestamp;

import com.inboxseq.notification.model.NotificationRecord;
import com.inboxseq.notification.model.ReadConsistency;
import com.inboxseq.notification.model.WriteOutcome;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.store.type",
    havingValue = "jdbc",
    matchIfMissing = true)
public class JdbcNotificationStore implements NotificationStore {

  private static final Logger logger = LoggerFactory.getLogger(JdbcNotificationStore.class);

  private static final String SELECT_COLUMNS =
      """
      SELECT user_id, notification_id, name, timestamp, sender_id, sender_device_id, op_id,
             badge, invalidate, activity_id, viewpoint_id, update_seq, viewed_seq
      FROM notifications
      """;

  private final NotificationJdbcTemplates jdbcTemplates;

  @Override
  public List<NotificationRecord> rangeQuery(NotificationRangeQuery query) {
    final StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE user_id = :userId\n");
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", query.userId())
            .addValue("limit", query.limit());
    if (query.fromId() != null) {
      sql.append("  AND notification_id >= :fromId\n");
      params.addValue("fromId", query.fromId());
    }
    if (query.toId() != null) {
      sql.append("  AND notification_id <= :toId\n");
      params.addValue("toId", query.toId());
    }
    sql.append("ORDER BY notification_id ")
        .append(query.direction() == ScanDirection.DESCENDING ? "DESC" : "ASC")
        .append("\nLIMIT :limit");
    return jdbcTemplates
        .forConsistency(query.consistency())
        .query(sql.toString(), params, this::mapRow);
  }

  @Override
  public WriteOutcome insertIfAbsent(NotificationRecord record) {
    // 例外ではなく更新件数で競合を判定し、呼び出し側のトランザクションを壊さない
    final String sql =
        """
        INSERT INTO notifications (
          user_id,
          notification_id,
          name,
          timestamp,
          sender_id,
          sender_device_id,
          op_id,
          badge,
          invalidate,
          activity_id,
          viewpoint_id,
          update_seq,
          viewed_seq
        ) VALUES (
          :userId,
          :notificationId,
          :name,
          :timestamp,
          :senderId,
          :senderDeviceId,
          :opId,
          :badge,
          :invalidate,
          :activityId,
          :viewpointId,
          :updateSeq,
          :viewedSeq
        )
        ON CONFLICT (user_id, notification_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", record.userId())
            .addValue("notificationId", record.notificationId())
            .addValue("name", record.name())
            .addValue("timestamp", toTimestamp(record.timestamp()))
            .addValue("senderId", record.senderId())
            .addValue("senderDeviceId", record.senderDeviceId())
            .addValue("opId", record.opId())
            .addValue("badge", record.badge())
            .addValue("invalidate", record.invalidateJson())
            .addValue("activityId", record.activityId())
            .addValue("viewpointId", record.viewpointId())
            .addValue("updateSeq", record.updateSeq())
            .addValue("viewedSeq", record.viewedSeq());
    try {
      final int inserted = jdbcTemplates.primary().update(sql, params);
      return inserted > 0 ? WriteOutcome.committed(record) : WriteOutcome.conflict();
    } catch (TransientDataAccessException | RecoverableDataAccessException ex) {
      logger.warn(
          "notification insert failed transiently userId={} notificationId={}",
          record.userId(),
          record.notificationId(),
          ex);
      return WriteOutcome.transientError(ex);
    } catch (DataAccessException ex) {
      return WriteOutcome.fatal(ex);
    }
  }

  @Override
  public Optional<NotificationRecord> findById(long userId, long notificationId) {
    final String sql = SELECT_COLUMNS + "WHERE user_id = :userId AND notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("notificationId", notificationId);
    return jdbcTemplates.forConsistency(ReadConsistency.STRONG).query(sql, params, this::mapRow).stream()
        .findFirst();
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getLong("user_id"),
        rs.getLong("notification_id"),
        rs.getString("name"),
        toInstant(rs.getTimestamp("timestamp")),
        rs.getLong("sender_id"),
        rs.getLong("sender_device_id"),
        rs.getString("op_id"),
        rs.getInt("badge"),
        rs.getString("invalidate"),
        rs.getString("activity_id"),
        rs.getString("viewpoint_id"),
        rs.getObject("update_seq", Long.class),
        rs.getObject("viewed_seq", Long.class));
  }
}
