/*
 * どこで: Notification サービス層
 * 何を: ユーザーの最新通知と、指定 id より後の通知を読み出す
 * なぜ: 採番の起点 (最新 id/badge) と下流の差分取得を同じ範囲スキャンで賄うため
 */
package com.inboxseq.notification.service;

import com.inboxseq.notification.config.NotificationQueryProperties;
import com.inboxseq.notification.model.NotificationRecord;
import com.inboxseq.notification.model.ReadConsistency;
import com.inboxseq.notification.repository.NotificationRangeQuery;
import com.inboxseq.notification.repository.NotificationStore;
import com.inboxseq.notification.repository.ScanDirection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationReader {

  private final NotificationStore store;
  private final NotificationQueryProperties properties;

  public Optional<NotificationRecord> queryLast(long userId) {
    return queryLast(userId, ReadConsistency.EVENTUAL);
  }

  /** notification_id 最大のレコード。通知が 1 件もなければ empty。 */
  public Optional<NotificationRecord> queryLast(long userId, ReadConsistency consistency) {
    final List<NotificationRecord> records =
        store.rangeQuery(NotificationRangeQuery.last(userId, consistency));
    return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
  }

  /** afterNotificationId より大きい id を昇順で最大 limit 件返す。 */
  public List<NotificationRecord> queryAfter(
      long userId, long afterNotificationId, int limit, ReadConsistency consistency) {
    if (limit <= 0 || limit > properties.maxLimit()) {
      throw new InvalidNotificationRequestException(
          "limit must be between 1 and " + properties.maxLimit());
    }
    if (consistency == null) {
      throw new InvalidNotificationRequestException("consistency is required");
    }
    if (afterNotificationId == Long.MAX_VALUE) {
      return List.of();
    }
    return store.rangeQuery(
        new NotificationRangeQuery(
            userId, afterNotificationId + 1, null, limit, ScanDirection.ASCENDING, consistency));
  }
}
