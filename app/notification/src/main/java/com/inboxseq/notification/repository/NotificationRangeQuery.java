/*
 * どこで: Notification データアクセス
 * 何を: ユーザー単位の notification_id 範囲スキャン条件
 * なぜ: ストア実装ごとに同じ条件を解釈させるため
 */
package com.inboxseq.notification.repository;

import com.inboxseq.notification.model.ReadConsistency;
import java.util.Objects;

/**
 * @param fromId 下限 (含む)。null なら下限なし
 * @param toId 上限 (含む)。null なら上限なし
 */
public record NotificationRangeQuery(
    long userId,
    Long fromId,
    Long toId,
    int limit,
    ScanDirection direction,
    ReadConsistency consistency) {

  public NotificationRangeQuery {
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(consistency, "consistency");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
  }

  public static NotificationRangeQuery last(long userId, ReadConsistency consistency) {
    return new NotificationRangeQuery(userId, null, null, 1, ScanDirection.DESCENDING, consistency);
  }
}
