/*
 * どこで: Notification ドメインモデル
 * 何を: notifications テーブルの 1 行 (user_id, notification_id) のスナップショット
 * なぜ: 採番/バッジクリア/参照で同じ不変レコードを共有するため
 */
package com.inboxseq.notification.model;

import java.time.Instant;

/**
 * ユーザーごとに採番された通知レコード。
 *
 * <p>作成後は更新されない。invalidateJson はシリアライズ済みの無効化ペイロードで、復元は {@code
 * InvalidationCodec} が遅延で行う。
 */
public record NotificationRecord(
    long userId,
    long notificationId,
    String name,
    Instant timestamp,
    long senderId,
    long senderDeviceId,
    String opId,
    int badge,
    String invalidateJson,
    String activityId,
    String viewpointId,
    Long updateSeq,
    Long viewedSeq) {

  public boolean hasInvalidate() {
    return invalidateJson != null;
  }
}
