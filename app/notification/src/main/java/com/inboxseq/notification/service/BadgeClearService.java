/*
 * どこで: Notification サービス層
 * 何を: 呼び出し側が決めた id で clear_badges 通知を 1 回だけ作成する
 * なぜ: 同じバッジクリア要求が繰り返されても通知を 1 件に畳むため
 */
package com.inboxseq.notification.service;

import com.inboxseq.notification.model.NotificationNames;
import com.inboxseq.notification.model.NotificationRecord;
import com.inboxseq.notification.model.WriteOutcome;
import com.inboxseq.notification.repository.NotificationStore;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BadgeClearService {

  private static final Logger logger = LoggerFactory.getLogger(BadgeClearService.class);

  private final NotificationStore store;
  private final NotificationSequenceMetrics metrics;
  private final Clock clock;

  /**
   * 作成できたら true、同じ id の通知が既にあれば false。リトライはしない。
   *
   * @throws NotificationStoreException 競合以外の書き込み失敗。isRetryable() で一時障害かを判別できる
   */
  public boolean tryClearBadge(long userId, long deviceId, long notificationId) {
    if (notificationId <= 0) {
      throw new InvalidNotificationRequestException("notificationId must be positive");
    }
    final NotificationRecord record =
        new NotificationRecord(
            userId,
            notificationId,
            NotificationNames.CLEAR_BADGES,
            Instant.now(clock),
            userId,
            deviceId,
            null,
            0,
            null,
            null,
            null,
            null,
            null);
    final WriteOutcome outcome = store.insertIfAbsent(record);
    return switch (outcome.status()) {
      case COMMITTED -> {
        metrics.recordBadgeClear(true);
        yield true;
      }
      case CONFLICT -> {
        metrics.recordBadgeClear(false);
        logger.info(
            "clear_badges notification already exists userId={} notificationId={}",
            userId,
            notificationId);
        yield false;
      }
      case TRANSIENT_ERROR, FATAL ->
          throw new NotificationStoreException(
              "clear_badges insert failed userId=" + userId + " notificationId=" + notificationId,
              outcome.error(),
              outcome.status() == WriteOutcome.Status.TRANSIENT_ERROR);
    };
  }
}
