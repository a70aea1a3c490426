/*
 * どこで: Notification サービス層
 * 何を: ユーザーごとの notification_id を最新 id + 1 で採番し、insert-if-absent で確定する
 * なぜ: ロックやカウンタを持たず、ストアの条件付き作成だけで重複なく採番するため
 */
package com.inboxseq.notification.service;

import com.inboxseq.notification.config.NotificationAllocationProperties;
import com.inboxseq.notification.model.CreateNotificationCommand;
import com.inboxseq.notification.model.NotificationRecord;
import com.inboxseq.notification.model.OperationContext;
import com.inboxseq.notification.model.ReadConsistency;
import com.inboxseq.notification.model.ViewpointSeqPair;
import com.inboxseq.notification.model.WriteOutcome;
import com.inboxseq.notification.repository.NotificationStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 通知の採番ループ。
 *
 * <p>各試行は「最新レコードの読み取り → 候補の組み立て → 条件付き作成」の順で、I/O はこの 2 回だけ。競合したら以降の読み取りを
 * STRONG に上げて次の id を狙う。負けた id を取り戻すことはない。
 *
 * <p>badge は読み取った直前レコードから引き継ぐため、同時に採番した 2 件が同じ badge になることがある。badge は未読数の目安であり、厳密な監査値としては扱わない。
 */
@Service
@RequiredArgsConstructor
public class NotificationAllocator {

  private static final Logger logger = LoggerFactory.getLogger(NotificationAllocator.class);

  private final NotificationReader reader;
  private final NotificationStore store;
  private final InvalidationCodec invalidationCodec;
  private final ContentionBackoff backoff;
  private final NotificationAllocationProperties properties;
  private final NotificationSequenceMetrics metrics;

  public NotificationRecord createForUser(CreateNotificationCommand command) {
    validate(command);
    final String invalidateJson =
        command.invalidate() == null ? null : invalidationCodec.encode(command.invalidate());
    ReadConsistency consistency =
        command.consistency() == null ? ReadConsistency.EVENTUAL : command.consistency();
    int conflicts = 0;
    int transientErrors = 0;
    RuntimeException lastTransientError = null;

    for (int attempt = 1; attempt <= properties.maxAttempts(); attempt++) {
      if (attempt > 1) {
        backoff.pause(attempt - 1);
      }
      final NotificationRecord last =
          reader.queryLast(command.userId(), consistency).orElse(null);
      final NotificationRecord candidate = buildCandidate(command, last, invalidateJson);
      final WriteOutcome outcome = store.insertIfAbsent(candidate);
      switch (outcome.status()) {
        case COMMITTED -> {
          metrics.recordAllocationCommitted(attempt);
          return outcome.record();
        }
        case CONFLICT -> {
          conflicts++;
          metrics.recordConflictRetry();
          logger.info(
              "notification id already in use userId={} notificationId={} attempt={}",
              candidate.userId(),
              candidate.notificationId(),
              attempt);
        }
        case TRANSIENT_ERROR -> {
          transientErrors++;
          lastTransientError = outcome.error();
          metrics.recordTransientRetry();
          logger.warn(
              "notification insert retry after transient error userId={} notificationId={} attempt={}",
              candidate.userId(),
              candidate.notificationId(),
              attempt);
        }
        case FATAL ->
            throw new NotificationStoreException(
                "notification insert failed userId="
                    + candidate.userId()
                    + " notificationId="
                    + candidate.notificationId(),
                outcome.error(),
                false);
        default -> throw new IllegalStateException("unexpected write outcome " + outcome.status());
      }
      // 古いレプリカを読み続けて同じ id に衝突しないよう、以降はプライマリを読む
      consistency = ReadConsistency.STRONG;
    }

    metrics.recordAllocationExhausted();
    logger.warn(
        "notification id allocation exhausted userId={} attempts={} conflicts={} transientErrors={}",
        command.userId(),
        properties.maxAttempts(),
        conflicts,
        transientErrors);
    throw new ContentionExceededException(
        command.userId(), properties.maxAttempts(), conflicts, transientErrors, lastTransientError);
  }

  private NotificationRecord buildCandidate(
      CreateNotificationCommand command, NotificationRecord last, String invalidateJson) {
    final long notificationId;
    try {
      notificationId = last == null ? 1L : Math.addExact(last.notificationId(), 1L);
    } catch (ArithmeticException ex) {
      throw new NotificationSequenceExhaustedException(
          "notification id reached Long.MAX_VALUE", command.userId(), ex);
    }
    int badge = last == null ? 0 : last.badge();
    if (command.incrementBadge()) {
      try {
        badge = Math.addExact(badge, 1);
      } catch (ArithmeticException ex) {
        throw new NotificationSequenceExhaustedException(
            "badge reached Integer.MAX_VALUE", command.userId(), ex);
      }
    }
    final OperationContext operation = command.operation();
    Long updateSeq = null;
    Long viewedSeq = null;
    final ViewpointSeqPair seqPair = command.seqPair();
    if (seqPair != null) {
      updateSeq = seqPair.updateSeq();
      // viewed_seq は操作したユーザー本人の通知にだけ載せる
      if (seqPair.viewedSeq() != null && operation.userId() == command.userId()) {
        viewedSeq = seqPair.viewedSeq();
      }
    }
    return new NotificationRecord(
        command.userId(),
        notificationId,
        command.name(),
        operation.timestamp(),
        operation.userId(),
        operation.deviceId(),
        operation.operationId(),
        badge,
        invalidateJson,
        command.activityId(),
        command.viewpointId(),
        updateSeq,
        viewedSeq);
  }

  private void validate(CreateNotificationCommand command) {
    if (command == null) {
      throw new InvalidNotificationRequestException("command is required");
    }
    if (command.operation() == null) {
      throw new InvalidNotificationRequestException("operation is required");
    }
    if (command.operation().timestamp() == null) {
      throw new InvalidNotificationRequestException("operation timestamp is required");
    }
    if (command.name() == null || command.name().isBlank()) {
      throw new InvalidNotificationRequestException("name is required");
    }
  }
}
