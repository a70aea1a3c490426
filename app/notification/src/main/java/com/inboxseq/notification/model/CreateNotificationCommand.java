/*
 * どこで: Notification ドメインモデル
 * 何を: 通知採番 (createForUser) の入力一式
 * なぜ: 引数の多い採番呼び出しを 1 つの値にまとめるため
 */
package com.inboxseq.notification.model;

import java.util.Map;

/**
 * @param invalidate null なら無効化ペイロードを持たない通知になる
 * @param seqPair null なら update_seq / viewed_seq を設定しない
 * @param consistency 最初の読み取りの一貫性。null は EVENTUAL 扱い
 */
public record CreateNotificationCommand(
    long userId,
    OperationContext operation,
    String name,
    Map<String, Object> invalidate,
    String activityId,
    String viewpointId,
    ViewpointSeqPair seqPair,
    boolean incrementBadge,
    ReadConsistency consistency) {

  public static CreateNotificationCommand simple(
      long userId, OperationContext operation, String name, boolean incrementBadge) {
    return new CreateNotificationCommand(
        userId, operation, name, null, null, null, null, incrementBadge, ReadConsistency.EVENTUAL);
  }
}
