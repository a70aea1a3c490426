/*
 * どこで: Notification ドメインモデル
 * 何を: 条件付き作成 (insert-if-absent) の結果
 * なぜ: 競合/一時障害/恒久障害を呼び出し側で区別できるようにするため
 */
package com.inboxseq.notification.model;

import java.util.Objects;

public record WriteOutcome(Status status, NotificationRecord record, RuntimeException error) {

  public enum Status {
    COMMITTED,
    CONFLICT,
    TRANSIENT_ERROR,
    FATAL
  }

  public WriteOutcome {
    Objects.requireNonNull(status, "status");
  }

  public static WriteOutcome committed(NotificationRecord record) {
    return new WriteOutcome(Status.COMMITTED, Objects.requireNonNull(record, "record"), null);
  }

  public static WriteOutcome conflict() {
    return new WriteOutcome(Status.CONFLICT, null, null);
  }

  public static WriteOutcome transientError(RuntimeException error) {
    return new WriteOutcome(Status.TRANSIENT_ERROR, null, Objects.requireNonNull(error, "error"));
  }

  public static WriteOutcome fatal(RuntimeException error) {
    return new WriteOutcome(Status.FATAL, null, Objects.requireNonNull(error, "error"));
  }
}
