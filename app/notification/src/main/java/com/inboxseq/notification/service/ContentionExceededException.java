/*
 * どこで: Notification サービス層
 * 何を: 採番リトライが上限回数に達したことを示す例外
 * なぜ: 同一ユーザーへの書き込みが集中しても採番ループを打ち切るため
 */
package com.inboxseq.notification.service;

public class ContentionExceededException extends RuntimeException {

  private final long userId;
  private final int attempts;
  private final int conflicts;
  private final int transientErrors;

  public ContentionExceededException(
      long userId, int attempts, int conflicts, int transientErrors, Throwable lastTransientError) {
    super(
        "notification id allocation gave up userId="
            + userId
            + " attempts="
            + attempts
            + " conflicts="
            + conflicts
            + " transientErrors="
            + transientErrors,
        lastTransientError);
    this.userId = userId;
    this.attempts = attempts;
    this.conflicts = conflicts;
    this.transientErrors = transientErrors;
  }

  public long getUserId() {
    return userId;
  }

  public int getAttempts() {
    return attempts;
  }

  public int getConflicts() {
    return conflicts;
  }

  public int getTransientErrors() {
    return transientErrors;
  }
}
