/*
 * どこで: Notification サービス層
 * 何を: notification_id または badge が long/int の上限に達して次の値を採番できないことを示す例外
 * なぜ: 桁あふれした負の id/badge を書き込まずに採番を打ち切るため
 */
package com.inboxseq.notification.service;

public class NotificationSequenceExhaustedException extends RuntimeException {

  private final long userId;

  public NotificationSequenceExhaustedException(String message, long userId, Throwable cause) {
    super(message + " userId=" + userId, cause);
    this.userId = userId;
  }

  public long getUserId() {
    return userId;
  }
}
