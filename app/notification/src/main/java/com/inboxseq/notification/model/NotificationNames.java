/*
 * どこで: Notification ドメインモデル
 * 何を: このモジュール自身が書き込む通知名
 * なぜ: 名前の表記揺れを防ぐため
 */
package com.inboxseq.notification.model;

public final class NotificationNames {
  private NotificationNames() {}

  public static final String CLEAR_BADGES = "clear_badges";
}
