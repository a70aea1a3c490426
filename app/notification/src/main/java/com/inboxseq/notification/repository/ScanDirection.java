/*
 * どこで: Notification データアクセス
 * 何を: notification_id のスキャン方向
 * なぜ: 最新 1 件取得と差分取得で同じ範囲クエリを使うため
 */
package com.inboxseq.notification.repository;

public enum ScanDirection {
  ASCENDING,
  DESCENDING
}
