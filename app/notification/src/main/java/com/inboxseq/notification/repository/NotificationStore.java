/*
 * どこで: Notification Repository 層
 * 何を: 範囲スキャンと条件付き作成だけを持つストア契約
 * なぜ: 採番プロトコルをストア実装 (Postgres / メモリ) から切り離すため
 */
package com.inboxseq.notification.repository;

import com.inboxseq.notification.model.NotificationRecord;
import com.inboxseq.notification.model.WriteOutcome;
import java.util.List;
import java.util.Optional;

public interface NotificationStore {

  /**
   * 役割: 1 ユーザーのパーティションを notification_id 順に走査する。 動作: 方向と件数上限を守った順序付きリストを返し、該当なしなら空リストを返す。
   * 前提: 読み取り一貫性は query.consistency() に従う。
   */
  List<NotificationRecord> rangeQuery(NotificationRangeQuery query);

  /**
   * 役割: (user_id, notification_id) が未使用の場合だけレコードを作成する。 動作: 作成できれば COMMITTED、既存行があれば
   * CONFLICT、接続断やタイムアウトは TRANSIENT_ERROR、それ以外は FATAL を返す。失敗時に副作用は残らない。
   */
  WriteOutcome insertIfAbsent(NotificationRecord record);

  /** 役割: 主キーで 1 件取得する。 動作: 常にプライマリを読む。 */
  Optional<NotificationRecord> findById(long userId, long notificationId);
}
