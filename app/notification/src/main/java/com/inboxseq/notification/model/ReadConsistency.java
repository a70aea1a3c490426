/*
 * どこで: Notification ドメインモデル
 * 何を: 範囲スキャンの読み取り一貫性レベル
 * なぜ: 競合後だけ強い一貫性の読み取りへ切り替えるため
 */
package com.inboxseq.notification.model;

public enum ReadConsistency {
  /** レプリカ読み取り。直前の書き込みが見えない場合がある。 */
  EVENTUAL,
  /** プライマリ読み取り。成功済みの書き込みはすべて見える。 */
  STRONG
}
