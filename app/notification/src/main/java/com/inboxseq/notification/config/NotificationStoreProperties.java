/*
 * どこで: Notification アプリの設定バインド
 * 何を: ストア種別と EVENTUAL 読み取り用レプリカ接続を保持する
 * なぜ: 環境ごとに Postgres / メモリ、レプリカ有無を切り替えるため
 */
package com.inboxseq.notification.config;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.store")
@Validated
public record NotificationStoreProperties(@NotNull StoreType type, Replica replica) {

  public enum StoreType {
    JDBC,
    MEMORY
  }

  /** url が空ならレプリカなしとしてプライマリを読む。 */
  public record Replica(String url, String username, String password) {

    public boolean isConfigured() {
      return url != null && !url.isBlank();
    }
  }
}
