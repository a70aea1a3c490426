/*
 * どこで: Notification データアクセス
 * 何を: プライマリ/レプリカの JDBC テンプレートを読み取り一貫性で振り分ける
 * なぜ: EVENTUAL はレプリカ、STRONG はプライマリを読むため
 */
package com.inboxseq.notification.repository;

import com.inboxseq.notification.model.ReadConsistency;
import com.zaxxer.hikari.HikariDataSource;
import java.util.Objects;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public final class NotificationJdbcTemplates implements AutoCloseable {

  private final NamedParameterJdbcTemplate primary;
  private final NamedParameterJdbcTemplate replica;
  private final HikariDataSource replicaDataSource;

  private NotificationJdbcTemplates(
      NamedParameterJdbcTemplate primary,
      NamedParameterJdbcTemplate replica,
      HikariDataSource replicaDataSource) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.replica = Objects.requireNonNull(replica, "replica");
    this.replicaDataSource = replicaDataSource;
  }

  public static NotificationJdbcTemplates primaryOnly(NamedParameterJdbcTemplate primary) {
    return new NotificationJdbcTemplates(primary, primary, null);
  }

  public static NotificationJdbcTemplates withReplica(
      NamedParameterJdbcTemplate primary, HikariDataSource replicaDataSource) {
    return new NotificationJdbcTemplates(
        primary, new NamedParameterJdbcTemplate(replicaDataSource), replicaDataSource);
  }

  public NamedParameterJdbcTemplate primary() {
    return primary;
  }

  public NamedParameterJdbcTemplate forConsistency(ReadConsistency consistency) {
    return consistency == ReadConsistency.STRONG ? primary : replica;
  }

  public boolean hasReplica() {
    return replicaDataSource != null;
  }

  @Override
  public void close() {
    if (replicaDataSource != null) {
      replicaDataSource.close();
    }
  }
}
