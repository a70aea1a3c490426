/*
 * どこで: Notification インフラ設定
 * 何を: 読み取り一貫性ごとの JDBC テンプレートを組み立てる
 * なぜ: JdbcNotificationStore がプライマリとレプリカを使い分けられるようにするため
 */
package com.inboxseq.notification.config;

import com.inboxseq.notification.repository.NotificationJdbcTemplates;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
@ConditionalOnProperty(
    name = "notification.store.type",
    havingValue = "jdbc",
    matchIfMissing = true)
public class NotificationStoreConfig {

  private static final Logger logger = LoggerFactory.getLogger(NotificationStoreConfig.class);
  private static final String REPLICA_POOL_NAME = "notification-replica";

  @Bean
  NotificationJdbcTemplates notificationJdbcTemplates(
      NamedParameterJdbcTemplate jdbcTemplate, NotificationStoreProperties properties) {
    final NotificationStoreProperties.Replica replica = properties.replica();
    if (replica == null || !replica.isConfigured()) {
      logger.info("notification store replica not configured; eventual reads use primary");
      return NotificationJdbcTemplates.primaryOnly(jdbcTemplate);
    }
    final HikariDataSource dataSource =
        DataSourceBuilder.create()
            .type(HikariDataSource.class)
            .url(replica.url())
            .username(replica.username())
            .password(replica.password())
            .build();
    dataSource.setPoolName(REPLICA_POOL_NAME);
    dataSource.setReadOnly(true);
    logger.info("notification store replica configured pool={}", REPLICA_POOL_NAME);
    return NotificationJdbcTemplates.withReplica(jdbcTemplate, dataSource);
  }
}
