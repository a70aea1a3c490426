/*
 * どこで: Notification アプリのスモークテスト
 * 何を: Postgres 構成で Spring コンテキストの起動を確認する
 * なぜ: Flyway migration と JDBC ストアの配線が壊れていないことを担保するため
 */
package com.inboxseq.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.inboxseq.notification.repository.JdbcNotificationStore;
import com.inboxseq.notification.repository.NotificationStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private NotificationStore store;

  @Test
  void contextLoadsWithJdbcStore() {
    assertThat(store).isInstanceOf(JdbcNotificationStore.class);
  }
}
