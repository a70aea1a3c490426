/*
 * どこで: 共通ユーティリティのユニットテスト
 * 何を: Instant と Timestamp の相互変換と null の扱いを検証する
 * なぜ: JDBC バインド時の時刻ずれや NPE を防ぐため
 */
package com.inboxseq.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00.123456Z");

  @Test
  void convertsBothDirectionsWithoutLosingMicros() {
    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(BASE_TIME);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(BASE_TIME);
  }

  @Test
  void nullStaysNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
