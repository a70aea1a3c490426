/*
 * どこで: Notification サービス層
 * 何を: 採番結果/試行回数/リトライ理由/バッジクリア結果のメトリクスを記録する
 * なぜ: 同一ユーザーへの書き込み集中を Prometheus から観測できるようにするため
 */
package com.inboxseq.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationSequenceMetrics {

  static final String METRIC_ALLOCATION_TOTAL = "notification.sequence.allocation.total";
  static final String METRIC_ALLOCATION_ATTEMPTS = "notification.sequence.allocation.attempts";
  static final String METRIC_WRITE_RETRY_TOTAL = "notification.sequence.write.retry.total";
  static final String METRIC_BADGE_CLEAR_TOTAL = "notification.sequence.badge_clear.total";

  static final String RESULT_COMMITTED = "committed";
  static final String RESULT_CONTENTION_EXCEEDED = "contention_exceeded";
  static final String REASON_CONFLICT = "conflict";
  static final String REASON_TRANSIENT = "transient";
  static final String BADGE_CLEAR_CREATED = "created";
  static final String BADGE_CLEAR_DUPLICATE = "duplicate";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final DistributionSummary attemptsSummary;

  public NotificationSequenceMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.attemptsSummary =
        DistributionSummary.builder(METRIC_ALLOCATION_ATTEMPTS)
            .description("Write attempts needed to commit a notification id")
            .register(meterRegistry);
  }

  public void recordAllocationCommitted(int attempts) {
    counter(METRIC_ALLOCATION_TOTAL, "result", RESULT_COMMITTED, "Notification id allocation outcomes")
        .increment();
    attemptsSummary.record(attempts);
  }

  public void recordAllocationExhausted() {
    counter(
            METRIC_ALLOCATION_TOTAL,
            "result",
            RESULT_CONTENTION_EXCEEDED,
            "Notification id allocation outcomes")
        .increment();
  }

  public void recordConflictRetry() {
    counter(METRIC_WRITE_RETRY_TOTAL, "reason", REASON_CONFLICT, "Retried notification inserts")
        .increment();
  }

  public void recordTransientRetry() {
    counter(METRIC_WRITE_RETRY_TOTAL, "reason", REASON_TRANSIENT, "Retried notification inserts")
        .increment();
  }

  public void recordBadgeClear(boolean created) {
    final String result = created ? BADGE_CLEAR_CREATED : BADGE_CLEAR_DUPLICATE;
    counter(METRIC_BADGE_CLEAR_TOTAL, "result", result, "clear_badges marker outcomes")
        .increment();
  }

  private Counter counter(String name, String tagKey, String tagValue, String description) {
    return counters.computeIfAbsent(
        name + '|' + tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
