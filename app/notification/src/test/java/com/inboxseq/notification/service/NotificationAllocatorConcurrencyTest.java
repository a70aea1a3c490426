/*
 * どこで: NotificationAllocator / BadgeClearService の結合テスト (インメモリストア)
 * 何を: 実スレッドでの同時採番と、通知作成からバッジクリアまでの一連の流れを検証する
 * なぜ: ロックなしでも id の重複や欠番が出ないことを確認するため
 */
package com.inboxseq.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxseq.notification.config.NotificationAllocationProperties;
import com.inboxseq.notification.config.NotificationQueryProperties;
import com.inboxseq.notification.model.CreateNotificationCommand;
import com.inboxseq.notification.model.NotificationNames;
import com.inboxseq.notification.model.NotificationRecord;
import com.inboxseq.notification.model.OperationContext;
import com.inboxseq.notification.model.ReadConsistency;
import com.inboxseq.notification.repository.InMemoryNotificationStore;
import com.inboxseq.notification.repository.NotificationRangeQuery;
import com.inboxseq.notification.repository.ScanDirection;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationAllocatorConcurrencyTest {

  private static final Instant NOW = Instant.parse("2026-01-17T09:00:00Z");
  private static final long USER_ID = 42L;
  private static final long DEVICE_ID = 7L;
  private static final int CALLERS = 32;

  private InMemoryNotificationStore store;
  private NotificationReader reader;
  private NotificationAllocator allocator;
  private BadgeClearService badgeClearService;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    final NotificationAllocationProperties properties =
        new NotificationAllocationProperties(
            64, Duration.ofMillis(1), Duration.ofMillis(5), 2.0d, 0.5d, 1.5d);
    final NotificationSequenceMetrics metrics =
        new NotificationSequenceMetrics(new SimpleMeterRegistry());
    store = new InMemoryNotificationStore();
    reader = new NotificationReader(store, new NotificationQueryProperties(500));
    allocator =
        new NotificationAllocator(
            reader,
            store,
            new InvalidationCodec(new ObjectMapper()),
            new ContentionBackoff(properties),
            properties,
            metrics);
    badgeClearService =
        new BadgeClearService(store, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
    executor = Executors.newFixedThreadPool(8);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void concurrentCallersReceiveDistinctContiguousIds() throws Exception {
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<NotificationRecord>> futures = new ArrayList<>();
    for (int i = 0; i < CALLERS; i++) {
      final String opId = "op-" + i;
      futures.add(
          executor.submit(
              () -> {
                start.await();
                return allocator.createForUser(
                    CreateNotificationCommand.simple(
                        USER_ID, new OperationContext(USER_ID, DEVICE_ID, opId, NOW), "share", true));
              }));
    }
    start.countDown();

    final List<Long> ids = new ArrayList<>();
    for (Future<NotificationRecord> future : futures) {
      ids.add(future.get(30, TimeUnit.SECONDS).notificationId());
    }

    assertThat(ids).doesNotHaveDuplicates().hasSize(CALLERS);
    final List<NotificationRecord> stored =
        store.rangeQuery(
            new NotificationRangeQuery(
                USER_ID, null, null, CALLERS + 1, ScanDirection.ASCENDING, ReadConsistency.STRONG));
    assertThat(stored)
        .extracting(NotificationRecord::notificationId)
        .containsExactlyElementsOf(
            LongStream.rangeClosed(1, CALLERS).boxed().toList());
    for (int i = 1; i < stored.size(); i++) {
      assertThat(stored.get(i).badge()).isGreaterThanOrEqualTo(stored.get(i - 1).badge());
    }
  }

  @Test
  void shareCommentThenClearBadge() {
    final OperationContext operation = new OperationContext(USER_ID, DEVICE_ID, "op-1", NOW);

    final NotificationRecord share =
        allocator.createForUser(CreateNotificationCommand.simple(USER_ID, operation, "share", true));
    final NotificationRecord comment =
        allocator.createForUser(
            CreateNotificationCommand.simple(USER_ID, operation, "comment", true));

    assertThat(share.notificationId()).isEqualTo(1L);
    assertThat(share.badge()).isEqualTo(1);
    assertThat(comment.notificationId()).isEqualTo(2L);
    assertThat(comment.badge()).isEqualTo(2);

    assertThat(badgeClearService.tryClearBadge(USER_ID, DEVICE_ID, 5L)).isTrue();
    final NotificationRecord last = reader.queryLast(USER_ID, ReadConsistency.STRONG).orElseThrow();
    assertThat(last.notificationId()).isEqualTo(5L);
    assertThat(last.name()).isEqualTo(NotificationNames.CLEAR_BADGES);
    assertThat(last.badge()).isZero();
    assertThat(last.timestamp()).isEqualTo(NOW);

    assertThat(badgeClearService.tryClearBadge(USER_ID, DEVICE_ID, 5L)).isFalse();

    final NotificationRecord next =
        allocator.createForUser(CreateNotificationCommand.simple(USER_ID, operation, "share", true));
    assertThat(next.notificationId()).isEqualTo(6L);
    assertThat(next.badge()).isEqualTo(1);
  }

  @Test
  void allocationAfterMaximumClearIdFailsInsteadOfWrapping() {
    final OperationContext operation = new OperationContext(USER_ID, DEVICE_ID, "op-1", NOW);

    assertThat(badgeClearService.tryClearBadge(USER_ID, DEVICE_ID, Long.MAX_VALUE)).isTrue();

    assertThatThrownBy(
            () ->
                allocator.createForUser(
                    CreateNotificationCommand.simple(USER_ID, operation, "share", true)))
        .isInstanceOf(NotificationSequenceExhaustedException.class);
    assertThat(reader.queryLast(USER_ID, ReadConsistency.STRONG))
        .map(NotificationRecord::notificationId)
        .hasValue(Long.MAX_VALUE);
    assertThat(
            store.rangeQuery(
                new NotificationRangeQuery(
                    USER_ID, null, 0L, 10, ScanDirection.ASCENDING, ReadConsistency.STRONG)))
        .isEmpty();
  }
}
