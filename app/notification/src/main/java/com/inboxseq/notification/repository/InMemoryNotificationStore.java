/*
 * どこで: Notification データアクセス
 * 何を: プロセス内メモリで NotificationStore 契約を満たす実装
 * なぜ: DB なしでローカル起動や並行採番の検証を行うため
 */
package com.inboxseq.notification.repository;

import com.inboxseq.notification.model.NotificationRecord;
import com.inboxseq.notification.model.WriteOutcome;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "notification.store.type", havingValue = "memory")
public class InMemoryNotificationStore implements NotificationStore {

  private final ConcurrentMap<Long, ConcurrentNavigableMap<Long, NotificationRecord>> partitions =
      new ConcurrentHashMap<>();

  // 単一プロセス内では常に最新が見えるため consistency は区別しない
  @Override
  public List<NotificationRecord> rangeQuery(NotificationRangeQuery query) {
    final ConcurrentNavigableMap<Long, NotificationRecord> partition =
        partitions.get(query.userId());
    if (partition == null) {
      return List.of();
    }
    final long from = query.fromId() == null ? Long.MIN_VALUE : query.fromId();
    final long to = query.toId() == null ? Long.MAX_VALUE : query.toId();
    if (from > to) {
      return List.of();
    }
    NavigableMap<Long, NotificationRecord> range = partition.subMap(from, true, to, true);
    if (query.direction() == ScanDirection.DESCENDING) {
      range = range.descendingMap();
    }
    return range.values().stream().limit(query.limit()).toList();
  }

  @Override
  public WriteOutcome insertIfAbsent(NotificationRecord record) {
    // notifications テーブルの CHECK 制約と同じ条件
    if (record.notificationId() < 1 || record.badge() < 0) {
      return WriteOutcome.fatal(
          new DataIntegrityViolationException(
              "notification row violates check constraint userId="
                  + record.userId()
                  + " notificationId="
                  + record.notificationId()
                  + " badge="
                  + record.badge()));
    }
    final NotificationRecord existing =
        partitions
            .computeIfAbsent(record.userId(), ignored -> new ConcurrentSkipListMap<>())
            .putIfAbsent(record.notificationId(), record);
    return existing == null ? WriteOutcome.committed(record) : WriteOutcome.conflict();
  }

  @Override
  public Optional<NotificationRecord> findById(long userId, long notificationId) {
    final ConcurrentNavigableMap<Long, NotificationRecord> partition = partitions.get(userId);
    return partition == null ? Optional.empty() : Optional.ofNullable(partition.get(notificationId));
  }
}
