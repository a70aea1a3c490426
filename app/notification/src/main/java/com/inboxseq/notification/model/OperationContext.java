/*
 * どこで: Notification ドメインモデル
 * 何を: 通知を発生させた操作の識別子と時刻
 * なぜ: sender/op_id/timestamp を呼び出し側から受け取るため
 */
package com.inboxseq.notification.model;

import java.time.Instant;

public record OperationContext(long userId, long deviceId, String operationId, Instant timestamp) {}
