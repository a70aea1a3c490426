/*
 * どこで: Notification ドメインモデル
 * 何を: viewpoint 側の update_seq / viewed_seq の組
 * なぜ: viewed_seq は操作したユーザー本人の通知にだけ載せるため
 */
package com.inboxseq.notification.model;

public record ViewpointSeqPair(long updateSeq, Long viewedSeq) {}
