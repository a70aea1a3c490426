/*
 * どこで: Notification サービス層
 * 何を: ストア書き込みの失敗 (競合以外) を示す例外
 * なぜ: 呼び出し側が retryable で再試行可否を判断できるようにするため
 */
package com.inboxseq.notification.service;

public class NotificationStoreException extends RuntimeException {

    private final boolean retryable;

    public NotificationStoreException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
