/*
 * どこで: Notification サービス層
 * 何を: リトライ待機中の割り込みを示す例外
 * なぜ: 割り込みフラグを戻したうえで採番を中断するため
 */
package com.inboxseq.notification.service;

public class AllocationInterruptedException extends RuntimeException {

    public AllocationInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
