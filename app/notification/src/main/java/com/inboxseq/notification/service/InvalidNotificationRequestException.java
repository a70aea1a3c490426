/*
 * どこで: Notification サービス層
 * 何を: 採番/参照の入力不正を示す例外
 * なぜ: ストアへ到達する前に恒久的な失敗として弾くため
 */
package com.inboxseq.notification.service;

public class InvalidNotificationRequestException extends RuntimeException {

    public InvalidNotificationRequestException(String message) {
        super(message);
    }
}
