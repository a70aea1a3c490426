/*
 * どこで: Notification サービス層
 * 何を: 無効化ペイロードのシリアライズ/復元失敗を示す例外
 * なぜ: 再試行しても回復しない入力不正として呼び出し側へ伝えるため
 */
package com.inboxseq.notification.service;

public class InvalidationEncodingException extends RuntimeException {

    public InvalidationEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
