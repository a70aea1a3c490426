/*
 * どこで: Notification アプリの設定バインド
 * 何を: 昇順範囲読み取りの件数上限を保持する
 * なぜ: 1 回の読み取りでパーティション全体を走査しないようにするため
 */
package com.inboxseq.notification.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.query")
@Validated
public record NotificationQueryProperties(@NotNull @Positive Integer maxLimit) {}
