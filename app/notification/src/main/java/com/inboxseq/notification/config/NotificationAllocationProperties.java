/*
 * どこで: Notification アプリの設定バインド
 * 何を: 採番リトライの上限回数とバックオフ設定を保持する
 * なぜ: 競合が続いたときに無限ループせず打ち切るため
 */
package com.inboxseq.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.allocation")
@Validated
public record NotificationAllocationProperties(
    @NotNull @Positive Integer maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax) {

  @AssertTrue(message = "notification.allocation.backoff-base must not be negative")
  public boolean isBackoffBaseNonNegative() {
    return backoffBase == null || !backoffBase.isNegative();
  }

  @AssertTrue(message = "notification.allocation.backoff-max must be >= backoff-base")
  public boolean isBackoffMaxNotBelowBase() {
    // null は @NotNull で検出する前提。
    return backoffBase == null || backoffMax == null || backoffMax.compareTo(backoffBase) >= 0;
  }

  @AssertTrue(message = "notification.allocation.backoff-exponent-base must be >= 1.0")
  public boolean isExponentBaseValid() {
    return backoffExponentBase >= 1.0d;
  }

  @AssertTrue(message = "notification.allocation.backoff-jitter-min/max must satisfy 0 <= min <= max")
  public boolean isJitterRangeValid() {
    return backoffJitterMin >= 0.0d && backoffJitterMin <= backoffJitterMax;
  }
}
