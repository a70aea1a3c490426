/*
 * どこで: Notification サービス層
 * 何を: 採番競合後の待機時間 (指数 + ジッター) を計算して待機する
 * なぜ: 同じユーザーへ同時に書く呼び出し同士が同じ id で衝突し続けないようにするため
 */
package com.inboxseq.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.inboxseq.notification.config.NotificationAllocationProperties;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ContentionBackoff {

  private final NotificationAllocationProperties properties;

  /** retry は 1 始まりの再試行回数。 */
  public void pause(int retry) {
    final Duration backoff = computeBackoffDuration(retry);
    if (backoff.isZero()) {
      return;
    }
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new AllocationInterruptedException("interrupted during allocation backoff", ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int retry) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), retry - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }
}
