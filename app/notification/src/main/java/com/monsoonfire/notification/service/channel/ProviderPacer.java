/*
 * Where: Notification channel layer
 * What: Per-provider minimum spacing between outbound calls
 * Why: Provider quotas are shared by every job on this instance
 */
package com.monsoonfire.notification.service.channel;

import com.google.common.util.concurrent.RateLimiter;
import com.monsoonfire.notification.config.ProviderPacingProperties;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProviderPacer {

  private final ProviderPacingProperties properties;
  private final ConcurrentMap<String, RateLimiter> limiters = new ConcurrentHashMap<>();

  /** Blocks until the provider's next slot; returns the seconds spent waiting. */
  public double acquire(String provider) {
    return limiters.computeIfAbsent(provider, this::createLimiter).acquire();
  }

  private RateLimiter createLimiter(String provider) {
    final Duration interval = properties.intervalFor(provider);
    if (interval.isZero() || interval.isNegative()) {
      return RateLimiter.create(Double.MAX_VALUE);
    }
    return RateLimiter.create(1_000_000_000.0 / interval.toNanos());
  }
}
