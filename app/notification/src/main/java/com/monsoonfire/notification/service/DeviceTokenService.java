/*
 * Where: Notification service layer
 * What: Registers, unregisters and expires push device tokens
 * Why: A token is identified by the digest of its whitespace-stripped value, so the raw token is
 *      never needed to address it again
 */
package com.monsoonfire.notification.service;

import com.monsoonfire.common.DedupeHashes;
import com.monsoonfire.notification.config.NotificationRetentionProperties;
import com.monsoonfire.notification.model.DeviceToken;
import com.monsoonfire.notification.repository.DeviceTokenRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeviceTokenService {

  private static final Logger logger = LoggerFactory.getLogger(DeviceTokenService.class);
  static final String PLATFORM_IOS = "ios";
  static final String REASON_UNREGISTERED = "USER_UNREGISTERED";
  static final String REASON_STALE = "STALE_TOKEN_TIMEOUT";
  private static final Set<String> ENVIRONMENTS = Set.of("sandbox", "production");

  private final DeviceTokenRepository deviceTokenRepository;
  private final NotificationRetentionProperties retentionProperties;
  private final Clock clock;

  /** Upserts the token for the user and returns its hash. */
  public String register(String uid, Registration registration) {
    final String token = normalizeToken(registration.token());
    if (token.isEmpty()) {
      throw new IllegalArgumentException("token is required");
    }
    final String environment =
        registration.environment() == null
            ? "production"
            : registration.environment().trim().toLowerCase(Locale.ROOT);
    if (!ENVIRONMENTS.contains(environment)) {
      throw new IllegalArgumentException("environment must be sandbox or production");
    }
    final Instant now = Instant.now(clock);
    final String tokenHash = hashToken(token);
    deviceTokenRepository.upsertRegistration(
        new DeviceToken(
            tokenHash,
            uid,
            token,
            PLATFORM_IOS,
            environment,
            true,
            trimToNull(registration.appVersion()),
            trimToNull(registration.appBuild()),
            trimToNull(registration.deviceModel()),
            now,
            now,
            now,
            null,
            null));
    logger.info("device token registered uid={} tokenHash={}", uid, tokenHash);
    return tokenHash;
  }

  /** Deactivates by raw token or by hash; returns the number of tokens deactivated. */
  public int unregister(String uid, String token, String tokenHash) {
    final String resolvedHash;
    if (tokenHash != null && !tokenHash.isBlank()) {
      resolvedHash = tokenHash.trim();
    } else if (token != null && !normalizeToken(token).isEmpty()) {
      resolvedHash = hashToken(normalizeToken(token));
    } else {
      throw new IllegalArgumentException("token or tokenHash is required");
    }
    final int updated =
        deviceTokenRepository.deactivate(
            uid, List.of(resolvedHash), REASON_UNREGISTERED, Instant.now(clock));
    logger.info(
        "device token unregistered uid={} tokenHash={} updated={}", uid, resolvedHash, updated);
    return updated;
  }

  public int deactivateStaleTokens() {
    final Instant now = Instant.now(clock);
    final Instant cutoff = now.minus(retentionProperties.staleDeviceTokenAge());
    final int deactivated =
        deviceTokenRepository.deactivateStale(
            cutoff, retentionProperties.staleDeviceTokenLimit(), REASON_STALE, now);
    logger.info("stale device tokens deactivated count={} cutoff={}", deactivated, cutoff);
    return deactivated;
  }

  static String normalizeToken(String raw) {
    return raw == null ? "" : raw.replaceAll("\\s+", "");
  }

  static String hashToken(String normalizedToken) {
    return DedupeHashes.sha256Hex(normalizedToken);
  }

  private static String trimToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  public record Registration(
      String token, String environment, String appVersion, String appBuild, String deviceModel) {}
}
