package com.monsoonfire.notification.model;

import java.time.Instant;

public record DeviceToken(
    String tokenHash,
    String uid,
    String token,
    String platform,
    String environment,
    boolean active,
    String appVersion,
    String appBuild,
    String deviceModel,
    Instant createdAt,
    Instant updatedAt,
    Instant lastSeenAt,
    Instant deactivatedAt,
    String deactivationReason) {}
