package com.monsoonfire.notification.model;

import java.time.Instant;

public record StorageAuditRecord(
    String auditId,
    String reservationId,
    String uid,
    String action,
    String reason,
    StorageStatus fromStatus,
    StorageStatus toStatus,
    Integer reminderOrdinal,
    Integer reminderCount,
    String failureCode,
    Instant at) {}
