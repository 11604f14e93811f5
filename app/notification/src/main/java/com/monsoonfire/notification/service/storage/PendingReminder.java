package com.monsoonfire.notification.service.storage;

import com.monsoonfire.notification.model.StorageStatus;

/**
 * A pickup reminder the policy wants enqueued. {@code reminderOrdinal} is null for the
 * missed-window notice.
 */
public record PendingReminder(
    String dedupeKey,
    Integer reminderOrdinal,
    String reason,
    String policyWindowLabel,
    StorageStatus previousStatus) {}
