package com.monsoonfire.notification.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/** One entry of the reservation storage notice history, stored as JSON. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageNoticeEntry(
    Instant at,
    String kind,
    String detail,
    StorageStatus status,
    Integer reminderOrdinal,
    Integer reminderCount,
    String failureCode) {}
