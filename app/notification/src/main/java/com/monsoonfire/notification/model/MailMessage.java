package com.monsoonfire.notification.model;

import java.time.Instant;
import java.util.Map;

/** Outbound mail document picked up by the external mailer. */
public record MailMessage(
    String mailId,
    String recipient,
    String subject,
    String textBody,
    Map<String, Object> data,
    Instant createdAt) {}
