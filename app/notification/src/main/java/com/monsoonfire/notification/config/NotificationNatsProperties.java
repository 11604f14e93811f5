package com.monsoonfire.notification.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Inbound JetStream subscriptions: reservation writes and kiln firing updates. */
@ConfigurationProperties(prefix = "notification.nats")
@Validated
public record NotificationNatsProperties(
    @Valid @NotNull JetStreamSubscriptionProperties reservation,
    @Valid @NotNull JetStreamSubscriptionProperties kiln) {}
