package com.monsoonfire.notification.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.common.event.ReservationEventPayload;
import com.monsoonfire.notification.config.NotificationNatsProperties;
import com.monsoonfire.notification.service.event.ReservationEventHandler;
import io.nats.client.Connection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Reservation document writes. */
@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class ReservationEventSubscriber extends JetStreamEventSubscriber<ReservationEventPayload> {

  private final ReservationEventHandler eventHandler;

  public ReservationEventSubscriber(
      Connection connection,
      ObjectMapper objectMapper,
      NotificationNatsProperties properties,
      ReservationEventHandler eventHandler) {
    super(connection, objectMapper, properties.reservation(), ReservationEventPayload.class);
    this.eventHandler = eventHandler;
  }

  @Override
  protected void handle(ReservationEventPayload event) {
    eventHandler.handle(event);
  }
}
