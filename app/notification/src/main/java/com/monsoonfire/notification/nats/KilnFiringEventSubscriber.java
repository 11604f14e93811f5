package com.monsoonfire.notification.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.monsoonfire.common.event.KilnFiringEventPayload;
import com.monsoonfire.notification.config.NotificationNatsProperties;
import com.monsoonfire.notification.service.event.KilnUnloadEventHandler;
import io.nats.client.Connection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class KilnFiringEventSubscriber extends JetStreamEventSubscriber<KilnFiringEventPayload> {

  private final KilnUnloadEventHandler eventHandler;

  public KilnFiringEventSubscriber(
      Connection connection,
      ObjectMapper objectMapper,
      NotificationNatsProperties properties,
      KilnUnloadEventHandler eventHandler) {
    super(connection, objectMapper, properties.kiln(), KilnFiringEventPayload.class);
    this.eventHandler = eventHandler;
  }

  @Override
  protected void handle(KilnFiringEventPayload event) {
    eventHandler.handle(event);
  }
}
