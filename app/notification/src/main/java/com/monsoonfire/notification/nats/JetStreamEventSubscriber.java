/*
 * Where: Notification NATS subscriptions
 * What: Durable JetStream push consumer that decodes JSON envelopes and hands them to a handler
 * Why: ack, nak and term decisions are the same for every inbound event stream
 */
package com.monsoonfire.notification.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.monsoonfire.notification.config.JetStreamSubscriptionProperties;
import com.monsoonfire.notification.service.event.NotificationEventPermanentException;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Base for the inbound event subscribers.
 *
 * <p>Malformed payloads and {@link NotificationEventPermanentException} terminate the message.
 * Database failures and any other runtime error nak it so JetStream redelivers up to {@code
 * max-deliver} times.
 */
public abstract class JetStreamEventSubscriber<T> {

  private static final Logger logger = LoggerFactory.getLogger(JetStreamEventSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final ObjectMapper objectMapper;
  private final JetStreamSubscriptionProperties properties;
  private final Class<T> payloadType;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  protected JetStreamEventSubscriber(
      Connection connection,
      ObjectMapper objectMapper,
      JetStreamSubscriptionProperties properties,
      Class<T> payloadType) {
    this.connection = connection;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.payloadType = payloadType;
  }

  /** Handles one decoded event; runs on the NATS dispatcher thread. */
  protected abstract void handle(T event);

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "event subscriber started type={} subject={} stream={} durable={}",
          payloadType.getSimpleName(),
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
    started.set(false);
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    final T event;
    try {
      event = objectMapper.readValue(message.getData(), payloadType);
    } catch (IOException ex) {
      logger.warn(
          "failed to parse event payload subject={} type={}",
          message.getSubject(),
          payloadType.getSimpleName(),
          ex);
      termSilently(message);
      return;
    }
    if (event == null) {
      logger.warn("empty event payload subject={}", message.getSubject());
      termSilently(message);
      return;
    }
    try {
      handle(event);
      message.ack();
    } catch (NotificationEventPermanentException ex) {
      logger.warn("permanent failure while handling event subject={}", message.getSubject(), ex);
      termSilently(message);
    } catch (DataAccessException ex) {
      logger.warn("temporary failure while handling event subject={}", message.getSubject(), ex);
      nakSilently(message);
    } catch (RuntimeException ex) {
      // unknown failures are redelivered rather than dropped
      logger.warn("failed to handle event subject={}", message.getSubject(), ex);
      nakSilently(message);
    }
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    // the stream carries the Nats-Msg-Id duplicate window, so it is created if missing
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info(
        "event stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private static boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private static void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nak nats message", ex);
    }
  }

  private static void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term nats message", ex);
    }
  }
}
