package com.solanaeda.eventbus.producer;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rabbitmq.client.AMQP;
import com.solanaeda.eventbus.EventBusException;
import com.solanaeda.eventbus.PublishException;
import com.solanaeda.eventbus.config.BrokerSettings;
import com.solanaeda.eventbus.connection.ConnectionManager;
import com.solanaeda.eventbus.envelope.EnvelopeCodec;
import com.solanaeda.eventbus.envelope.EnvelopeFactory;
import com.solanaeda.eventbus.envelope.EventEnvelope;
import com.solanaeda.eventbus.envelope.MessageHeaders;
import com.solanaeda.eventbus.envelope.RoutingKeys;
import com.solanaeda.eventbus.topology.EventTopology;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes {@link EventEnvelope}s to the events exchange with {@code mandatory=true}. With
 * publisher confirms on, {@code publish} returns only after the broker has acked the message.
 */
public class EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

  public static final String WORKER_STATUS_TYPE = "WORKER_STATUS";
  public static final String CUSTOM_TYPE = "CUSTOM";

  private final ConnectionManager connectionManager;
  private final EnvelopeFactory envelopeFactory;
  private final EnvelopeCodec codec;
  private final EventTopology topology;
  private final BrokerSettings settings;
  private final PublisherStats stats = new PublisherStats();

  public EventPublisher(ConnectionManager connectionManager, EnvelopeFactory envelopeFactory,
                        EnvelopeCodec codec, EventTopology topology) {
    this.connectionManager = connectionManager;
    this.envelopeFactory = envelopeFactory;
    this.codec = codec;
    this.topology = topology;
    this.settings = connectionManager.settings();
  }

  public EventPublisher bindMetrics(MeterRegistry registry) {
    stats.bindTo(registry);
    return this;
  }

  public EventEnvelope publish(String eventType, Object data) {
    return publish(eventType, data, PublishOptions.defaults());
  }

  public EventEnvelope publish(String eventType, Object data, PublishOptions options) {
    EventEnvelope envelope = envelopeFactory.create(eventType, data, options.routingKey(),
        options.correlationId(), options.causationId());
    if (topology != null && settings.getExchangeName().equals(topology.eventsExchange().getName())
        && topology.routes(envelope.routingKey()).isEmpty()) {
      log.warn("Routing key {} matches no queue binding; broker will return {}", envelope.routingKey(), envelope.id());
    }
    send(settings.getExchangeName(), envelope, options, options.headers());
    return envelope;
  }

  /**
   * Worker heartbeat/status, routed as {@code worker.<name>.<status>}.
   */
  public EventEnvelope publishStatus(String workerName, WorkerStatus status, Map<String, ?> data) {
    ObjectNode node = codec.mapper().createObjectNode();
    if (data != null) node.setAll((ObjectNode) codec.mapper().valueToTree(data));
    node.put("workerName", workerName);
    node.put("status", status.name());
    PublishOptions options = PublishOptions.defaults()
        .withRoutingKey(RoutingKeys.forWorkerStatus(workerName, status.name()));
    return publish(WORKER_STATUS_TYPE, node, options);
  }

  public EventEnvelope publishToExchange(String exchange, String routingKey, Object data, PublishOptions options) {
    EventEnvelope envelope = envelopeFactory.create(CUSTOM_TYPE, data, routingKey,
        options.correlationId(), options.causationId());
    send(exchange, envelope, options, options.headers());
    return envelope;
  }

  /**
   * Sends an existing envelope again, unchanged, with extra headers. Used for dead-letter retry.
   */
  public void republish(EventEnvelope envelope, Map<String, Object> headers) {
    send(settings.getExchangeName(), envelope, PublishOptions.defaults(), headers);
  }

  private void send(String exchange, EventEnvelope envelope, PublishOptions options, Map<String, Object> headers) {
    byte[] body = codec.encode(envelope);
    AMQP.BasicProperties props = properties(envelope, options, headers);
    stats.started();
    String outerEventId = MDC.get("eventId");
    String outerCorrelationId = MDC.get("correlationId");
    MDC.put("eventId", envelope.id());
    MDC.put("correlationId", envelope.correlationId());
    try {
      awaitWritable();
      CompletableFuture<Void> confirm = connectionManager.publish(exchange, envelope.routingKey(), true, props, body);
      confirm.get(settings.getConfirmTimeout().toMillis(), TimeUnit.MILLISECONDS);
      stats.confirmed();
      log.debug("Published {} to {} with key {}", envelope.type(), exchange, envelope.routingKey());
    } catch (ExecutionException e) {
      stats.failed();
      Throwable cause = e.getCause();
      log.error("Publish of {} failed: {}", envelope.type(), cause.getMessage());
      throw cause instanceof PublishException pe ? pe : new PublishException("Publish of " + envelope.id() + " failed", cause);
    } catch (TimeoutException e) {
      stats.failed();
      log.error("Publish of {} timed out waiting for confirm after {}ms", envelope.type(), settings.getConfirmTimeout().toMillis());
      throw new PublishException("Timed out waiting for confirm of " + envelope.id(), e);
    } catch (InterruptedException e) {
      stats.failed();
      Thread.currentThread().interrupt();
      throw new PublishException("Interrupted while publishing " + envelope.id(), e);
    } catch (IOException | EventBusException e) {
      stats.failed();
      log.error("Publish of {} failed: {}", envelope.type(), e.getMessage());
      throw e instanceof PublishException pe ? pe : new PublishException("Publish of " + envelope.id() + " failed", e);
    } finally {
      restoreMdc("eventId", outerEventId);
      restoreMdc("correlationId", outerCorrelationId);
    }
  }

  // a handler publishing from inside a delivery keeps the delivery's MDC
  private static void restoreMdc(String key, String value) {
    if (value == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, value);
    }
  }

  private void awaitWritable() throws InterruptedException {
    if (!connectionManager.awaitWritable(settings.getConfirmTimeout())) {
      throw new PublishException("Connection blocked by broker flow control");
    }
  }

  private static AMQP.BasicProperties properties(EventEnvelope envelope, PublishOptions options, Map<String, Object> headers) {
    AMQP.BasicProperties.Builder b = new AMQP.BasicProperties.Builder()
        .contentType(MessageHeaders.CONTENT_TYPE)
        .contentEncoding(MessageHeaders.CONTENT_ENCODING)
        .deliveryMode(options.persistent() ? 2 : 1)
        .messageId(envelope.id())
        .correlationId(envelope.correlationId())
        .timestamp(envelope.timestamp() != null ? Date.from(envelope.timestamp()) : new Date())
        .type(envelope.type())
        .headers(headers == null || headers.isEmpty() ? null : new HashMap<>(headers));
    if (options.priority() != null) b.priority(options.priority());
    if (options.expiration() != null) b.expiration(Long.toString(options.expiration().toMillis()));
    return b.build();
  }

  public PublisherMetrics getMetrics() { return stats.snapshot(); }

  public void resetMetrics() { stats.reset(); }
}
