package com.solanaeda.eventbus.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.solanaeda.eventbus.EnvelopeFormatException;
import com.solanaeda.eventbus.EventBusException;
import com.solanaeda.eventbus.connection.ConnectionManager;
import com.solanaeda.eventbus.envelope.EnvelopeCodec;
import com.solanaeda.eventbus.envelope.EventEnvelope;
import com.solanaeda.eventbus.envelope.MessageHeaders;
import com.solanaeda.eventbus.topology.DeadLetterRoute;
import com.solanaeda.eventbus.topology.EventTopology;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Subscribes handlers to queues on the shared channel and turns handler outcomes into
 * ack / requeue / dead-letter decisions.
 */
public class EventConsumer {
  private static final Logger log = LoggerFactory.getLogger(EventConsumer.class);

  /** Deliveries whose {@code x-retry-count} reached this value are dead-lettered when the handler fails. */
  public static final int MAX_RETRY_COUNT = 3;

  private final ConnectionManager connectionManager;
  private final EnvelopeCodec codec;
  private final EventTopology topology;
  private final int defaultPrefetch;
  private final ConsumerStats stats = new ConsumerStats();
  private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

  private record Subscription(String queue, MessageHandler handler, ConsumerOptions options) {}

  public EventConsumer(ConnectionManager connectionManager, EnvelopeCodec codec, EventTopology topology) {
    this.connectionManager = connectionManager;
    this.codec = codec;
    this.topology = topology;
    this.defaultPrefetch = connectionManager.settings().getPrefetchCount();
  }

  public EventConsumer bindMetrics(MeterRegistry registry, String name) {
    stats.bindTo(registry, name);
    return this;
  }

  public String consume(String queueName, MessageHandler handler) {
    return consume(queueName, handler, ConsumerOptions.manual(defaultPrefetch));
  }

  public String consume(String queueName, MessageHandler handler, boolean manualAck, int prefetch) {
    return consume(queueName, handler, new ConsumerOptions(manualAck, prefetch, null));
  }

  /**
   * Sets the prefetch for this subscription and starts consuming.
   *
   * @return the consumer tag
   */
  public String consume(String queueName, MessageHandler handler, ConsumerOptions options) {
    Subscription sub = new Subscription(queueName, handler, options);
    String tag = subscribe(sub, options.consumerTag());
    subscriptions.put(tag, sub);
    log.info("Started consumer {} on queue {} (prefetch={}, manualAck={})", tag, queueName,
        options.prefetch(), options.manualAck());
    return tag;
  }

  private String subscribe(Subscription sub, String consumerTag) {
    Channel ch = connectionManager.getChannel();
    try {
      synchronized (ch) {
        // per-consumer limit; applies to the basicConsume that follows
        ch.basicQos(sub.options().prefetch(), false);
        return ch.basicConsume(sub.queue(), !sub.options().manualAck(), consumerTag == null ? "" : consumerTag,
            (tag, delivery) -> onDelivery(sub, ch, delivery),
            tag -> onCancelled(tag, sub));
      }
    } catch (IOException e) {
      throw new EventBusException("Failed to start consumer for queue " + sub.queue(), e);
    }
  }

  private void onDelivery(Subscription sub, Channel ch, Delivery delivery) {
    EventEnvelope envelope;
    try {
      envelope = codec.decode(delivery.getBody());
    } catch (EnvelopeFormatException e) {
      stats.malformed();
      log.error("Discarding malformed message from {}: {}", sub.queue(), e.getMessage());
      if (sub.options().manualAck()) settleMalformed(sub.queue(), ch, delivery, e.getMessage());
      return;
    }

    stats.started();
    DeliveryAcknowledgement ack = new DeliveryAcknowledgement(this, ch, delivery, sub.queue(),
        sub.options().manualAck(), stats);
    MDC.put("eventId", envelope.id());
    MDC.put("correlationId", envelope.correlationId());
    MDC.put("queue", sub.queue());
    try {
      sub.handler().handle(envelope, ack);
      if (!sub.options().manualAck() && !ack.isSettled()) ack.ack();
    } catch (Exception e) {
      onHandlerFailure(envelope, ack, e);
    } finally {
      MDC.remove("eventId");
      MDC.remove("correlationId");
      MDC.remove("queue");
    }
  }

  private void onHandlerFailure(EventEnvelope envelope, DeliveryAcknowledgement ack, Exception e) {
    if (ack.isSettled()) {
      log.warn("Handler for {} failed after settling the message: {}", envelope.type(), e.getMessage());
      return;
    }
    int retryCount = ack.retryCount();
    if (isNonRetryable(e)) {
      log.warn("Handler rejected {} ({}): {}", envelope.type(), envelope.id(), e.getMessage());
      ack.reject(reason(e));
    } else if (retryCount >= MAX_RETRY_COUNT) {
      log.error("Handler failed for {} ({}) after {} retries, dead-lettering: {}", envelope.type(), envelope.id(),
          retryCount, e.getMessage());
      ack.reject(reason(e));
    } else {
      log.warn("Handler failed for {} ({}), requeueing (retryCount={}): {}", envelope.type(), envelope.id(),
          retryCount, e.getMessage());
      ack.nack(true);
    }
  }

  static boolean isNonRetryable(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof AmqpRejectAndDontRequeueException) return true;
    }
    return false;
  }

  private static String reason(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private void settleMalformed(String queue, Channel ch, Delivery delivery, String reason) {
    long tag = delivery.getEnvelope().getDeliveryTag();
    try {
      if (deadLetter(queue, delivery, "malformed envelope: " + reason)) {
        ch.basicAck(tag, false);
      } else {
        ch.basicNack(tag, false, false);
      }
    } catch (IOException | RuntimeException e) {
      log.error("Failed to settle malformed delivery {} on {}: {}", tag, queue, e.getMessage());
    }
  }

  /**
   * Publishes the raw delivery to the dead-letter route of {@code queue} with failure headers.
   *
   * @return false when the queue has no dead-letter route or the publish was not confirmed;
   *     the caller then falls back to {@code basicNack(requeue=false)}
   */
  boolean deadLetter(String queue, Delivery delivery, String reason) {
    Optional<DeadLetterRoute> route = topology.deadLetterRouteFor(queue);
    if (route.isEmpty()) return false;
    AMQP.BasicProperties original = delivery.getProperties();
    Map<String, Object> headers = new HashMap<>(MessageHeaders.headers(original));
    headers.put(MessageHeaders.ERROR_REASON, reason);
    headers.put(MessageHeaders.ORIGINAL_QUEUE, queue);
    headers.putIfAbsent(MessageHeaders.FIRST_FAILURE_AT, Instant.now().toString());
    AMQP.BasicProperties props = original.builder().headers(headers).build();
    try {
      connectionManager.publish(route.get().exchange(), route.get().routingKey(), false, props, delivery.getBody())
          .get(connectionManager.settings().getConfirmTimeout().toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted dead-lettering message from {}", queue);
      return false;
    } catch (Exception e) {
      log.warn("Dead-letter publish from {} failed, falling back to broker dead-lettering: {}", queue, e.getMessage());
      return false;
    }
  }

  private void onCancelled(String tag, Subscription sub) {
    if (subscriptions.remove(tag) != null) {
      log.warn("Consumer {} on {} was cancelled by the broker", tag, sub.queue());
    }
  }

  public void cancel(String consumerTag) {
    Subscription sub = subscriptions.remove(consumerTag);
    if (sub == null) throw new IllegalArgumentException("Consumer " + consumerTag + " not found");
    if (connectionManager.isConnected()) {
      Channel ch = connectionManager.getChannel();
      try {
        synchronized (ch) {
          ch.basicCancel(consumerTag);
        }
      } catch (IOException e) {
        throw new EventBusException("Failed to cancel consumer " + consumerTag, e);
      }
    }
    log.info("Stopped consumer {} on {}", consumerTag, sub.queue());
  }

  public void cancelAll() {
    for (String tag : new ArrayList<>(subscriptions.keySet())) {
      try {
        cancel(tag);
      } catch (RuntimeException e) {
        log.error("Error cancelling consumer {}: {}", tag, e.getMessage());
      }
    }
  }

  /**
   * Re-registers every subscription on the current channel under its previous consumer tag.
   * Called after a reconnect; the broker forgets consumers of a closed channel.
   */
  public void resubscribeAll() {
    List<Map.Entry<String, Subscription>> current = new ArrayList<>(subscriptions.entrySet());
    for (Map.Entry<String, Subscription> e : current) {
      try {
        subscribe(e.getValue(), e.getKey());
        log.info("Resubscribed consumer {} on {}", e.getKey(), e.getValue().queue());
      } catch (RuntimeException ex) {
        log.error("Failed to resubscribe consumer {} on {}: {}", e.getKey(), e.getValue().queue(), ex.getMessage());
      }
    }
  }

  public boolean isActive() { return !subscriptions.isEmpty(); }

  public int getConsumerCount() { return subscriptions.size(); }

  public boolean isSubscribed(String consumerTag) { return subscriptions.containsKey(consumerTag); }

  public ConsumerMetrics getMetrics() { return stats.snapshot(); }

  public void resetMetrics() { stats.reset(); }
}
