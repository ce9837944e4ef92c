package com.solanaeda.eventbus.dlq;

import com.solanaeda.eventbus.PublishException;
import com.solanaeda.eventbus.consumer.Acknowledgement;
import com.solanaeda.eventbus.consumer.ConsumerOptions;
import com.solanaeda.eventbus.consumer.EventConsumer;
import com.solanaeda.eventbus.envelope.EventEnvelope;
import com.solanaeda.eventbus.envelope.MessageHeaders;
import com.solanaeda.eventbus.producer.EventPublisher;
import com.solanaeda.eventbus.retry.FailureClassifier;
import com.solanaeda.eventbus.retry.RetryPolicies;
import com.solanaeda.eventbus.topology.EventQueue;
import com.solanaeda.eventbus.topology.QueueInfo;
import com.solanaeda.eventbus.topology.TopologyBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains the dead-letter queue of one domain queue. Transient failures are republished to the
 * events exchange with an incremented {@code x-retry-count}; everything else goes to the
 * {@link PermanentFailureHook}. The dead letter is acked once it has been handled.
 */
public class DeadLetterHandler {
  private static final Logger log = LoggerFactory.getLogger(DeadLetterHandler.class);

  public static final String UNKNOWN_QUEUE = "unknown";
  static final String TRANSACTION_FAILED = "TRANSACTION_FAILED";

  private final EventConsumer consumer;
  private final EventPublisher publisher;
  private final TopologyBuilder topologyBuilder;
  private final EventQueue sourceQueue;
  private final DeadLetterOptions options;
  private final Clock clock;
  private final RetryTemplate republishRetry = RetryPolicies.IMMEDIATE.toRetryTemplate();
  private final AtomicLong retried = new AtomicLong();
  private final AtomicLong permanentFailures = new AtomicLong();
  private final AtomicLong skipped = new AtomicLong();

  private String consumerTag; // guarded by this

  public DeadLetterHandler(EventConsumer consumer, EventPublisher publisher, TopologyBuilder topologyBuilder,
                           EventQueue sourceQueue, DeadLetterOptions options) {
    this(consumer, publisher, topologyBuilder, sourceQueue, options, Clock.systemUTC());
  }

  public DeadLetterHandler(EventConsumer consumer, EventPublisher publisher, TopologyBuilder topologyBuilder,
                           EventQueue sourceQueue, DeadLetterOptions options, Clock clock) {
    this.consumer = consumer;
    this.publisher = publisher;
    this.topologyBuilder = topologyBuilder;
    this.sourceQueue = sourceQueue;
    this.options = options;
    this.clock = clock;
  }

  public String queueName() { return sourceQueue.deadLetterQueueName(); }

  public EventQueue sourceQueue() { return sourceQueue; }

  public synchronized void start() {
    if (isRunning()) {
      log.warn("Already processing {}", queueName());
      return;
    }
    consumerTag = consumer.consume(queueName(), this::onMessage, ConsumerOptions.manual(options.prefetch()));
    log.info("Started processing {}", queueName());
  }

  /**
   * Stops consumption. A dead letter already being handled still completes.
   */
  public synchronized void stop() {
    if (consumerTag == null) return;
    String tag = consumerTag;
    consumerTag = null;
    if (consumer.isSubscribed(tag)) {
      try {
        consumer.cancel(tag);
      } catch (RuntimeException e) {
        log.warn("Error stopping {}: {}", queueName(), e.getMessage());
      }
    }
    log.info("Stopped processing {}", queueName());
  }

  public synchronized boolean isRunning() {
    return consumerTag != null && consumer.isSubscribed(consumerTag);
  }

  void onMessage(EventEnvelope envelope, Acknowledgement ack) {
    try {
      DLQMessage message = toDlqMessage(envelope, ack.headers());
      if (!belongsHere(message)) {
        skipped.incrementAndGet();
        log.debug("Skipping dead letter {} from {} on {}", envelope.id(), message.originalQueue(), queueName());
        ack.ack();
        return;
      }
      log.info("Processing failed message from {}: type={}, retryCount={}, errorReason={}",
          message.originalQueue(), envelope.type(), message.retryCount(), message.errorReason());

      if (analyzeFailure(message) && message.retryCount() < options.maxRetryAttempts()) {
        retryOrGiveUp(message);
      } else {
        handlePermanentFailure(message);
      }
      ack.ack();
    } catch (RuntimeException e) {
      log.error("Error processing message from {}, discarding: {}", queueName(), e.getMessage(), e);
      ack.ack();
    }
  }

  DLQMessage toDlqMessage(EventEnvelope envelope, Map<String, Object> headers) {
    Map<?, ?> death = MessageHeaders.latestDeath(headers);
    String originalQueue = firstNonNull(
        MessageHeaders.stringHeader(headers, MessageHeaders.ORIGINAL_QUEUE),
        death.get("queue") != null ? String.valueOf(death.get("queue")) : null,
        MessageHeaders.stringHeader(headers, MessageHeaders.FIRST_DEATH_QUEUE),
        UNKNOWN_QUEUE);
    String reason = firstNonNull(
        MessageHeaders.stringHeader(headers, MessageHeaders.ERROR_REASON),
        MessageHeaders.stringHeader(headers, MessageHeaders.FIRST_DEATH_REASON),
        death.get("reason") != null ? String.valueOf(death.get("reason")) : null,
        null);
    Instant now = clock.instant();
    return new DLQMessage(envelope, originalQueue, MessageHeaders.intHeader(headers, MessageHeaders.RETRY_COUNT),
        parseInstant(MessageHeaders.stringHeader(headers, MessageHeaders.FIRST_FAILURE_AT), now), now, reason);
  }

  /**
   * With a fanout dead-letter exchange every DLQ sees every dead letter; only the DLQ of the
   * original queue acts on it.
   */
  boolean belongsHere(DLQMessage message) {
    String origin = message.originalQueue();
    return UNKNOWN_QUEUE.equals(origin) || sourceQueue.queueName().equals(origin);
  }

  /**
   * Whether a dead letter is worth another attempt, judged from its reason and event type.
   */
  public boolean analyzeFailure(DLQMessage message) {
    String reason = message.errorReason();
    if (reason != null && reason.toLowerCase(Locale.ROOT).contains("validation")) return false;
    if (TRANSACTION_FAILED.equals(message.envelope().type())) return false;
    return FailureClassifier.isTransient(reason);
  }

  private void retryOrGiveUp(DLQMessage message) {
    try {
      retry(message);
    } catch (PublishException e) {
      log.error("Retry republish of {} failed: {}", message.envelope().id(), e.getMessage());
      handlePermanentFailure(new DLQMessage(message.envelope(), message.originalQueue(), message.retryCount(),
          message.firstFailedAt(), message.lastFailedAt(), "retry republish failed: " + e.getMessage()));
    }
  }

  private void retry(DLQMessage message) {
    EventEnvelope envelope = message.envelope();
    Map<String, Object> headers = new HashMap<>();
    headers.put(MessageHeaders.RETRY_COUNT, message.retryCount() + 1);
    headers.put(MessageHeaders.FIRST_FAILURE_AT, message.firstFailedAt().toString());
    republishRetry.execute(ctx -> {
      publisher.republish(envelope, headers);
      return null;
    });
    retried.incrementAndGet();
    log.info("Retrying message {} to {} (attempt {})", envelope.id(), message.originalQueue(), message.retryCount() + 1);
  }

  private void handlePermanentFailure(DLQMessage message) {
    permanentFailures.incrementAndGet();
    EventEnvelope envelope = message.envelope();
    MDC.put("eventId", envelope.id());
    MDC.put("correlationId", envelope.correlationId());
    MDC.put("queue", message.originalQueue());
    try {
      log.error("Permanent failure for message {}: type={}, originalQueue={}, retryCount={}, errorReason={}",
          envelope.id(), envelope.type(), message.originalQueue(), message.retryCount(), message.errorReason());
      try {
        options.onMaxRetriesExceeded().onMaxRetriesExceeded(message);
      } catch (RuntimeException e) {
        log.error("Permanent failure hook failed for {}: {}", envelope.id(), e.getMessage(), e);
      }
    } finally {
      MDC.remove("eventId");
      MDC.remove("correlationId");
      MDC.remove("queue");
    }
  }

  public DeadLetterStats getStats() {
    int depth;
    try {
      depth = topologyBuilder.getQueueInfo(queueName()).map(QueueInfo::messageCount).orElse(-1);
    } catch (RuntimeException e) {
      log.error("Error getting stats for {}: {}", queueName(), e.getMessage());
      depth = -1;
    }
    return new DeadLetterStats(queueName(), depth, retried.get(), permanentFailures.get(), skipped.get());
  }

  public int purge() {
    int count = topologyBuilder.purgeQueue(queueName());
    log.info("Purged {} messages from {}", count, queueName());
    return count;
  }

  /**
   * Republishes {@code message} regardless of its classification.
   */
  public void replay(DLQMessage message) {
    retry(message);
  }

  private static Instant parseInstant(String value, Instant fallback) {
    if (value == null) return fallback;
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      log.debug("Unparseable {} header {}", MessageHeaders.FIRST_FAILURE_AT, value);
      return fallback;
    }
  }

  private static String firstNonNull(String a, String b, String c, String d) {
    if (a != null) return a;
    if (b != null) return b;
    if (c != null) return c;
    return d;
  }
}
