package com.solanaeda.eventbus.connection;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.ReturnListener;
import com.solanaeda.eventbus.PublishException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps publish sequence numbers of the current channel to futures completed by the broker's
 * {@code basic.ack} / {@code basic.nack}. A mandatory message the broker could not route
 * arrives as {@code basic.return} before its ack; such a message fails even though it is acked.
 */
public class PublishConfirmations implements ConfirmListener, ReturnListener {
  private static final Logger log = LoggerFactory.getLogger(PublishConfirmations.class);

  private final ConcurrentNavigableMap<Long, Pending> pending = new ConcurrentSkipListMap<>();
  // message ids seen in basic.return, consumed by the following ack
  private final Set<String> returnsSeen = ConcurrentHashMap.newKeySet();
  private final AtomicLong returned = new AtomicLong();
  private volatile boolean trackReturns = true;

  private record Pending(String messageId, CompletableFuture<Void> future) {}

  void setTrackReturns(boolean trackReturns) { this.trackReturns = trackReturns; }

  public CompletableFuture<Void> register(long sequenceNumber, String messageId) {
    CompletableFuture<Void> future = new CompletableFuture<>();
    if (messageId != null) returnsSeen.remove(messageId);
    pending.put(sequenceNumber, new Pending(messageId, future));
    return future;
  }

  public void discard(long sequenceNumber) {
    pending.remove(sequenceNumber);
  }

  public int pendingCount() { return pending.size(); }

  public long returnedCount() { return returned.get(); }

  @Override
  public void handleAck(long deliveryTag, boolean multiple) {
    for (Map.Entry<Long, Pending> e : settle(deliveryTag, multiple).entrySet()) {
      Pending p = e.getValue();
      if (p.messageId() != null && returnsSeen.remove(p.messageId())) {
        p.future().completeExceptionally(new PublishException("Message " + p.messageId() + " was returned as unroutable"));
      } else {
        p.future().complete(null);
      }
    }
  }

  @Override
  public void handleNack(long deliveryTag, boolean multiple) {
    for (Map.Entry<Long, Pending> e : settle(deliveryTag, multiple).entrySet()) {
      Pending p = e.getValue();
      log.warn("Confirm NACK seq={} messageId={}", e.getKey(), p.messageId());
      p.future().completeExceptionally(new PublishException("Broker nacked message " + p.messageId()));
    }
  }

  @Override
  public void handleReturn(int replyCode, String replyText, String exchange, String routingKey,
                           AMQP.BasicProperties properties, byte[] body) {
    returned.incrementAndGet();
    String messageId = properties != null ? properties.getMessageId() : null;
    if (trackReturns && messageId != null) returnsSeen.add(messageId);
    log.warn("Rabbit RETURNED (unroutable): replyCode={}, replyText={}, exchange={}, routingKey={}, messageId={}, bytes={}",
        replyCode, replyText, exchange, routingKey, messageId, body == null ? 0 : body.length);
  }

  /**
   * Fails every outstanding confirm; sequence numbers restart on a new channel.
   */
  public void failAll(Throwable cause) {
    Map<Long, Pending> all = settle(Long.MAX_VALUE, true);
    for (Pending p : all.values()) {
      p.future().completeExceptionally(cause);
    }
    returnsSeen.clear();
    if (!all.isEmpty()) log.warn("Failed {} unconfirmed publishes: {}", all.size(), cause.getMessage());
  }

  private Map<Long, Pending> settle(long deliveryTag, boolean multiple) {
    Map<Long, Pending> settled = new ConcurrentSkipListMap<>();
    if (multiple) {
      ConcurrentNavigableMap<Long, Pending> head = pending.headMap(deliveryTag, true);
      for (Map.Entry<Long, Pending> e : head.entrySet()) {
        if (pending.remove(e.getKey(), e.getValue())) settled.put(e.getKey(), e.getValue());
      }
    } else {
      Pending p = pending.remove(deliveryTag);
      if (p != null) settled.put(deliveryTag, p);
    }
    return settled;
  }
}
