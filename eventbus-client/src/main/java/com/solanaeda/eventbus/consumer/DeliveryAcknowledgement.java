package com.solanaeda.eventbus.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.solanaeda.eventbus.envelope.MessageHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Acknowledgement bound to one delivery on the channel it arrived on.
 */
class DeliveryAcknowledgement implements Acknowledgement {
  private static final Logger log = LoggerFactory.getLogger(DeliveryAcknowledgement.class);

  private final EventConsumer consumer;
  private final Channel channel;
  private final Delivery delivery;
  private final String queue;
  private final boolean manualAck;
  private final ConsumerStats stats;
  private final AtomicBoolean settled = new AtomicBoolean();

  DeliveryAcknowledgement(EventConsumer consumer, Channel channel, Delivery delivery, String queue,
                          boolean manualAck, ConsumerStats stats) {
    this.consumer = consumer;
    this.channel = channel;
    this.delivery = delivery;
    this.queue = queue;
    this.manualAck = manualAck;
    this.stats = stats;
  }

  @Override
  public void ack() {
    if (!settled.compareAndSet(false, true)) return;
    stats.acknowledged();
    if (!manualAck) return;
    try {
      channel.basicAck(deliveryTag(), false);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to ack delivery {} on {}: {}", deliveryTag(), queue, e.getMessage());
    }
  }

  @Override
  public void nack(boolean requeue) {
    if (!settled.compareAndSet(false, true)) return;
    if (requeue) stats.nacked(); else stats.rejected();
    if (!manualAck) return;
    try {
      channel.basicNack(deliveryTag(), false, requeue);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to nack delivery {} on {}: {}", deliveryTag(), queue, e.getMessage());
    }
  }

  @Override
  public void reject(String reason) {
    if (!settled.compareAndSet(false, true)) return;
    stats.rejected();
    if (!manualAck) return;
    try {
      if (consumer.deadLetter(queue, delivery, reason)) {
        channel.basicAck(deliveryTag(), false);
      } else {
        channel.basicNack(deliveryTag(), false, false);
      }
    } catch (IOException | RuntimeException e) {
      log.error("Failed to dead-letter delivery {} on {}: {}", deliveryTag(), queue, e.getMessage());
    }
  }

  @Override
  public boolean isSettled() { return settled.get(); }

  @Override
  public String queue() { return queue; }

  @Override
  public Map<String, Object> headers() { return MessageHeaders.headers(properties()); }

  @Override
  public int retryCount() { return MessageHeaders.retryCount(properties()); }

  @Override
  public boolean redelivered() { return delivery.getEnvelope().isRedeliver(); }

  private AMQP.BasicProperties properties() { return delivery.getProperties(); }

  private long deliveryTag() { return delivery.getEnvelope().getDeliveryTag(); }
}
