package com.solanaeda.eventbus.consumer;

import java.util.Map;

/**
 * Settles one delivery. Only the first settle call has an effect; later calls are ignored.
 * Safe to call from any thread.
 */
public interface Acknowledgement {

  void ack();

  /** Negative acknowledge with requeue. */
  default void nack() { nack(true); }

  /**
   * @param requeue false sends the message to its dead-letter queue through the broker
   */
  void nack(boolean requeue);

  /**
   * Dead-letters the message with {@code reason} recorded in the {@code x-error-reason} header.
   */
  void reject(String reason);

  boolean isSettled();

  String queue();

  Map<String, Object> headers();

  int retryCount();

  boolean redelivered();
}
