package com.solanaeda.eventbus.consumer;

import com.solanaeda.eventbus.envelope.EventEnvelope;

/**
 * Receives one parsed envelope per delivery. A handler settles the message through
 * {@code ack}; if it throws instead, the consumer decides between requeue and dead-letter.
 */
@FunctionalInterface
public interface MessageHandler {
  void handle(EventEnvelope envelope, Acknowledgement ack) throws Exception;
}
