package com.solanaeda.eventbus.validation;

import com.solanaeda.eventbus.consumer.Acknowledgement;
import com.solanaeda.eventbus.envelope.EventEnvelope;

@FunctionalInterface
public interface TypedEventHandler<T> {
  void handle(T payload, EventEnvelope envelope, Acknowledgement ack) throws Exception;
}
