package com.solanaeda.eventbus;

/**
 * The initial connect gave up after the configured number of attempts.
 */
public class BrokerConnectionException extends EventBusException {
  public BrokerConnectionException(String message, Throwable cause) { super(message, cause); }
}
