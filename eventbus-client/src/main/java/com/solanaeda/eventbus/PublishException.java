package com.solanaeda.eventbus;

/**
 * A publish was nacked, returned as unroutable, timed out waiting for its confirm,
 * or could not be written to the channel. Never retried internally.
 */
public class PublishException extends EventBusException {
  public PublishException(String message) { super(message); }
  public PublishException(String message, Throwable cause) { super(message, cause); }
}
