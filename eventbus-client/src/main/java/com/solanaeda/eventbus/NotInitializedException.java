package com.solanaeda.eventbus;

/**
 * Channel or connection requested before a successful connect, or after close.
 */
public class NotInitializedException extends EventBusException {
  public NotInitializedException(String message) { super(message); }
}
