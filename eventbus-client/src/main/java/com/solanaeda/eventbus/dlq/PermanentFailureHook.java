package com.solanaeda.eventbus.dlq;

/**
 * Called once for a dead letter that will not be retried automatically.
 */
@FunctionalInterface
public interface PermanentFailureHook {
  PermanentFailureHook NOOP = message -> { };

  void onMaxRetriesExceeded(DLQMessage message);
}
