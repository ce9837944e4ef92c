package com.solanaeda.eventbus.dlq;

public record DeadLetterOptions(int maxRetryAttempts, int prefetch, PermanentFailureHook onMaxRetriesExceeded) {
  public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;

  public DeadLetterOptions {
    if (maxRetryAttempts < 0) throw new IllegalArgumentException("maxRetryAttempts must be >= 0");
    if (prefetch < 1) throw new IllegalArgumentException("prefetch must be >= 1");
    if (onMaxRetriesExceeded == null) onMaxRetriesExceeded = PermanentFailureHook.NOOP;
  }

  public static DeadLetterOptions defaults() {
    return new DeadLetterOptions(DEFAULT_MAX_RETRY_ATTEMPTS, 10, PermanentFailureHook.NOOP);
  }

  public DeadLetterOptions withMaxRetryAttempts(int maxRetryAttempts) {
    return new DeadLetterOptions(maxRetryAttempts, prefetch, onMaxRetriesExceeded);
  }

  public DeadLetterOptions withHook(PermanentFailureHook hook) {
    return new DeadLetterOptions(maxRetryAttempts, prefetch, hook);
  }
}
