package com.solanaeda.eventbus.retry;

import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

/**
 * Retry presets for callers that retry a failed operation such as {@code publish()}.
 */
public enum RetryPolicies {
  /** Transient network blips. */
  IMMEDIATE(3, 100, 500, 1.5),
  /** Temporary failures. */
  SHORT(5, 1_000, 10_000, 2),
  /** Rate limiting. */
  MEDIUM(5, 2_000, 30_000, 2),
  /** Waiting for a dependency to recover. */
  LONG(10, 5_000, 60_000, 2),
  /** Permanent failures: single attempt. */
  NONE(1, 0, 0, 1);

  private final int maxAttempts;
  private final long initialDelayMillis;
  private final long maxDelayMillis;
  private final double multiplier;

  RetryPolicies(int maxAttempts, long initialDelayMillis, long maxDelayMillis, double multiplier) {
    this.maxAttempts = maxAttempts;
    this.initialDelayMillis = initialDelayMillis;
    this.maxDelayMillis = maxDelayMillis;
    this.multiplier = multiplier;
  }

  public int maxAttempts() { return maxAttempts; }
  public long initialDelayMillis() { return initialDelayMillis; }
  public long maxDelayMillis() { return maxDelayMillis; }
  public double multiplier() { return multiplier; }

  /**
   * Template that never retries {@link AmqpRejectAndDontRequeueException}.
   */
  public RetryTemplate toRetryTemplate() {
    RetryTemplateBuilder b = RetryTemplate.builder()
        .maxAttempts(maxAttempts)
        .notRetryOn(AmqpRejectAndDontRequeueException.class)
        .traversingCauses();
    if (initialDelayMillis == 0) {
      b.noBackoff();
    } else {
      b.exponentialBackoff(initialDelayMillis, multiplier, maxDelayMillis, true);
    }
    return b.build();
  }

  public static RetryPolicies forError(Throwable error) {
    String message = FailureClassifier.messageOf(error);
    if (error instanceof AmqpRejectAndDontRequeueException) return NONE;
    if (FailureClassifier.isNetworkError(message)) return MEDIUM;
    if (FailureClassifier.isRateLimitError(message)) return LONG;
    if (FailureClassifier.isTimeoutError(message)) return SHORT;
    if (FailureClassifier.isPermanentError(message)) return NONE;
    return SHORT;
  }
}
