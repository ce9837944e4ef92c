package com.solanaeda.eventbus.connection;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential reconnect delay: {@code min(base * 2^attempt, max) + jitter}, jitter uniform in
 * {@code [0, maxJitter)}.
 */
public final class ReconnectBackoff {
  public static final Duration MAX_DELAY = Duration.ofSeconds(30);
  public static final Duration MAX_JITTER = Duration.ofSeconds(1);

  private static final int MAX_EXPONENT = 30;

  private final long baseMillis;
  private final long maxMillis;
  private final long maxJitterMillis;
  private final DoubleSupplier random;

  public ReconnectBackoff(Duration base) {
    this(base, MAX_DELAY, MAX_JITTER, () -> ThreadLocalRandom.current().nextDouble());
  }

  public ReconnectBackoff(Duration base, Duration max, Duration maxJitter, DoubleSupplier random) {
    if (base.isNegative() || max.isNegative() || maxJitter.isNegative()) {
      throw new IllegalArgumentException("backoff durations must not be negative");
    }
    this.baseMillis = base.toMillis();
    this.maxMillis = max.toMillis();
    this.maxJitterMillis = maxJitter.toMillis();
    this.random = random;
  }

  /**
   * Delay before the next attempt, without jitter.
   */
  public Duration baseDelayFor(int attempt) {
    int exponent = Math.max(0, Math.min(attempt, MAX_EXPONENT));
    if (baseMillis > (maxMillis >> exponent)) {
      return Duration.ofMillis(maxMillis);
    }
    return Duration.ofMillis(Math.min(baseMillis << exponent, maxMillis));
  }

  public Duration delayFor(int attempt) {
    long jitter = (long) (random.getAsDouble() * maxJitterMillis);
    return baseDelayFor(attempt).plusMillis(jitter);
  }
}
