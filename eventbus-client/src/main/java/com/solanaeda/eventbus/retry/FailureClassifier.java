package com.solanaeda.eventbus.retry;

import java.util.List;
import java.util.Locale;

/**
 * Classifies failures by their message text. Matching is case-insensitive.
 */
public final class FailureClassifier {
  private static final List<String> NETWORK = List.of("econnrefused", "etimedout", "econnreset", "enotfound",
      "network", "connection refused", "connection reset");
  private static final List<String> RATE_LIMIT = List.of("rate limit", "429", "too many requests");
  private static final List<String> TIMEOUT = List.of("timeout", "timedout", "timed out");
  private static final List<String> VALIDATION = List.of("validation", "invalid", "schema");
  private static final List<String> PERMANENT = List.of("not found", "unauthorized", "forbidden");
  // dead letters whose reason contains one of these are retried
  private static final List<String> TRANSIENT = List.of("timeout", "network", "rate limit", "temporary");

  private FailureClassifier() {}

  public static boolean isNetworkError(String message) { return containsAny(message, NETWORK); }

  public static boolean isRateLimitError(String message) { return containsAny(message, RATE_LIMIT); }

  public static boolean isTimeoutError(String message) { return containsAny(message, TIMEOUT); }

  public static boolean isValidationError(String message) { return containsAny(message, VALIDATION); }

  public static boolean isPermanentError(String message) {
    return isValidationError(message) || containsAny(message, PERMANENT);
  }

  public static boolean isTransient(String message) { return containsAny(message, TRANSIENT); }

  public static String messageOf(Throwable t) {
    StringBuilder sb = new StringBuilder();
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (c.getMessage() != null) sb.append(c.getMessage()).append(' ');
      if (c.getCause() == c) break;
    }
    return sb.toString();
  }

  private static boolean containsAny(String message, List<String> needles) {
    if (message == null || message.isEmpty()) return false;
    String m = message.toLowerCase(Locale.ROOT);
    for (String n : needles) {
      if (m.contains(n)) return true;
    }
    return false;
  }
}
