package com.solanaeda.eventbus.envelope;

import com.rabbitmq.client.AMQP;

import java.util.List;
import java.util.Map;

/**
 * Header names used for retry bookkeeping and dead-letter routing.
 */
public final class MessageHeaders {
  public static final String RETRY_COUNT = "x-retry-count";
  public static final String FIRST_FAILURE_AT = "x-first-failure-at";
  public static final String ERROR_REASON = "x-error-reason";
  public static final String ORIGINAL_QUEUE = "x-original-queue";
  // set by the broker
  public static final String DEATH = "x-death";
  public static final String FIRST_DEATH_REASON = "x-first-death-reason";
  public static final String FIRST_DEATH_QUEUE = "x-first-death-queue";

  public static final String CONTENT_TYPE = "application/json";
  public static final String CONTENT_ENCODING = "UTF-8";

  private MessageHeaders() {}

  public static int retryCount(AMQP.BasicProperties props) {
    return intHeader(headers(props), RETRY_COUNT);
  }

  public static Map<String, Object> headers(AMQP.BasicProperties props) {
    if (props == null || props.getHeaders() == null) return Map.of();
    return props.getHeaders();
  }

  public static String stringHeader(Map<String, Object> headers, String name) {
    Object v = headers.get(name);
    return v == null ? null : v.toString(); // LongString on the wire
  }

  public static int intHeader(Map<String, Object> headers, String name) {
    Object v = headers.get(name);
    if (v instanceof Number n) return n.intValue();
    if (v != null) {
      try {
        return Integer.parseInt(v.toString().trim());
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }

  /**
   * First {@code x-death} entry, the most recent dead-lettering by the broker.
   */
  public static Map<?, ?> latestDeath(Map<String, Object> headers) {
    Object v = headers.get(DEATH);
    if (v instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof Map<?, ?> m) {
      return m;
    }
    return Map.of();
  }
}
