package com.solanaeda.eventbus.producer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Publisher counters. All updates and snapshots go through the same monitor so a snapshot
 * never shows a half-applied transition.
 */
class PublisherStats {
  private long totalPublished;
  private long confirmed;
  private long failed;
  private long pending;

  synchronized void started() {
    totalPublished++;
    pending++;
  }

  synchronized void confirmed() {
    confirmed++;
    pending--;
  }

  synchronized void failed() {
    failed++;
    pending--;
  }

  synchronized PublisherMetrics snapshot() {
    return new PublisherMetrics(totalPublished, confirmed, failed, pending);
  }

  /**
   * Zeroes the cumulative counters. {@code pending} is left alone: publishes still awaiting
   * their confirm settle against it later.
   */
  synchronized void reset() {
    totalPublished = 0;
    confirmed = 0;
    failed = 0;
  }

  void bindTo(MeterRegistry registry) {
    FunctionCounter.builder("eventbus_published_total", this, s -> s.snapshot().totalPublished()).register(registry);
    FunctionCounter.builder("eventbus_confirmed_total", this, s -> s.snapshot().confirmed()).register(registry);
    FunctionCounter.builder("eventbus_publish_failed_total", this, s -> s.snapshot().failed()).register(registry);
    Gauge.builder("eventbus_publish_pending", this, s -> s.snapshot().pending()).register(registry);
  }
}
