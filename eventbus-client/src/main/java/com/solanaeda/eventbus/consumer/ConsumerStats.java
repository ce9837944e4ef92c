package com.solanaeda.eventbus.consumer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

class ConsumerStats {
  private long totalProcessed;
  private long acknowledged;
  private long nacked;
  private long rejected;
  private long processing;

  synchronized void started() {
    totalProcessed++;
    processing++;
  }

  synchronized void acknowledged() {
    acknowledged++;
    processing--;
  }

  synchronized void nacked() {
    nacked++;
    processing--;
  }

  synchronized void rejected() {
    rejected++;
    processing--;
  }

  /** Unparseable delivery: never reached a handler. */
  synchronized void malformed() {
    totalProcessed++;
    rejected++;
  }

  synchronized ConsumerMetrics snapshot() {
    return new ConsumerMetrics(totalProcessed, acknowledged, nacked, rejected, processing);
  }

  // in-flight deliveries keep their processing count
  synchronized void reset() {
    totalProcessed = 0;
    acknowledged = 0;
    nacked = 0;
    rejected = 0;
  }

  void bindTo(MeterRegistry registry, String name) {
    FunctionCounter.builder("eventbus_consumed_total", this, s -> s.snapshot().totalProcessed()).tag("consumer", name).register(registry);
    FunctionCounter.builder("eventbus_acked_total", this, s -> s.snapshot().acknowledged()).tag("consumer", name).register(registry);
    FunctionCounter.builder("eventbus_nacked_total", this, s -> s.snapshot().nacked()).tag("consumer", name).register(registry);
    FunctionCounter.builder("eventbus_rejected_total", this, s -> s.snapshot().rejected()).tag("consumer", name).register(registry);
    Gauge.builder("eventbus_processing", this, s -> s.snapshot().processing()).tag("consumer", name).register(registry);
  }
}
