package com.solanaeda.dlqworker.messaging;

import com.solanaeda.eventbus.dlq.DLQMessage;
import com.solanaeda.eventbus.dlq.PermanentFailureHook;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Records dead letters that need manual review. Alerting is left to whatever scrapes the counter.
 */
@Component
public class PermanentFailureReporter implements PermanentFailureHook {
  private static final Logger log = LoggerFactory.getLogger(PermanentFailureReporter.class);

  private final MeterRegistry registry;

  public PermanentFailureReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void onMaxRetriesExceeded(DLQMessage message) {
    MDC.put("eventId", message.envelope().id());
    MDC.put("queue", message.originalQueue());
    try {
      log.error("Dead letter needs manual review: type={} originalQueue={} retryCount={} firstFailedAt={} reason={}",
          message.envelope().type(), message.originalQueue(), message.retryCount(), message.firstFailedAt(),
          message.errorReason());
      Counter.builder("dlq_permanent_failures_total")
          .tag("queue", message.originalQueue())
          .register(registry)
          .increment();
    } finally {
      MDC.remove("eventId");
      MDC.remove("queue");
    }
  }
}
