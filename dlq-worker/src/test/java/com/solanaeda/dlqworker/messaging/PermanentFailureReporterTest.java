package com.solanaeda.dlqworker.messaging;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.solanaeda.eventbus.dlq.DLQMessage;
import com.solanaeda.eventbus.envelope.EventEnvelope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class PermanentFailureReporterTest {

  @Test
  void counts_permanent_failures_per_queue() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    PermanentFailureReporter reporter = new PermanentFailureReporter(registry);

    reporter.onMaxRetriesExceeded(message("q.burn.events"));
    reporter.onMaxRetriesExceeded(message("q.burn.events"));
    reporter.onMaxRetriesExceeded(message("q.trade.events"));

    assertThat(registry.counter("dlq_permanent_failures_total", "queue", "q.burn.events").count()).isEqualTo(2.0d);
    assertThat(registry.counter("dlq_permanent_failures_total", "queue", "q.trade.events").count()).isEqualTo(1.0d);
  }

  @Test
  void clears_mdc_afterwards() {
    PermanentFailureReporter reporter = new PermanentFailureReporter(new SimpleMeterRegistry());

    reporter.onMaxRetriesExceeded(message("q.burn.events"));

    assertThat(MDC.get("eventId")).isNull();
    assertThat(MDC.get("queue")).isNull();
  }

  private static DLQMessage message(String queue) {
    EventEnvelope envelope = new EventEnvelope("1.0", "evt-1", "evt-1", null, Instant.now(), "BURN_DETECTED",
        "burn.detected", JsonNodeFactory.instance.objectNode().put("amount", 1), "test");
    return new DLQMessage(envelope, queue, 3, Instant.now(), Instant.now(), "validation failed: amount");
  }
}
