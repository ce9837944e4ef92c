package com.solanaeda.eventbus.producer;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PublisherStatsTest {

  @Test
  void reset_during_in_flight_publish_keeps_pending_consistent() {
    PublisherStats stats = new PublisherStats();
    stats.started();

    stats.reset();
    assertThat(stats.snapshot()).isEqualTo(new PublisherMetrics(0, 0, 0, 1));

    stats.confirmed();
    assertThat(stats.snapshot()).isEqualTo(new PublisherMetrics(0, 1, 0, 0));
  }

  @Test
  void totals_are_exported_as_counters() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    PublisherStats stats = new PublisherStats();
    stats.bindTo(registry);

    stats.started();
    stats.failed();

    assertThat(registry.get("eventbus_publish_failed_total").functionCounter().count()).isEqualTo(1.0d);
    assertThat(registry.get("eventbus_publish_pending").gauge().value()).isZero();
  }
}
