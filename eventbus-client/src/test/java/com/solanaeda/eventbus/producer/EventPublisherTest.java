package com.solanaeda.eventbus.producer;

import com.rabbitmq.client.AMQP;
import com.solanaeda.eventbus.PublishException;
import com.solanaeda.eventbus.config.BrokerSettings;
import com.solanaeda.eventbus.connection.ConnectionManager;
import com.solanaeda.eventbus.envelope.EnvelopeCodec;
import com.solanaeda.eventbus.envelope.EnvelopeFactory;
import com.solanaeda.eventbus.envelope.EventEnvelope;
import com.solanaeda.eventbus.topology.EventTopology;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class EventPublisherTest {

  private final EnvelopeCodec codec = new EnvelopeCodec();
  private BrokerSettings settings;
  private ConnectionManager connectionManager;
  private EventPublisher publisher;

  @BeforeEach
  void setUp() throws Exception {
    settings = new BrokerSettings();
    settings.setConfirmTimeout(Duration.ofMillis(100));
    connectionManager = mock(ConnectionManager.class);
    when(connectionManager.settings()).thenReturn(settings);
    when(connectionManager.awaitWritable(any())).thenReturn(true);
    publisher = new EventPublisher(connectionManager, new EnvelopeFactory(codec.mapper(), "test"), codec,
        new EventTopology(settings));
  }

  @Test
  void publish_sends_persistent_json_with_mandatory_flag() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));

    EventEnvelope sent = publisher.publish("BURN_DETECTED", Map.of("mint", "M", "amount", 10),
        PublishOptions.defaults().withPriority(5).withExpiration(Duration.ofSeconds(30)));

    ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(connectionManager).publish(eq("solana.events"), eq("burn.detected"), eq(true), props.capture(), body.capture());

    AMQP.BasicProperties p = props.getValue();
    assertThat(p.getDeliveryMode()).isEqualTo(2);
    assertThat(p.getContentType()).isEqualTo("application/json");
    assertThat(p.getContentEncoding()).isEqualTo("UTF-8");
    assertThat(p.getMessageId()).isEqualTo(sent.id());
    assertThat(p.getCorrelationId()).isEqualTo(sent.id());
    assertThat(p.getPriority()).isEqualTo(5);
    assertThat(p.getExpiration()).isEqualTo("30000");
    assertThat(p.getTimestamp()).isNotNull();
    assertThat(codec.decode(body.getValue())).isEqualTo(sent);

    assertThat(publisher.getMetrics()).isEqualTo(new PublisherMetrics(1, 1, 0, 0));
  }

  @Test
  void broker_nack_surfaces_as_publish_exception() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenReturn(CompletableFuture.failedFuture(new PublishException("Broker nacked message x")));

    assertThatThrownBy(() -> publisher.publish("TRADE_EXECUTED", Map.of()))
        .isInstanceOf(PublishException.class)
        .hasMessageContaining("nacked");
    assertThat(publisher.getMetrics()).isEqualTo(new PublisherMetrics(1, 0, 1, 0));
  }

  @Test
  void missing_confirm_times_out() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenReturn(new CompletableFuture<>());

    assertThatThrownBy(() -> publisher.publish("PRICE_UPDATED", Map.of()))
        .isInstanceOf(PublishException.class)
        .hasMessageContaining("Timed out");
    assertThat(publisher.getMetrics().failed()).isEqualTo(1);
  }

  @Test
  void write_failure_surfaces_as_publish_exception() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenThrow(new IOException("connection reset"));

    assertThatThrownBy(() -> publisher.publish("PRICE_UPDATED", Map.of()))
        .isInstanceOf(PublishException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void blocked_connection_fails_without_writing() throws Exception {
    when(connectionManager.awaitWritable(any())).thenReturn(false);

    assertThatThrownBy(() -> publisher.publish("PRICE_UPDATED", Map.of()))
        .isInstanceOf(PublishException.class)
        .hasMessageContaining("flow control");
    verify(connectionManager, never()).publish(anyString(), anyString(), anyBoolean(), any(), any());
  }

  @Test
  void worker_status_uses_per_worker_routing_key() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));

    EventEnvelope e = publisher.publishStatus("burn-scanner", WorkerStatus.RUNNING, Map.of("uptime", 12));

    assertThat(e.type()).isEqualTo("WORKER_STATUS");
    assertThat(e.routingKey()).isEqualTo("worker.burn-scanner.running");
    assertThat(e.data().get("workerName").asText()).isEqualTo("burn-scanner");
    assertThat(e.data().get("status").asText()).isEqualTo("RUNNING");
    assertThat(e.data().get("uptime").asInt()).isEqualTo(12);
    verify(connectionManager).publish(eq("solana.events"), eq("worker.burn-scanner.running"), eq(true), any(), any());
  }

  @Test
  void republish_keeps_envelope_and_adds_headers() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));
    EventEnvelope original = publisher.publish("TRADE_FAILED", Map.of("sig", "abc"));

    publisher.republish(original, Map.of("x-retry-count", 1));

    ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(connectionManager, times(2)).publish(eq("solana.events"), eq("trade.failed"), eq(true), props.capture(), body.capture());
    assertThat(props.getAllValues().get(1).getHeaders()).containsEntry("x-retry-count", 1);
    assertThat(codec.decode(body.getAllValues().get(1))).isEqualTo(original);
  }

  @Test
  void custom_exchange_publish() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));

    EventEnvelope e = publisher.publishToExchange("solana.status", "", Map.of("ok", true), PublishOptions.defaults());

    assertThat(e.type()).isEqualTo("CUSTOM");
    verify(connectionManager).publish(eq("solana.status"), anyString(), eq(true), any(), any());
  }

  @Test
  void metrics_are_resettable_and_exported() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    publisher.bindMetrics(registry);

    publisher.publish("BURN_DETECTED", Map.of());
    assertThat(registry.get("eventbus_published_total").functionCounter().count()).isEqualTo(1.0d);

    publisher.resetMetrics();
    assertThat(publisher.getMetrics()).isEqualTo(new PublisherMetrics(0, 0, 0, 0));
    assertThat(registry.get("eventbus_published_total").functionCounter().count()).isEqualTo(0.0d);
  }

  @Test
  void publishing_inside_a_delivery_keeps_the_delivery_mdc() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));
    MDC.put("eventId", "incoming-1");
    MDC.put("correlationId", "corr-1");
    try {
      publisher.publish("TRADE_EXECUTED", Map.of("signature", "abc"));

      assertThat(MDC.get("eventId")).isEqualTo("incoming-1");
      assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
    } finally {
      MDC.clear();
    }
  }

  @Test
  void publishing_outside_a_delivery_leaves_no_mdc() throws Exception {
    when(connectionManager.publish(anyString(), anyString(), anyBoolean(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));

    publisher.publish("TRADE_EXECUTED", Map.of("signature", "abc"));

    assertThat(MDC.get("eventId")).isNull();
    assertThat(MDC.get("correlationId")).isNull();
  }
}
