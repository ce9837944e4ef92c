package com.solanaeda.dlqworker.health;

import com.solanaeda.eventbus.EventBusClient;
import com.solanaeda.eventbus.connection.ConnectionHealth;
import com.solanaeda.eventbus.dlq.DeadLetterHandler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("broker")
public class BrokerHealthIndicator implements HealthIndicator {
  private final EventBusClient client;

  public BrokerHealthIndicator(EventBusClient client) {
    this.client = client;
  }

  @Override
  public Health health() {
    ConnectionHealth h = client.connection().getHealth();
    Health.Builder builder = h.connected() ? Health.up() : Health.down();
    builder.withDetail("url", h.url())
        .withDetail("attempt", h.attempt())
        .withDetail("reconnectPending", h.reconnectPending());
    if (h.connectedAt() != null) builder.withDetail("connectedAt", h.connectedAt().toString());
    if (h.lastError() != null) builder.withDetail("lastError", h.lastError());
    long running = client.deadLetterHandlers().stream().filter(DeadLetterHandler::isRunning).count();
    builder.withDetail("dlqHandlers", running);
    return builder.build();
  }
}
