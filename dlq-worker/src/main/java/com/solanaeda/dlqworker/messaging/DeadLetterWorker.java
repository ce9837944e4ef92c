package com.solanaeda.dlqworker.messaging;

import com.solanaeda.dlqworker.config.DeadLetterProperties;
import com.solanaeda.eventbus.EventBusClient;
import com.solanaeda.eventbus.EventBusException;
import com.solanaeda.eventbus.dlq.DeadLetterHandler;
import com.solanaeda.eventbus.dlq.DeadLetterOptions;
import com.solanaeda.eventbus.producer.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs one dead-letter handler per domain queue for the lifetime of the application context.
 * Stopped before the client bean is closed, so handlers stop ahead of the connection.
 */
@Component
public class DeadLetterWorker implements SmartLifecycle {
  private static final Logger log = LoggerFactory.getLogger(DeadLetterWorker.class);

  private final EventBusClient client;
  private final DeadLetterProperties properties;
  private final PermanentFailureReporter reporter;
  private final String workerName;
  private volatile boolean running;

  public DeadLetterWorker(EventBusClient client, DeadLetterProperties properties, PermanentFailureReporter reporter,
                          @Value("${spring.application.name:dlq-worker}") String workerName) {
    this.client = client;
    this.properties = properties;
    this.reporter = reporter;
    this.workerName = workerName;
  }

  @Override
  public void start() {
    if (!properties.isEnabled()) {
      log.info("DLQ processing disabled");
      return;
    }
    DeadLetterOptions options = new DeadLetterOptions(properties.getMaxRetryAttempts(), properties.getPrefetch(), reporter);
    List<DeadLetterHandler> handlers = client.startDeadLetterHandlers(options);
    running = true;
    publishStatus(WorkerStatus.RUNNING, Map.of("queues", handlers.size()));
  }

  @Override
  public void stop() {
    if (!running) return;
    publishStatus(WorkerStatus.STOPPING, Map.of());
    client.stopDeadLetterHandlers();
    running = false;
    log.info("DLQ worker stopped");
  }

  @Override
  public boolean isRunning() { return running; }

  private void publishStatus(WorkerStatus status, Map<String, ?> data) {
    try {
      client.publisher().publishStatus(workerName, status, data);
    } catch (EventBusException e) {
      log.warn("Could not publish {} status: {}", status, e.getMessage());
    }
  }
}
