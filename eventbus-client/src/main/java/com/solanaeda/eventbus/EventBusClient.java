package com.solanaeda.eventbus;

import com.solanaeda.eventbus.config.BrokerSettings;
import com.solanaeda.eventbus.connection.ConnectionListener;
import com.solanaeda.eventbus.connection.ConnectionManager;
import com.solanaeda.eventbus.consumer.EventConsumer;
import com.solanaeda.eventbus.dlq.DeadLetterHandler;
import com.solanaeda.eventbus.dlq.DeadLetterHandlers;
import com.solanaeda.eventbus.dlq.DeadLetterOptions;
import com.solanaeda.eventbus.envelope.EnvelopeCodec;
import com.solanaeda.eventbus.envelope.EnvelopeFactory;
import com.solanaeda.eventbus.producer.EventPublisher;
import com.solanaeda.eventbus.topology.EventQueue;
import com.solanaeda.eventbus.topology.EventTopology;
import com.solanaeda.eventbus.topology.TopologyBuilder;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connected client: one connection, declared topology, a publisher and a consumer. After a
 * reconnect it re-declares the topology and resubscribes every consumer, dead-letter
 * handlers included.
 */
public class EventBusClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventBusClient.class);

  private final ConnectionManager connectionManager;
  private final TopologyBuilder topologyBuilder;
  private final EventPublisher publisher;
  private final EventConsumer consumer;
  private final EventConsumer deadLetterConsumer;
  private final EnvelopeCodec codec;
  private final List<DeadLetterHandler> deadLetterHandlers = new CopyOnWriteArrayList<>();

  EventBusClient(ConnectionManager connectionManager, EnvelopeCodec codec, String source) {
    this.connectionManager = connectionManager;
    this.codec = codec;
    EventTopology topology = new EventTopology(connectionManager.settings());
    this.topologyBuilder = new TopologyBuilder(connectionManager, topology);
    this.publisher = new EventPublisher(connectionManager, new EnvelopeFactory(codec.mapper(), source), codec, topology);
    this.consumer = new EventConsumer(connectionManager, codec, topology);
    this.deadLetterConsumer = new EventConsumer(connectionManager, codec, topology);
  }

  public static EventBusClient create(BrokerSettings settings, String source) {
    return create(settings, source, null);
  }

  /**
   * Connects (retrying per {@code maxInitialRetries}), declares topology and dead-letter queues.
   *
   * @param registry optional; publisher, consumer and connection gauges are bound when present
   */
  public static EventBusClient create(BrokerSettings settings, String source, MeterRegistry registry) {
    return create(new ConnectionManager(settings), new EnvelopeCodec(), source, registry);
  }

  static EventBusClient create(ConnectionManager connectionManager, EnvelopeCodec codec, String source,
                               MeterRegistry registry) {
    EventBusClient client = new EventBusClient(connectionManager, codec, source);
    if (registry != null) client.bindMetrics(registry);
    try {
      connectionManager.connect();
      client.topologyBuilder.setupTopology();
      client.topologyBuilder.setupDlq();
    } catch (RuntimeException e) {
      connectionManager.close();
      throw e;
    }
    connectionManager.addListener(client.new Reconnector());
    log.info("Event bus client ready (source={})", source);
    return client;
  }

  private void bindMetrics(MeterRegistry registry) {
    publisher.bindMetrics(registry);
    consumer.bindMetrics(registry, "events");
    deadLetterConsumer.bindMetrics(registry, "dlq");
    Gauge.builder("eventbus_connected", connectionManager, cm -> cm.isConnected() ? 1 : 0).register(registry);
    Gauge.builder("eventbus_reconnect_attempt", connectionManager, cm -> cm.getHealth().attempt()).register(registry);
  }

  private class Reconnector implements ConnectionListener {
    @Override
    public void onReconnected(ConnectionManager manager) {
      boolean declared = redeclare();
      consumer.resubscribeAll();
      deadLetterConsumer.resubscribeAll();
      log.info("{} consumers resubscribed after reconnect",
          consumer.getConsumerCount() + deadLetterConsumer.getConsumerCount());
      if (!declared) manager.scheduleReconnect();
    }

    private boolean redeclare() {
      try {
        topologyBuilder.setupTopology();
        topologyBuilder.setupDlq();
        return true;
      } catch (RuntimeException e) {
        log.error("Topology re-declaration after reconnect failed, scheduling another reconnect: {}", e.getMessage());
        return false;
      }
    }
  }

  public ConnectionManager connection() { return connectionManager; }
  public TopologyBuilder topology() { return topologyBuilder; }
  public EventPublisher publisher() { return publisher; }
  public EventConsumer consumer() { return consumer; }
  public EnvelopeCodec codec() { return codec; }
  public List<DeadLetterHandler> deadLetterHandlers() { return List.copyOf(deadLetterHandlers); }

  public DeadLetterHandler deadLetterHandler(EventQueue queue, DeadLetterOptions options) {
    DeadLetterHandler handler = DeadLetterHandlers.forQueue(deadLetterConsumer, publisher, topologyBuilder, queue, options);
    deadLetterHandlers.add(handler);
    return handler;
  }

  /**
   * Starts one dead-letter handler per domain queue.
   */
  public List<DeadLetterHandler> startDeadLetterHandlers(DeadLetterOptions options) {
    List<DeadLetterHandler> started = DeadLetterHandlers.startAll(deadLetterConsumer, publisher, topologyBuilder, options);
    deadLetterHandlers.addAll(started);
    return started;
  }

  public void stopDeadLetterHandlers() {
    for (DeadLetterHandler handler : deadLetterHandlers) {
      handler.stop();
    }
  }

  public boolean isConnected() { return connectionManager.isConnected(); }

  /**
   * Stops dead-letter handlers, cancels consumers, then closes channel and connection.
   */
  @Override
  public void close() {
    if (connectionManager.isClosed()) return;
    stopDeadLetterHandlers();
    consumer.cancelAll();
    deadLetterConsumer.cancelAll();
    connectionManager.close();
  }
}
