package com.solanaeda.eventbus.dlq;

import com.solanaeda.eventbus.consumer.EventConsumer;
import com.solanaeda.eventbus.producer.EventPublisher;
import com.solanaeda.eventbus.topology.EventQueue;
import com.solanaeda.eventbus.topology.TopologyBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public final class DeadLetterHandlers {
  private static final Logger log = LoggerFactory.getLogger(DeadLetterHandlers.class);

  private DeadLetterHandlers() {}

  public static DeadLetterHandler forQueue(EventConsumer consumer, EventPublisher publisher,
                                           TopologyBuilder topologyBuilder, EventQueue queue,
                                           DeadLetterOptions options) {
    return new DeadLetterHandler(consumer, publisher, topologyBuilder, queue, options);
  }

  /**
   * Creates and starts one handler per domain queue.
   */
  public static List<DeadLetterHandler> startAll(EventConsumer consumer, EventPublisher publisher,
                                                 TopologyBuilder topologyBuilder, DeadLetterOptions options) {
    List<DeadLetterHandler> handlers = new ArrayList<>();
    for (EventQueue queue : EventQueue.values()) {
      DeadLetterHandler handler = forQueue(consumer, publisher, topologyBuilder, queue, options);
      handler.start();
      handlers.add(handler);
    }
    log.info("Setup {} DLQ handlers", handlers.size());
    return handlers;
  }
}
