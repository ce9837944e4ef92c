package com.solanaeda.eventbus.topology;

import com.solanaeda.eventbus.config.BrokerSettings;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The declarable model of exchanges, queues and bindings derived from {@link BrokerSettings}.
 * Pure data: nothing here talks to the broker.
 */
public class EventTopology {
  private final Exchange events;
  private final Exchange status;
  private final Exchange deadLetter;
  private final Map<String, Queue> queues = new LinkedHashMap<>();
  private final List<Binding> bindings = new ArrayList<>();
  private final Map<String, Queue> deadLetterQueues = new LinkedHashMap<>();
  private final List<Binding> deadLetterBindings = new ArrayList<>();

  public EventTopology(BrokerSettings settings) {
    this.events = new ExchangeBuilder(settings.getExchangeName(), settings.getExchangeType()).durable(true).build();
    this.status = new ExchangeBuilder(EventExchange.STATUS.exchangeName(), EventExchange.STATUS.defaultType()).durable(true).build();
    this.deadLetter = new ExchangeBuilder(EventExchange.DLQ.exchangeName(), settings.getDeadLetterExchangeType()).durable(true).build();

    for (EventQueue eq : EventQueue.values()) {
      QueueBuilder qb = QueueBuilder.durable(eq.queueName())
          .deadLetterExchange(deadLetter.getName())
          .deadLetterRoutingKey(eq.deadLetterRoutingKey());
      BrokerSettings.QueueLimits limits = settings.getQueueLimits().get(eq.queueName());
      if (limits != null) {
        if (limits.getMessageTtl() != null) qb.ttl((int) limits.getMessageTtl().toMillis());
        if (limits.getMaxLength() != null) qb.maxLength(limits.getMaxLength());
      }
      Queue q = qb.build();
      queues.put(eq.queueName(), q);
      for (String key : eq.routingKeys()) {
        bindings.add(BindingBuilder.bind(q).to(events).with(key).noargs());
      }

      Queue dlq = QueueBuilder.durable(eq.deadLetterQueueName()).build();
      deadLetterQueues.put(eq.queueName(), dlq);
      deadLetterBindings.add(BindingBuilder.bind(dlq).to(deadLetter).with(eq.deadLetterRoutingKey()).noargs());
    }
  }

  public List<Exchange> exchanges() { return List.of(events, status, deadLetter); }
  public Exchange eventsExchange() { return events; }
  public Exchange deadLetterExchange() { return deadLetter; }
  public List<Queue> queues() { return List.copyOf(queues.values()); }
  public List<Binding> bindings() { return Collections.unmodifiableList(bindings); }
  public List<Queue> deadLetterQueues() { return List.copyOf(deadLetterQueues.values()); }
  public List<Binding> deadLetterBindings() { return Collections.unmodifiableList(deadLetterBindings); }

  /**
   * Dead-letter target of a domain queue, from its declared {@code x-dead-letter-*} arguments.
   */
  public Optional<DeadLetterRoute> deadLetterRouteFor(String queueName) {
    Queue q = queues.get(queueName);
    if (q == null) return Optional.empty();
    Object exchange = q.getArguments().get("x-dead-letter-exchange");
    Object key = q.getArguments().get("x-dead-letter-routing-key");
    if (exchange == null) return Optional.empty();
    return Optional.of(new DeadLetterRoute(exchange.toString(), key == null ? "" : key.toString()));
  }

  /**
   * Domain queues a message published with {@code routingKey} on the events exchange reaches.
   */
  public List<String> routes(String routingKey) {
    List<String> matched = new ArrayList<>();
    for (Binding b : bindings) {
      if (topicMatches(b.getRoutingKey(), routingKey) && !matched.contains(b.getDestination())) {
        matched.add(b.getDestination());
      }
    }
    return matched;
  }

  static boolean topicMatches(String pattern, String routingKey) {
    return matchWords(pattern.split("\\.", -1), 0, routingKey.split("\\.", -1), 0);
  }

  private static boolean matchWords(String[] p, int pi, String[] k, int ki) {
    if (pi == p.length) return ki == k.length;
    if ("#".equals(p[pi])) {
      for (int skip = ki; skip <= k.length; skip++) {
        if (matchWords(p, pi + 1, k, skip)) return true;
      }
      return false;
    }
    if (ki == k.length) return false;
    if ("*".equals(p[pi]) || p[pi].equals(k[ki])) return matchWords(p, pi + 1, k, ki + 1);
    return false;
  }
}
