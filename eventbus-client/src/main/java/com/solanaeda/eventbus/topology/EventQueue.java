package com.solanaeda.eventbus.topology;

import java.util.List;
import java.util.Optional;

/**
 * Domain queues and the routing-key patterns that bind them to the events exchange.
 */
public enum EventQueue {
  BURN_EVENTS("q.burn.events", "burn.detected", "burn.large"),
  TRADE_EVENTS("q.trade.events", "trade.executed", "trade.failed", "trade.confirmed"),
  PRICE_EVENTS("q.price.events", "price.updated", "price.threshold"),
  LIQUIDITY_EVENTS("q.liquidity.events", "liquidity.added", "liquidity.removed", "liquidity.changed"),
  POSITION_EVENTS("q.positions", "position.opened", "position.closed", "position.updated"),
  WORKERS_STATUS("q.workers", "worker.#"),
  TOKEN_LAUNCH("q.token.launch", "token.launched", "token.delist"),
  MARKET_EVENTS("q.market.events", "market.trending", "market.summary"),
  ARBITRAGE_EVENTS("q.arbitrage", "arbitrage.detected", "arbitrage.executed"),
  SYSTEM_EVENTS("q.system", "system.#");

  public static final String DLQ_SUFFIX = ".dlq";

  private final String queueName;
  private final List<String> routingKeys;

  EventQueue(String queueName, String... routingKeys) {
    this.queueName = queueName;
    this.routingKeys = List.of(routingKeys);
  }

  public String queueName() { return queueName; }
  public List<String> routingKeys() { return routingKeys; }
  public String deadLetterQueueName() { return queueName + DLQ_SUFFIX; }

  /** Key set as {@code x-dead-letter-routing-key}; equals the DLQ binding key. */
  public String deadLetterRoutingKey() { return queueName + DLQ_SUFFIX; }

  public static Optional<EventQueue> fromQueueName(String name) {
    for (EventQueue q : values()) {
      if (q.queueName.equals(name)) return Optional.of(q);
    }
    return Optional.empty();
  }
}
