package com.solanaeda.eventbus.topology;

import org.springframework.amqp.core.ExchangeTypes;

public enum EventExchange {
  /** Domain events, routed by topic key. */
  EVENTS("solana.events", ExchangeTypes.TOPIC),
  /** Worker status broadcast. */
  STATUS("solana.status", ExchangeTypes.FANOUT),
  /** Dead-letter exchange for every domain queue. */
  DLQ("solana.dlq", ExchangeTypes.FANOUT);

  private final String exchangeName;
  private final String defaultType;

  EventExchange(String exchangeName, String defaultType) {
    this.exchangeName = exchangeName;
    this.defaultType = defaultType;
  }

  public String exchangeName() { return exchangeName; }
  public String defaultType() { return defaultType; }
}
