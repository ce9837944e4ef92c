package com.solanaeda.eventbus.consumer;

/**
 * @param consumerTag fixed tag, or {@code null} to let the broker generate one
 */
public record ConsumerOptions(boolean manualAck, int prefetch, String consumerTag) {

  public static ConsumerOptions manual(int prefetch) {
    return new ConsumerOptions(true, prefetch, null);
  }

  public ConsumerOptions withConsumerTag(String consumerTag) {
    return new ConsumerOptions(manualAck, prefetch, consumerTag);
  }
}
