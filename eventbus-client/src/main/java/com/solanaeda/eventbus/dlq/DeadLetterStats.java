package com.solanaeda.eventbus.dlq;

/**
 * @param messageCount current depth, or -1 when the queue could not be inspected
 */
public record DeadLetterStats(String queueName, int messageCount, long retried, long permanentFailures, long skipped) {}
