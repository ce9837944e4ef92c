package com.solanaeda.eventbus.consumer;

public record ConsumerMetrics(long totalProcessed, long acknowledged, long nacked, long rejected, long processing) {}
