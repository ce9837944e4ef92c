package com.solanaeda.eventbus.producer;

public record PublisherMetrics(long totalPublished, long confirmed, long failed, long pending) {}
