package com.solanaeda.eventbus.topology;

public record QueueInfo(String queue, int messageCount, int consumerCount) {}
