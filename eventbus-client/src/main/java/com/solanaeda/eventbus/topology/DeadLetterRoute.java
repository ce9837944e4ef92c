package com.solanaeda.eventbus.topology;

public record DeadLetterRoute(String exchange, String routingKey) {}
