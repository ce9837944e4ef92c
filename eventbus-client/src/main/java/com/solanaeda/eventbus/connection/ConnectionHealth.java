package com.solanaeda.eventbus.connection;

import java.time.Instant;

public record ConnectionHealth(boolean connected,
                               String url,
                               int attempt,
                               boolean reconnectPending,
                               String lastError,
                               Instant connectedAt) {}
