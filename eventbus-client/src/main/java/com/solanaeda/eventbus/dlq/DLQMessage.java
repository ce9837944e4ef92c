package com.solanaeda.eventbus.dlq;

import com.solanaeda.eventbus.envelope.EventEnvelope;

import java.time.Instant;

/**
 * A dead letter with its failure metadata, rebuilt from message headers.
 */
public record DLQMessage(
    EventEnvelope envelope,
    String originalQueue,
    int retryCount,
    Instant firstFailedAt,
    Instant lastFailedAt,
    String errorReason
) {}
