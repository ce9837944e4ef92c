package com.solanaeda.eventbus.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Wire record carried as the UTF-8 JSON body of every message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventEnvelope(
    String version,
    String id,
    String correlationId,
    String causationId,
    Instant timestamp,
    String type,
    String routingKey,
    JsonNode data,
    String source
) {}
