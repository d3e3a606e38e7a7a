package com.melo.backend.global.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One room state entry of a given record type; {@code target} is its state key.
 */
public record DurableRecord(String target, JsonNode payload) {
}
