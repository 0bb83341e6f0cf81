package com.microservices.processor.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of {@code POST /api/process}. An explicit JSON {@code null} arrives as a
 * {@code NullNode}; a missing field leaves {@code data} null.
 */
public record ProcessRequest(JsonNode data) {
}
