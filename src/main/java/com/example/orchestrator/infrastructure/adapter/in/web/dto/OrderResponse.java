package com.example.orchestrator.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO carrying a finalized or stored order.
 */
public record OrderResponse(
        @JsonProperty("id") long id,
        @JsonProperty("user_id") long userId,
        @JsonProperty("product") String product,
        @JsonProperty("quantity") int quantity,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") Instant createdAt
) {}
