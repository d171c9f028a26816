package com.example.orchestrator.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Request DTO for creating an order via REST API.
 * Any client-supplied id or status is ignored.
 */
public record CreateOrderRequest(
        @JsonProperty("user_id")
        @NotNull(message = "user_id is required")
        @Positive(message = "user_id must be positive")
        Long userId,

        @JsonProperty("product")
        @NotBlank(message = "product is required")
        String product,

        @JsonProperty("quantity")
        @NotNull(message = "quantity is required")
        @Positive(message = "quantity must be positive")
        Integer quantity,

        @JsonProperty("amount")
        @NotNull(message = "amount is required")
        @PositiveOrZero(message = "amount cannot be negative")
        @Digits(integer = 17, fraction = 2, message = "amount must have at most 17 integer digits and 2 decimals")
        BigDecimal amount
) {}
