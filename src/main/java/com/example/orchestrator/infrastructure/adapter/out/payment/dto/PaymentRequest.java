package com.example.orchestrator.infrastructure.adapter.out.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Request body for {@code POST /payments}.
 */
public record PaymentRequest(
        @JsonProperty("order_id") long orderId,
        @JsonProperty("amount") BigDecimal amount
) {
    public static PaymentRequest of(long orderId, BigDecimal amount) {
        return new PaymentRequest(orderId, amount);
    }
}
