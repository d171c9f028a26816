package com.example.orchestrator.application.dto;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Command for creating a new order.
 */
public record CreateOrderCommand(
        long userId,
        String product,
        int quantity,
        BigDecimal amount
) {
    public CreateOrderCommand {
        Objects.requireNonNull(product, "Product cannot be null");
        Objects.requireNonNull(amount, "Amount cannot be null");
        if (userId <= 0) {
            throw new IllegalArgumentException("UserId must be positive");
        }
        if (product.isBlank()) {
            throw new IllegalArgumentException("Product cannot be blank");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (amount.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Amount cannot be negative");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("Amount cannot have more than 2 decimals");
        }
    }
}
