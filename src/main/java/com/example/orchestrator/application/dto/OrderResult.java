package com.example.orchestrator.application.dto;

import com.example.orchestrator.domain.model.Order;
import com.example.orchestrator.domain.model.OrderStatus;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of an order as returned to callers.
 */
public record OrderResult(
        long orderId,
        long userId,
        String product,
        int quantity,
        BigDecimal amount,
        OrderStatus status,
        Instant createdAt
) {
    /**
     * Creates a result from a persisted order.
     *
     * @throws IllegalStateException if the order has no identifier yet
     */
    public static OrderResult from(Order order) {
        return new OrderResult(
                order.requireOrderId().getValue(),
                order.getUserId().getValue(),
                order.getProduct(),
                order.getQuantity(),
                order.getAmount().getAmount(),
                order.getStatus(),
                order.getCreatedAt()
        );
    }
}
