package com.example.orchestrator.application.exception;

import com.example.orchestrator.domain.model.OrderId;
import com.example.orchestrator.domain.model.OrderStatus;

/**
 * Raised when the terminal status of an order could not be written back.
 * Logged only; the caller still receives the payment outcome.
 */
public class StatusUpdateFailedException extends RuntimeException {

    private final OrderId orderId;
    private final OrderStatus targetStatus;

    public StatusUpdateFailedException(OrderId orderId, OrderStatus targetStatus, Throwable cause) {
        super("Failed to update order " + orderId + " to " + targetStatus.getCode(), cause);
        this.orderId = orderId;
        this.targetStatus = targetStatus;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public OrderStatus getTargetStatus() {
        return targetStatus;
    }
}
