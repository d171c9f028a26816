package com.example.orchestrator.application.exception;

/**
 * Thrown when an order lookup finds no stored order.
 */
public class OrderNotFoundException extends RuntimeException {

    private final long orderId;

    public OrderNotFoundException(long orderId) {
        super("Order not found: " + orderId);
        this.orderId = orderId;
    }

    public long getOrderId() {
        return orderId;
    }
}
