package com.example.orchestrator.domain.model;

/**
 * Enum representing the possible states of an Order.
 */
public enum OrderStatus {

    /**
     * Persisted, payment outcome not yet known.
     */
    PENDING("pending"),

    /**
     * Payment succeeded. Terminal.
     */
    COMPLETED("completed"),

    /**
     * Payment was rejected, errored or timed out. Terminal.
     */
    PAYMENT_FAILED("payment_failed");

    private final String code;

    OrderStatus(String code) {
        this.code = code;
    }

    /**
     * Lower-case code used on the wire.
     */
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
