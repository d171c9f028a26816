package com.example.orchestrator.domain.model;

import java.util.Objects;

/**
 * Value Object representing a store-assigned order identifier.
 */
public final class OrderId {

    private final long value;

    private OrderId(long value) {
        this.value = value;
    }

    /**
     * Creates an OrderId from a store-assigned value.
     *
     * @param value positive identifier
     * @return new OrderId instance
     * @throws IllegalArgumentException if value is not positive
     */
    public static OrderId of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Invalid OrderId: " + value);
        }
        return new OrderId(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderId orderId = (OrderId) o;
        return value == orderId.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
