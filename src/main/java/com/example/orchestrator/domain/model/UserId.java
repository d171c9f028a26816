package com.example.orchestrator.domain.model;

import java.util.Objects;

/**
 * Value Object referencing a user held by the user directory.
 */
public final class UserId {

    private final long value;

    private UserId(long value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if value is not positive
     */
    public static UserId of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("UserId must be positive: " + value);
        }
        return new UserId(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserId userId = (UserId) o;
        return value == userId.value;
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
