package com.example.orchestrator.infrastructure.persistence.entity;

/**
 * Order status enum for persistence layer.
 */
public enum OrderStatusEnum {
    PENDING,
    COMPLETED,
    PAYMENT_FAILED
}
