package com.example.orchestrator.domain.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate Root representing a purchase request and its processing outcome.
 * The identifier is assigned by the order store once the pending order is inserted.
 */
public final class Order {

    private OrderId orderId;
    private final UserId userId;
    private final String product;
    private final int quantity;
    private final Money amount;
    private final Instant createdAt;
    private OrderStatus status;

    private Order(OrderId orderId, UserId userId, String product, int quantity,
                  Money amount, Instant createdAt, OrderStatus status) {
        this.orderId = orderId;
        this.userId = Objects.requireNonNull(userId, "UserId cannot be null");
        this.product = Objects.requireNonNull(product, "Product cannot be null");
        this.amount = Objects.requireNonNull(amount, "Amount cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.quantity = quantity;

        if (product.isBlank()) {
            throw new IllegalArgumentException("Product cannot be blank");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
    }

    /**
     * Creates a new, not yet persisted, pending Order.
     *
     * @param userId   the owning user (already validated by the caller)
     * @param product  the product descriptor
     * @param quantity the quantity, must be positive
     * @param amount   the amount to charge
     * @return new Order in PENDING status without an identifier
     */
    public static Order create(UserId userId, String product, int quantity, Money amount) {
        return new Order(
                null,
                userId,
                product,
                quantity,
                amount,
                Instant.now().truncatedTo(ChronoUnit.MICROS),
                OrderStatus.PENDING
        );
    }

    /**
     * Reconstitutes an Order from persistence.
     */
    public static Order reconstitute(OrderId orderId, UserId userId, String product, int quantity,
                                     Money amount, Instant createdAt, OrderStatus status) {
        return new Order(
                Objects.requireNonNull(orderId, "OrderId cannot be null"),
                userId,
                product,
                quantity,
                amount,
                createdAt,
                status
        );
    }

    /**
     * Records the identifier assigned by the order store.
     *
     * @throws IllegalStateException if an identifier was already assigned
     */
    public void assignId(OrderId orderId) {
        Objects.requireNonNull(orderId, "OrderId cannot be null");
        if (this.orderId != null) {
            throw new IllegalStateException("Order already has id " + this.orderId);
        }
        this.orderId = orderId;
    }

    /**
     * Marks the order as completed after a successful payment.
     *
     * @throws IllegalStateException if order is not in PENDING status
     */
    public void markCompleted() {
        validateStatusTransition(OrderStatus.COMPLETED);
        this.status = OrderStatus.COMPLETED;
    }

    /**
     * Marks the order as failed after a rejected or unreachable payment.
     *
     * @throws IllegalStateException if order is not in PENDING status
     */
    public void markPaymentFailed() {
        validateStatusTransition(OrderStatus.PAYMENT_FAILED);
        this.status = OrderStatus.PAYMENT_FAILED;
    }

    private void validateStatusTransition(OrderStatus newStatus) {
        if (this.status != OrderStatus.PENDING) {
            throw new IllegalStateException(
                    "Cannot transition from " + this.status + " to " + newStatus +
                            ". Expected current status: " + OrderStatus.PENDING);
        }
    }

    public Optional<OrderId> getOrderId() {
        return Optional.ofNullable(orderId);
    }

    /**
     * @throws IllegalStateException if the order has not been persisted yet
     */
    public OrderId requireOrderId() {
        if (orderId == null) {
            throw new IllegalStateException("Order has not been persisted yet");
        }
        return orderId;
    }

    public UserId getUserId() {
        return userId;
    }

    public String getProduct() {
        return product;
    }

    public int getQuantity() {
        return quantity;
    }

    public Money getAmount() {
        return amount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public OrderStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return orderId != null && Objects.equals(orderId, order.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(orderId);
    }

    @Override
    public String toString() {
        return "Order{" +
                "orderId=" + orderId +
                ", userId=" + userId +
                ", status=" + status +
                ", quantity=" + quantity +
                ", amount=" + amount +
                '}';
    }
}
