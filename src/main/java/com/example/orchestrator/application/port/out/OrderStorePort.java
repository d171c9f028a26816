package com.example.orchestrator.application.port.out;

import com.example.orchestrator.domain.model.Order;
import com.example.orchestrator.domain.model.OrderId;
import com.example.orchestrator.domain.model.OrderStatus;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for order persistence.
 * Each operation is its own atomic unit; no transaction spans several calls.
 */
public interface OrderStorePort {

    /**
     * Inserts a new pending order.
     *
     * @param order the order to insert, without an id
     * @return future containing the store-assigned id
     */
    CompletableFuture<OrderId> insert(Order order);

    /**
     * Overwrites the status of a stored order.
     *
     * @param orderId the order id
     * @param status  the new status
     * @return future completing when the update is durable
     */
    CompletableFuture<Void> updateStatus(OrderId orderId, OrderStatus status);

    /**
     * @param orderId the order id
     * @return future containing the order if it exists
     */
    CompletableFuture<Optional<Order>> findById(OrderId orderId);
}
