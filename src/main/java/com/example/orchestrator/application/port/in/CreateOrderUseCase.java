package com.example.orchestrator.application.port.in;

import com.example.orchestrator.application.dto.CreateOrderCommand;
import com.example.orchestrator.application.dto.OrderResult;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for creating orders.
 */
public interface CreateOrderUseCase {

    /**
     * Creates a new order: validates the user, persists a pending order,
     * charges the payment and finalizes the status.
     *
     * @param command the order creation command
     * @return future containing the finalized order; completes exceptionally with
     *         {@link com.example.orchestrator.application.exception.UserValidationFailedException}
     *         or {@link com.example.orchestrator.application.exception.PersistenceFailedException}
     *         when no payment was attempted
     */
    CompletableFuture<OrderResult> createOrder(CreateOrderCommand command);
}
