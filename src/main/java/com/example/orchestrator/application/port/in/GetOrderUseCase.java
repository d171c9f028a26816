package com.example.orchestrator.application.port.in;

import com.example.orchestrator.application.dto.OrderResult;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for reading stored orders.
 */
public interface GetOrderUseCase {

    /**
     * @param orderId the store-assigned order id
     * @return future containing the stored order; completes exceptionally with
     *         {@link com.example.orchestrator.application.exception.OrderNotFoundException}
     *         if no such order exists
     */
    CompletableFuture<OrderResult> getOrder(long orderId);
}
