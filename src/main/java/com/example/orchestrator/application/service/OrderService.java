package com.example.orchestrator.application.service;

import com.example.orchestrator.application.dto.CreateOrderCommand;
import com.example.orchestrator.application.dto.OrderResult;
import com.example.orchestrator.application.exception.OrderNotFoundException;
import com.example.orchestrator.application.exception.PersistenceFailedException;
import com.example.orchestrator.application.exception.StatusUpdateFailedException;
import com.example.orchestrator.application.exception.UserValidationFailedException;
import com.example.orchestrator.application.port.in.CreateOrderUseCase;
import com.example.orchestrator.application.port.in.GetOrderUseCase;
import com.example.orchestrator.application.port.out.OrderStorePort;
import com.example.orchestrator.application.port.out.PaymentPort;
import com.example.orchestrator.application.port.out.PaymentPort.PaymentResult;
import com.example.orchestrator.application.port.out.UserDirectoryPort;
import com.example.orchestrator.application.port.out.UserDirectoryPort.UserLookupResult;
import com.example.orchestrator.domain.model.Money;
import com.example.orchestrator.domain.model.Order;
import com.example.orchestrator.domain.model.OrderId;
import com.example.orchestrator.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Application service that orchestrates order creation.
 * Flow: validate user → insert pending order → charge payment → finalize status.
 * Steps run strictly in sequence and no outbound call is retried.
 */
@Service
public class OrderService implements CreateOrderUseCase, GetOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final UserDirectoryPort userDirectoryPort;
    private final OrderStorePort orderStorePort;
    private final PaymentPort paymentPort;

    public OrderService(
            UserDirectoryPort userDirectoryPort,
            OrderStorePort orderStorePort,
            PaymentPort paymentPort) {
        this.userDirectoryPort = userDirectoryPort;
        this.orderStorePort = orderStorePort;
        this.paymentPort = paymentPort;
    }

    @Override
    public CompletableFuture<OrderResult> createOrder(CreateOrderCommand command) {
        UserId userId = UserId.of(command.userId());
        log.info("Creating order for user: {}, product: {}, quantity: {}",
                userId, command.product(), command.quantity());

        return validateUser(userId)
                .thenCompose(v -> persistPendingOrder(userId, command))
                .thenCompose(this::processPayment)
                .thenCompose(this::finalizeStatus)
                .thenApply(OrderResult::from);
    }

    @Override
    public CompletableFuture<OrderResult> getOrder(long orderId) {
        OrderId id = OrderId.of(orderId);
        return orderStorePort.findById(id)
                .thenApply(found -> found
                        .map(OrderResult::from)
                        .orElseThrow(() -> new OrderNotFoundException(orderId)));
    }

    private CompletableFuture<Void> validateUser(UserId userId) {
        log.debug("Validating user: {}", userId);

        return invoke(() -> userDirectoryPort.lookupUser(userId))
                .exceptionally(throwable -> UserLookupResult.unavailable(describe(throwable)))
                .thenAccept(result -> {
                    if (!result.exists()) {
                        log.warn("User validation failed for user {}: {}", userId, result.message());
                        throw new UserValidationFailedException(userId, result.message());
                    }
                    log.debug("User validated: {}", userId);
                });
    }

    private CompletableFuture<Order> persistPendingOrder(UserId userId, CreateOrderCommand command) {
        Order order = Order.create(userId, command.product(), command.quantity(), Money.of(command.amount()));

        return invoke(() -> orderStorePort.insert(order))
                .handle((orderId, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = unwrap(throwable);
                        log.error("Failed to persist order for user {}", userId, cause);
                        throw new PersistenceFailedException("Failed to persist order", cause);
                    }
                    order.assignId(orderId);
                    log.info("Order {} persisted with status {}", orderId, order.getStatus().getCode());
                    return order;
                });
    }

    private CompletableFuture<Order> processPayment(Order order) {
        OrderId orderId = order.requireOrderId();
        log.debug("Processing payment for order: {}, amount: {}", orderId, order.getAmount());

        return invoke(() -> paymentPort.processPayment(orderId, order.getAmount()))
                .exceptionally(throwable -> PaymentResult.unavailable(describe(throwable)))
                .thenApply(result -> {
                    if (result.success()) {
                        order.markCompleted();
                        log.info("Payment completed for order: {}", orderId);
                    } else {
                        order.markPaymentFailed();
                        log.warn("Payment failed for order {}: {}", orderId, result.message());
                    }
                    return order;
                });
    }

    /**
     * Writes the terminal status back. A failed write is logged and never
     * replaces the payment outcome already recorded on the order.
     */
    private CompletableFuture<Order> finalizeStatus(Order order) {
        OrderId orderId = order.requireOrderId();

        return invoke(() -> orderStorePort.updateStatus(orderId, order.getStatus()))
                .handle((v, throwable) -> {
                    if (throwable != null) {
                        StatusUpdateFailedException failure =
                                new StatusUpdateFailedException(orderId, order.getStatus(), unwrap(throwable));
                        log.error("{}; responding with payment outcome", failure.getMessage(), failure);
                    } else {
                        log.debug("Order {} finalized as {}", orderId, order.getStatus().getCode());
                    }
                    return order;
                });
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static String describe(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
