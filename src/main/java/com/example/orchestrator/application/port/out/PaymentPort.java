package com.example.orchestrator.application.port.out;

import com.example.orchestrator.domain.model.Money;
import com.example.orchestrator.domain.model.OrderId;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for payment processor operations.
 */
public interface PaymentPort {

    /**
     * Charges the amount of an order. Called at most once per order.
     *
     * @param orderId the persisted order id
     * @param amount  the payment amount
     * @return future containing the payment result
     */
    CompletableFuture<PaymentResult> processPayment(OrderId orderId, Money amount);

    /**
     * Result of a payment operation.
     */
    record PaymentResult(
            PaymentStatus status,
            int httpStatus,
            String message
    ) {
        public static PaymentResult success(int httpStatus) {
            return new PaymentResult(PaymentStatus.SUCCESS, httpStatus, "payment processed");
        }

        public static PaymentResult rejected(int httpStatus) {
            return new PaymentResult(PaymentStatus.REJECTED, httpStatus, "payment failed");
        }

        public static PaymentResult unavailable(String reason) {
            return new PaymentResult(PaymentStatus.UNAVAILABLE, 0, "payment service unavailable: " + reason);
        }

        public boolean success() {
            return status == PaymentStatus.SUCCESS;
        }
    }

    enum PaymentStatus {
        SUCCESS,
        REJECTED,
        UNAVAILABLE
    }
}
