package com.example.orchestrator.infrastructure.adapter.out.payment;

import com.example.orchestrator.application.port.out.PaymentPort;
import com.example.orchestrator.domain.model.Money;
import com.example.orchestrator.domain.model.OrderId;
import com.example.orchestrator.infrastructure.adapter.out.payment.dto.PaymentRequest;
import com.example.orchestrator.infrastructure.adapter.out.payment.mapper.PaymentMapper;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Adapter for the payment processor: {@code POST /payments}.
 * Single attempt per order, bounded by a TimeLimiter.
 */
@Component
public class PaymentServiceAdapter implements PaymentPort {

    private static final Logger log = LoggerFactory.getLogger(PaymentServiceAdapter.class);

    private final WebClient webClient;
    private final PaymentMapper mapper;

    public PaymentServiceAdapter(
            @Qualifier("paymentWebClient") WebClient webClient,
            PaymentMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    @TimeLimiter(name = "paymentTL", fallbackMethod = "processPaymentTimeoutFallback")
    public CompletableFuture<PaymentResult> processPayment(OrderId orderId, Money amount) {
        log.debug("Processing payment for order: {}, amount: {}", orderId, amount);

        PaymentRequest request = mapper.toRequest(orderId, amount);

        return webClient.post()
                .uri("/payments")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchangeToMono(response -> {
                    PaymentResult result = mapper.toResult(response.statusCode());
                    log.debug("Payment processor answered {} for order {}", result.httpStatus(), orderId);
                    return response.releaseBody().thenReturn(result);
                })
                .onErrorResume(throwable -> {
                    log.warn("Payment call failed for order {}: {}", orderId, throwable.toString());
                    return Mono.just(PaymentResult.unavailable(throwable.getClass().getSimpleName()));
                })
                .toFuture();
    }

    /**
     * Fallback when the payment call exceeds the time limit.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<PaymentResult> processPaymentTimeoutFallback(
            OrderId orderId, Money amount, TimeoutException ex) {
        log.warn("Payment processor timed out for order: {}", orderId);
        return CompletableFuture.completedFuture(PaymentResult.unavailable("timeout"));
    }
}
