package com.example.orchestrator.infrastructure.config;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Counts requests to {@code /orders} while they are processed, so shutdown can
 * wait for them. Actuator and API doc requests are not counted.
 */
@Component
@Order(1)
public class ActiveRequestFilter implements WebFilter {

    private static final String ORDERS_PATH = "/orders";

    private final GracefulShutdownConfig gracefulShutdownConfig;

    public ActiveRequestFilter(GracefulShutdownConfig gracefulShutdownConfig) {
        this.gracefulShutdownConfig = gracefulShutdownConfig;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!isOrderRequest(path)) {
            return chain.filter(exchange);
        }

        return Mono.defer(() -> {
            gracefulShutdownConfig.orderRequestStarted();
            return chain.filter(exchange)
                    .doFinally(signalType -> gracefulShutdownConfig.orderRequestFinished());
        });
    }

    private static boolean isOrderRequest(String path) {
        return path.equals(ORDERS_PATH) || path.startsWith(ORDERS_PATH + "/");
    }
}
