package com.example.orchestrator.infrastructure.persistence;

import com.example.orchestrator.application.port.out.OrderStorePort;
import com.example.orchestrator.domain.model.Order;
import com.example.orchestrator.domain.model.OrderId;
import com.example.orchestrator.domain.model.OrderStatus;
import com.example.orchestrator.infrastructure.persistence.entity.OrderEntity;
import com.example.orchestrator.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.orchestrator.infrastructure.persistence.repository.OrderJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * JPA-backed order store.
 * Blocking repository calls run on the bounded-elastic scheduler so that
 * request threads are never blocked. Every call is its own transaction.
 */
@Service
public class OrderPersistenceService implements OrderStorePort {

    private static final Logger log = LoggerFactory.getLogger(OrderPersistenceService.class);

    private final OrderJpaRepository orderRepository;
    private final OrderPersistenceMapper mapper;

    public OrderPersistenceService(
            OrderJpaRepository orderRepository,
            OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.mapper = mapper;
    }

    @Override
    public CompletableFuture<OrderId> insert(Order order) {
        return Mono.fromCallable(() -> {
                    OrderEntity saved = orderRepository.save(mapper.toEntity(order));
                    log.debug("Saved order entity: {}", saved.getId());
                    return OrderId.of(saved.getId());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .toFuture();
    }

    @Override
    public CompletableFuture<Void> updateStatus(OrderId orderId, OrderStatus status) {
        return Mono.fromCallable(() -> {
                    int updated = orderRepository.updateStatus(orderId.getValue(), mapper.toStatusEnum(status));
                    if (updated == 0) {
                        throw new IllegalStateException("No stored order with id " + orderId);
                    }
                    log.debug("Updated order {} to status {}", orderId, status);
                    return updated;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then()
                .toFuture();
    }

    @Override
    public CompletableFuture<Optional<Order>> findById(OrderId orderId) {
        return Mono.fromCallable(() -> orderRepository.findById(orderId.getValue()).map(mapper::toDomain))
                .subscribeOn(Schedulers.boundedElastic())
                .toFuture();
    }
}
