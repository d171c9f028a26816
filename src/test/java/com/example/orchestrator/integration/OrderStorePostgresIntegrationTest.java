package com.example.orchestrator.integration;

import com.example.orchestrator.application.port.out.OrderStorePort;
import com.example.orchestrator.domain.model.Money;
import com.example.orchestrator.domain.model.Order;
import com.example.orchestrator.domain.model.OrderId;
import com.example.orchestrator.domain.model.OrderStatus;
import com.example.orchestrator.domain.model.UserId;
import com.example.orchestrator.support.PostgresTestContainerSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Order store tests against a real PostgreSQL instance.
 */
@DisplayName("Order Store PostgreSQL Integration Tests")
class OrderStorePostgresIntegrationTest extends PostgresTestContainerSupport {

    @Autowired
    private OrderStorePort orderStorePort;

    @Test
    @DisplayName("should_insert_pending_order_and_update_status")
    void should_insert_pending_order_and_update_status() throws Exception {
        // Given
        Order order = Order.create(UserId.of(1), "book", 2, Money.of(new BigDecimal("20.00")));

        // When
        OrderId id = orderStorePort.insert(order).get();
        Order stored = orderStorePort.findById(id).get().orElseThrow();

        // Then
        assertThat(stored.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(stored.getAmount()).isEqualTo(Money.of(new BigDecimal("20")));
        assertThat(stored.getCreatedAt()).isEqualTo(order.getCreatedAt());

        // When
        orderStorePort.updateStatus(id, OrderStatus.COMPLETED).get();

        // Then
        assertThat(orderStorePort.findById(id).get().orElseThrow().getStatus())
                .isEqualTo(OrderStatus.COMPLETED);
    }

    @Test
    @DisplayName("should_assign_distinct_ids_to_concurrent_inserts")
    void should_assign_distinct_ids_to_concurrent_inserts() {
        // When
        List<CompletableFuture<OrderId>> inserts = IntStream.range(0, 20)
                .mapToObj(i -> orderStorePort.insert(
                        Order.create(UserId.of(1), "book", 1, Money.of(BigDecimal.ONE))))
                .toList();
        List<OrderId> ids = inserts.stream().map(CompletableFuture::join).toList();

        // Then
        assertThat(ids).doesNotHaveDuplicates().hasSize(20);
    }

    @Test
    @DisplayName("should_fail_status_update_for_unknown_order")
    void should_fail_status_update_for_unknown_order() {
        assertThatThrownBy(() -> orderStorePort.updateStatus(OrderId.of(Long.MAX_VALUE), OrderStatus.COMPLETED).get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
