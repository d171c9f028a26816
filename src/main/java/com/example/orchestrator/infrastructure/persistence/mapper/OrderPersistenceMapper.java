package com.example.orchestrator.infrastructure.persistence.mapper;

import com.example.orchestrator.domain.model.*;
import com.example.orchestrator.infrastructure.persistence.entity.OrderEntity;
import com.example.orchestrator.infrastructure.persistence.entity.OrderStatusEnum;
import org.springframework.stereotype.Component;

/**
 * Mapper between domain Order and persistence OrderEntity.
 */
@Component
public class OrderPersistenceMapper {

    public OrderEntity toEntity(Order order) {
        OrderEntity entity = new OrderEntity();
        order.getOrderId().ifPresent(id -> entity.setId(id.getValue()));
        entity.setUserId(order.getUserId().getValue());
        entity.setProduct(order.getProduct());
        entity.setQuantity(order.getQuantity());
        entity.setAmount(order.getAmount().getAmount());
        entity.setStatus(toStatusEnum(order.getStatus()));
        entity.setCreatedAt(order.getCreatedAt());
        return entity;
    }

    public Order toDomain(OrderEntity entity) {
        return Order.reconstitute(
                OrderId.of(entity.getId()),
                UserId.of(entity.getUserId()),
                entity.getProduct(),
                entity.getQuantity(),
                Money.of(entity.getAmount()),
                entity.getCreatedAt(),
                toDomainStatus(entity.getStatus())
        );
    }

    public OrderStatusEnum toStatusEnum(OrderStatus status) {
        return switch (status) {
            case PENDING -> OrderStatusEnum.PENDING;
            case COMPLETED -> OrderStatusEnum.COMPLETED;
            case PAYMENT_FAILED -> OrderStatusEnum.PAYMENT_FAILED;
        };
    }

    public OrderStatus toDomainStatus(OrderStatusEnum status) {
        return switch (status) {
            case PENDING -> OrderStatus.PENDING;
            case COMPLETED -> OrderStatus.COMPLETED;
            case PAYMENT_FAILED -> OrderStatus.PAYMENT_FAILED;
        };
    }
}
