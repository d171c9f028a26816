package com.example.orchestrator.infrastructure.adapter.in.web.mapper;

import com.example.orchestrator.application.dto.CreateOrderCommand;
import com.example.orchestrator.application.dto.OrderResult;
import com.example.orchestrator.infrastructure.adapter.in.web.dto.CreateOrderRequest;
import com.example.orchestrator.infrastructure.adapter.in.web.dto.OrderResponse;
import org.springframework.stereotype.Component;

/**
 * Mapper between web DTOs and application DTOs.
 */
@Component
public class OrderWebMapper {

    public CreateOrderCommand toCommand(CreateOrderRequest request) {
        return new CreateOrderCommand(
                request.userId(),
                request.product(),
                request.quantity(),
                request.amount());
    }

    public OrderResponse toResponse(OrderResult result) {
        return new OrderResponse(
                result.orderId(),
                result.userId(),
                result.product(),
                result.quantity(),
                result.amount(),
                result.status().getCode(),
                result.createdAt());
    }
}
