package com.example.orchestrator.infrastructure.adapter.in.web;

import com.example.orchestrator.application.dto.CreateOrderCommand;
import com.example.orchestrator.application.port.in.CreateOrderUseCase;
import com.example.orchestrator.application.port.in.GetOrderUseCase;
import com.example.orchestrator.infrastructure.adapter.in.web.dto.CreateOrderRequest;
import com.example.orchestrator.infrastructure.adapter.in.web.dto.OrderResponse;
import com.example.orchestrator.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebInputException;

import java.util.concurrent.CompletableFuture;

/**
 * REST controller for order operations.
 */
@RestController
@RequestMapping("/orders")
@Tag(name = "Orders", description = "Order creation and lookup")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final CreateOrderUseCase createOrderUseCase;
    private final GetOrderUseCase getOrderUseCase;
    private final OrderWebMapper mapper;

    public OrderController(
            CreateOrderUseCase createOrderUseCase,
            GetOrderUseCase getOrderUseCase,
            OrderWebMapper mapper) {
        this.createOrderUseCase = createOrderUseCase;
        this.getOrderUseCase = getOrderUseCase;
        this.mapper = mapper;
    }

    @Operation(
            summary = "Create an order",
            description = """
                    Validates the user against the user service, stores a pending order,
                    charges the payment service once and stores the final status.

                    A rejected or unreachable payment still answers 200; the body then
                    carries status `payment_failed`.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Order persisted and finalized (completed or payment_failed)",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = OrderResponse.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "id": 42,
                                      "user_id": 1,
                                      "product": "Laptop",
                                      "quantity": 1,
                                      "amount": 999.99,
                                      "status": "completed",
                                      "created_at": "2026-10-19T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Malformed or invalid request, or user validation failed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "USER_VALIDATION_FAILED",
                                      "message": "user not found",
                                      "timestamp": "2026-10-19T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "500", description = "Order could not be persisted")
    })
    @PostMapping
    public CompletableFuture<ResponseEntity<OrderResponse>> createOrder(
            @Valid @RequestBody CreateOrderRequest request) {

        log.info("Received order request for user: {}", request.userId());

        CreateOrderCommand command = mapper.toCommand(request);

        return createOrderUseCase.createOrder(command)
                .thenApply(result -> {
                    log.info("Order {} finished with status {}", result.orderId(), result.status().getCode());
                    return ResponseEntity.ok(mapper.toResponse(result));
                });
    }

    @Operation(
            summary = "Get an order",
            description = "Returns the stored order. May show `pending` while its creation is still in flight."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "400", description = "Invalid order id"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @GetMapping("/{orderId}")
    public CompletableFuture<ResponseEntity<OrderResponse>> getOrder(
            @Parameter(description = "Order id", required = true)
            @PathVariable long orderId) {
        log.debug("Query order: {}", orderId);
        if (orderId <= 0) {
            throw new ServerWebInputException("order id must be positive");
        }
        return getOrderUseCase.getOrder(orderId)
                .thenApply(result -> ResponseEntity.ok(mapper.toResponse(result)));
    }
}
