package com.microshop.orderservice.service;

import com.microshop.common.exception.ResourceNotFoundException;
import com.microshop.orderservice.client.UserLookup;
import com.microshop.orderservice.dto.CreateOrderRequest;
import com.microshop.orderservice.dto.OrderResponse;
import com.microshop.orderservice.exception.UserValidationException;
import com.microshop.orderservice.mapper.OrderMapper;
import com.microshop.orderservice.model.Order;
import com.microshop.orderservice.model.OrderStatus;
import com.microshop.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;
    private final UserLookup userLookup;
    private final Clock clock;

    /**
     * Validates the user over HTTP, then persists the order.
     *
     * The remote call happens before any write, so a rejected order leaves no trace.
     * There is no compensation the other way round: if the insert fails after a
     * successful lookup the order is simply not created, and a user deleted after
     * validation still has their orders.
     *
     * Runs without a transaction: the lookup may block up to the configured timeout
     * and must not hold a database connection. The insert uses the repository's
     * own transaction.
     */
    @Override
    public OrderResponse createOrder(CreateOrderRequest request) {
        log.info("Order creation process started. User ID: {}", request.getUserId());

        // ExternalServiceException propagates as-is when user-service cannot answer
        userLookup.findUserById(request.getUserId())
                .orElseThrow(() -> {
                    log.warn("Order rejected, user not found: userId={}", request.getUserId());
                    return new UserValidationException(request.getUserId());
                });

        Order order = newPendingOrder(request);

        Order savedOrder = orderRepository.save(order);
        log.info("Order saved to database. ID: {}, userId: {}", savedOrder.getId(), savedOrder.getUserId());

        return orderMapper.toOrderResponse(savedOrder);
    }

    // Fills in the server-side defaults once, right before the insert.
    private Order newPendingOrder(CreateOrderRequest request) {
        Order order = new Order();
        order.setUserId(request.getUserId());
        order.setProductName(request.getProductName());
        order.setQuantity(request.getQuantity());
        order.setTotalPrice(request.getTotalPrice());
        order.setStatus(OrderStatus.PENDING);

        Instant orderDate = request.getOrderDate() != null ? request.getOrderDate() : Instant.now(clock);
        // PostgreSQL keeps microseconds; truncate so the response matches what a later read returns
        order.setOrderDate(orderDate.truncatedTo(ChronoUnit.MICROS));
        return order;
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> listOrders() {
        return orderRepository.findAll().stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrder(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> listOrdersByUser(Long userId) {
        return orderRepository.findByUserId(userId).stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }
}
