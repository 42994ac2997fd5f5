package com.microshop.orderservice.service;

import com.microshop.orderservice.dto.CreateOrderRequest;
import com.microshop.orderservice.dto.OrderResponse;

import java.util.List;

public interface OrderService {

    /**
     * Creates a new order.
     * This method synchronously calls user-service to check that the referenced user exists.
     * Nothing is persisted when the user is unknown or user-service cannot answer.
     */
    OrderResponse createOrder(CreateOrderRequest request);

    List<OrderResponse> listOrders();

    /**
     * Retrieves a single order. Throws ResourceNotFoundException when absent.
     */
    OrderResponse getOrder(Long orderId);

    /**
     * Lists the orders placed by one user. Does not check that the user still exists.
     */
    List<OrderResponse> listOrdersByUser(Long userId);
}
