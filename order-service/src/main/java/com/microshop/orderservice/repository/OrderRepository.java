package com.microshop.orderservice.repository;

import com.microshop.orderservice.model.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    // find all orders for a user
    List<Order> findByUserId(Long userId);
}
