package com.microshop.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "orders")
@Getter
@Setter
@ToString
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // User ID who placed the order (from user-service).
    // Plain reference: no foreign key, the user may disappear later.
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(nullable = false)
    private Integer quantity;

    @Column(name = "total_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING) // Store enum as string in DB
    @Column(nullable = false)
    private OrderStatus status;

    // set by OrderServiceImpl before the insert, never by a lifecycle hook
    @Column(name = "order_date", nullable = false)
    private Instant orderDate;
}
