package com.microshop.orderservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {

    @NotNull(message = "User ID cannot be null")
    private Long userId;

    @NotBlank(message = "Product name cannot be blank")
    private String productName;

    @NotNull(message = "Quantity cannot be null")
    @Positive(message = "Quantity must be at least 1")
    private Integer quantity;

    @NotNull(message = "Total price cannot be null")
    @DecimalMin(value = "0.00", message = "Total price cannot be negative")
    @Digits(integer = 10, fraction = 2, message = "Total price must be in whole cents")
    private BigDecimal totalPrice;

    // optional, defaults to the creation time
    private Instant orderDate;
}
