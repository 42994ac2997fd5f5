package com.microshop.orderservice.service;

import com.microshop.common.dto.UserResponse;
import com.microshop.orderservice.client.UserLookup;
import com.microshop.orderservice.dto.CreateOrderRequest;
import com.microshop.orderservice.mapper.OrderMapper;
import com.microshop.orderservice.model.Order;
import com.microshop.orderservice.repository.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs OrderServiceImpl behind the real transactional proxy to check where
 * transactions begin relative to the call to user-service.
 */
@SpringJUnitConfig(OrderServiceTransactionTest.Config.class)
@DisplayName("OrderService transaction boundaries")
class OrderServiceTransactionTest {

    private static final AtomicBoolean TRANSACTION_OPEN_DURING_LOOKUP = new AtomicBoolean();

    @Configuration
    @EnableTransactionManagement
    static class Config {

        @Bean
        PlatformTransactionManager transactionManager() {
            return mock(PlatformTransactionManager.class);
        }

        @Bean
        OrderRepository orderRepository() {
            return mock(OrderRepository.class);
        }

        // records whether the transaction manager was already asked for a transaction
        @Bean
        UserLookup userLookup(PlatformTransactionManager transactionManager) {
            return userId -> {
                TRANSACTION_OPEN_DURING_LOOKUP.set(
                        !mockingDetails(transactionManager).getInvocations().isEmpty());
                return Optional.of(UserResponse.builder().id(userId).email("john@example.com").build());
            };
        }

        @Bean
        OrderService orderService(OrderRepository orderRepository, UserLookup userLookup) {
            return new OrderServiceImpl(orderRepository, Mappers.getMapper(OrderMapper.class), userLookup,
                    Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC));
        }
    }

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        reset(transactionManager, orderRepository);
        TRANSACTION_OPEN_DURING_LOOKUP.set(true);
        when(orderRepository.save(any(Order.class))).thenAnswer(i -> i.getArgument(0));
    }

    @Test
    @DisplayName("should call user-service without an open transaction")
    void shouldLookUpUserOutsideTransaction() {
        CreateOrderRequest request = CreateOrderRequest.builder()
                .userId(1L)
                .productName("Laptop")
                .quantity(1)
                .totalPrice(new BigDecimal("1299.99"))
                .build();

        orderService.createOrder(request);

        assertThat(TRANSACTION_OPEN_DURING_LOOKUP.get()).isFalse();
        verify(transactionManager, never()).getTransaction(any());
        verify(orderRepository).save(any(Order.class));
    }

    @Test
    @DisplayName("should still wrap reads in a transaction")
    void shouldWrapReadsInTransaction() {
        orderService.listOrders();

        verify(transactionManager).getTransaction(any());
    }
}
