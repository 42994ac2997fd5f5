package com.microshop.orderservice.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Where user-service lives and how long order-service waits for it.
 * Bound once at startup from the {@code user-service.*} properties.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "user-service")
public class UserServiceProperties {

    @NotBlank
    private String baseUrl = "http://localhost:8081";

    // applies to both connecting and waiting for the response
    @NotNull
    private Duration timeout = Duration.ofSeconds(3);
}
