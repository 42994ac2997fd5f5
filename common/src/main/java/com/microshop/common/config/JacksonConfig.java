package com.microshop.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson settings shared by both services, applied on top of Spring Boot's ObjectMapper.
 * The same mapper backs the MVC controllers and the WebClient codecs, so order-service
 * reads user-service payloads with the rules it writes its own with.
 */
@Configuration
public class JacksonConfig {

  @Bean
  public Jackson2ObjectMapperBuilderCustomizer microshopJacksonCustomizer() {
    return builder -> builder
        .modulesToInstall(new JavaTimeModule())
        // Instant fields (orderDate) go out as ISO-8601 strings
        .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        // a peer adding fields must not break the reader
        .featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }
}
