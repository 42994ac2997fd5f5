package com.microshop.orderservice.mapper;

import com.microshop.orderservice.dto.OrderResponse;
import com.microshop.orderservice.model.Order;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    // Order -> OrderResponse
    OrderResponse toOrderResponse(Order order);

    // Note: no request -> entity mapping here.
    // Status and order date are decided in the service layer after the user is validated.
}
