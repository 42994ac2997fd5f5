package com.microshop.userservice.mapper;

import com.microshop.common.dto.UserResponse;
import com.microshop.userservice.dto.CreateUserRequest;
import com.microshop.userservice.model.User;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface UserMapper {

    UserResponse toUserResponse(User user);

    /**
     * Creates a new User entity from the request.
     * The ID is ignored bc it is generated upon persistence.
     */
    @Mapping(target = "id", ignore = true)
    User toUser(CreateUserRequest request);
}
