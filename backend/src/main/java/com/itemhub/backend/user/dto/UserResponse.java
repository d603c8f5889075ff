package com.itemhub.backend.user.dto;

import java.time.LocalDateTime;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.itemhub.backend.user.domain.User;

public record UserResponse(
        Long id,
        String email,
        @JsonProperty("full_name") String fullName,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("is_superuser") boolean superuser,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {

    /**
     * User 엔티티 -> 응답 DTO 변환 팩토리 (hashed_password는 절대 포함하지 않는다)
     */
    public static UserResponse from(User user) {
        Objects.requireNonNull(user, "user must not be null");

        return new UserResponse(
                user.getId(),
                user.getEmail(),
                user.getFullName(),
                user.isActive(),
                user.isSuperuser(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
