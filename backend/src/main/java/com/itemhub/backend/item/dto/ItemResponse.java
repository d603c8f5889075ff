package com.itemhub.backend.item.dto;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.itemhub.backend.item.domain.Item;

public record ItemResponse(
        Long id,
        String title,
        String description,
        @JsonProperty("owner_id") Long ownerId,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {

    public static ItemResponse from(Item item) {
        return new ItemResponse(
                item.getId(),
                item.getTitle(),
                item.getDescription(),
                item.getOwnerId(),
                item.getCreatedAt(),
                item.getUpdatedAt()
        );
    }
}
