package com.itemhub.backend.item.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.itemhub.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * [아이템 부분 수정 DTO]
 * - null 필드는 "변경 안 함"
 * - title을 보낼 거면 공백일 수 없다.
 */
public record ItemUpdateRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Size(min = 1, max = 255)
        @Pattern(regexp = ".*\\S.*")
        String title,

        String description
) {}
