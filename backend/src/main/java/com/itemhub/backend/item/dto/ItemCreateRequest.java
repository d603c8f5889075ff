package com.itemhub.backend.item.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.itemhub.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ItemCreateRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Size(max = 255)
        String title,

        String description
) {}
