package com.facefinder.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@Schema(description = "Request to create a new room")
public record CreateRoomRequest(
    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_-]{1,64}")
    @Schema(description = "Unique room identifier", example = "wedding-2024", requiredMode = Schema.RequiredMode.REQUIRED)
    String id,

    @Schema(description = "Display name, defaults to the id", example = "Anna & Tom wedding")
    String name,

    @Min(1)
    @Schema(description = "Embedding dimension, defaults to the configured one", example = "1024", minimum = "1")
    Integer dimension
) {}
