package com.facefinder.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Request to open a search session for a reference face")
public record CreateSessionRequest(
    @NotBlank
    @Schema(description = "Room the session searches in", example = "wedding-2024")
    String roomId,

    @NotNull
    @Schema(description = "Embedding of the guest's reference face")
    float[] embedding
) {}
