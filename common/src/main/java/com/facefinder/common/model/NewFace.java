package com.facefinder.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * A face handed over by the embedding producer, not yet assigned an id.
 */
@Builder
public record NewFace(
    @NotNull
    @JsonProperty("embedding")
    float[] embedding,

    @NotBlank
    @JsonProperty("photo")
    String photo,

    @NotNull
    @JsonProperty("bbox")
    BoundingBox bbox,

    @JsonProperty("confidence")
    double confidence,

    @JsonProperty("metadata")
    FaceMetadata metadata
) {
    @JsonCreator
    public NewFace {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding cannot be null or empty");
        }
        if (photo == null || photo.isBlank()) {
            throw new IllegalArgumentException("Photo identifier cannot be blank");
        }
        if (bbox == null) {
            throw new IllegalArgumentException("Bounding box is required");
        }
        if (metadata == null) {
            metadata = FaceMetadata.empty();
        }
    }
}
