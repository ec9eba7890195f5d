package com.facefinder.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.time.Instant;

/**
 * One detected face as kept by the embedding store.
 * Records are immutable; the only change a record ever sees is the tombstone flag.
 */
@Builder(toBuilder = true)
public record FaceRecord(
    @JsonProperty("id")
    long id,

    @NotBlank
    @JsonProperty("roomId")
    String roomId,

    @NotBlank
    @JsonProperty("photo")
    String photo,

    @NotNull
    @JsonProperty("bbox")
    BoundingBox bbox,

    @JsonProperty("confidence")
    double confidence,

    @JsonProperty("metadata")
    FaceMetadata metadata,

    @NotNull
    @Size(min = 1)
    @JsonProperty("embedding")
    float[] embedding,

    @JsonProperty("deleted")
    boolean deleted,

    @JsonProperty("createdAt")
    Instant createdAt
) {
    @JsonCreator
    public FaceRecord {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding cannot be null or empty");
        }
        if (photo == null || photo.isBlank()) {
            throw new IllegalArgumentException("Photo identifier cannot be blank");
        }
        if (metadata == null) {
            metadata = FaceMetadata.empty();
        }
    }

    /**
     * Copy of this record with the tombstone flag set
     */
    public FaceRecord asDeleted() {
        return toBuilder().deleted(true).build();
    }

    @JsonIgnore
    public int dimension() {
        return embedding.length;
    }
}
