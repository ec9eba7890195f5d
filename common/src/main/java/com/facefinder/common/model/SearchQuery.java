package com.facefinder.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

@Builder
public record SearchQuery(
    @NotNull
    @Size(min = 1)
    @JsonProperty("embedding")
    float[] embedding,

    @Min(1)
    @JsonProperty("k")
    int k,

    @JsonProperty("roomId")
    String roomId,

    @JsonProperty("threshold")
    double threshold
) {
    @JsonCreator
    public SearchQuery {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding cannot be null or empty");
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive");
        }
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("Threshold must be between 0 and 1");
        }
    }

    /**
     * Creates a search query with similarity threshold
     */
    public static SearchQuery withThreshold(float[] embedding, int k, String roomId, double threshold) {
        return new SearchQuery(embedding, k, roomId, threshold);
    }
}
