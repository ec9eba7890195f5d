package com.facefinder.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;

/**
 * Face rectangle in source-image pixel coordinates.
 */
public record BoundingBox(
    @Min(0)
    @JsonProperty("x")
    int x,

    @Min(0)
    @JsonProperty("y")
    int y,

    @Min(1)
    @JsonProperty("width")
    int width,

    @Min(1)
    @JsonProperty("height")
    int height
) {
    @JsonCreator
    public BoundingBox {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Bounding box origin must be non-negative");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Bounding box width and height must be positive");
        }
    }

    public static BoundingBox of(int x, int y, int width, int height) {
        return new BoundingBox(x, y, width, height);
    }
}
