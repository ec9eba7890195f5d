package com.facefinder.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Photo metadata attached to a face at ingestion time (EXIF capture time, GPS position, camera).
 * Every field is optional. {@code schemaVersion} is bumped whenever a field is added or its meaning changes.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FaceMetadata(
    @JsonProperty("schemaVersion")
    int schemaVersion,

    @JsonProperty("takenAt")
    LocalDateTime takenAt,

    @JsonProperty("locationName")
    String locationName,

    @JsonProperty("latitude")
    Double latitude,

    @JsonProperty("longitude")
    Double longitude,

    @JsonProperty("altitude")
    Double altitude,

    @JsonProperty("cameraMake")
    String cameraMake,

    @JsonProperty("cameraModel")
    String cameraModel
) {
    public static final int CURRENT_SCHEMA_VERSION = 1;

    @JsonCreator
    public FaceMetadata {
        if (schemaVersion <= 0) {
            schemaVersion = CURRENT_SCHEMA_VERSION;
        }
        if (schemaVersion > CURRENT_SCHEMA_VERSION) {
            throw new IllegalArgumentException("Unsupported metadata schema version: " + schemaVersion);
        }
        if (latitude != null && (latitude < -90 || latitude > 90)) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }
        if (longitude != null && (longitude < -180 || longitude > 180)) {
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
        }
    }

    public static FaceMetadata empty() {
        return FaceMetadata.builder().build();
    }

    @JsonIgnore
    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}
