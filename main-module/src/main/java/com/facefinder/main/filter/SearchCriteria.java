package com.facefinder.main.filter;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.time.LocalDate;

/**
 * Structured filters of a session query, already extracted from the user's text.
 * Every field is optional; a radius filter needs latitude, longitude and radius together.
 */
@Builder
@Schema(description = "Structured filters applied to the matched photos")
public record SearchCriteria(
    @Schema(description = "Case-insensitive part of the location name", example = "Paris")
    @JsonProperty("location")
    String location,

    @Schema(description = "First capture day, inclusive", example = "2024-01-01")
    @JsonProperty("dateFrom")
    LocalDate dateFrom,

    @Schema(description = "Last capture day, inclusive", example = "2024-01-31")
    @JsonProperty("dateTo")
    LocalDate dateTo,

    @JsonProperty("latitude")
    Double latitude,

    @JsonProperty("longitude")
    Double longitude,

    @Schema(description = "Search radius around latitude/longitude in kilometres", example = "5.0")
    @JsonProperty("radiusKm")
    Double radiusKm
) {
    public SearchCriteria {
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new IllegalArgumentException("dateFrom must not be after dateTo");
        }
        boolean anyGeo = latitude != null || longitude != null || radiusKm != null;
        boolean allGeo = latitude != null && longitude != null && radiusKm != null;
        if (anyGeo && !allGeo) {
            throw new IllegalArgumentException("latitude, longitude and radiusKm must be given together");
        }
        if (radiusKm != null && radiusKm < 0) {
            throw new IllegalArgumentException("radiusKm must not be negative");
        }
    }

    public static SearchCriteria none() {
        return SearchCriteria.builder().build();
    }

    public boolean hasLocation() {
        return location != null && !location.isBlank();
    }

    public boolean hasDateRange() {
        return dateFrom != null || dateTo != null;
    }

    public boolean hasRadius() {
        return radiusKm != null;
    }
}
