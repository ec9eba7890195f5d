package com.facefinder.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Catalogue entry of a room: its dimension tag and face id sequence.
 */
@Builder(toBuilder = true)
public record RoomInfo(
    @NotBlank
    @JsonProperty("id")
    String id,

    @NotBlank
    @JsonProperty("name")
    String name,

    @Min(1)
    @JsonProperty("dimension")
    int dimension,

    @Min(0)
    @JsonProperty("activeCount")
    long activeCount,

    @Min(1)
    @JsonProperty("nextFaceId")
    long nextFaceId,

    @JsonProperty("createdAt")
    LocalDateTime createdAt,

    @JsonProperty("updatedAt")
    LocalDateTime updatedAt
) {
    @JsonCreator
    public RoomInfo {
        if (nextFaceId <= 0) {
            nextFaceId = 1;
        }
    }

    /**
     * Creates a new room info with updated active face count
     */
    public RoomInfo withActiveCount(long newCount) {
        return toBuilder().activeCount(newCount).updatedAt(LocalDateTime.now()).build();
    }

    /**
     * Reserves {@code count} ids and returns the info holding the advanced sequence
     */
    public RoomInfo withReservedIds(int count) {
        return toBuilder()
            .nextFaceId(nextFaceId + count)
            .activeCount(activeCount + count)
            .updatedAt(LocalDateTime.now())
            .build();
    }

    /**
     * Creates room info for a new room
     */
    public static RoomInfo forNewRoom(String id, String name, int dimension) {
        LocalDateTime now = LocalDateTime.now();
        return new RoomInfo(id, name, dimension, 0, 1, now, now);
    }
}
