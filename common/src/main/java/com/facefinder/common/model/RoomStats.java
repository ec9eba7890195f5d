package com.facefinder.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoomStats(
    @JsonProperty("roomId")
    String roomId,

    @JsonProperty("totalActive")
    long totalActive,

    @JsonProperty("tombstoned")
    long tombstoned,

    @JsonProperty("indexKind")
    IndexKind indexKind,

    @JsonProperty("clusterCount")
    int clusterCount,

    @JsonProperty("dimension")
    int dimension
) {
}
