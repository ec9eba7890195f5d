package com.facefinder.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * All matched faces of one photo together with aggregate scores.
 */
public record MatchGroup(
    @JsonProperty("photo")
    String photo,

    @JsonProperty("photoName")
    String photoName,

    @JsonProperty("faces")
    List<FaceMatch> faces,

    @JsonProperty("maxSimilarity")
    double maxSimilarity,

    @JsonProperty("avgSimilarity")
    double avgSimilarity,

    @JsonProperty("faceCount")
    int faceCount,

    @JsonProperty("expanded")
    boolean expanded,

    @JsonProperty("metadata")
    FaceMetadata metadata
) {
    public MatchGroup {
        faces = List.copyOf(faces);
        if (metadata == null) {
            metadata = FaceMetadata.empty();
        }
    }

    /** One face inside a matched photo */
    public record FaceMatch(
        @JsonProperty("faceId") long faceId,
        @JsonProperty("bbox") BoundingBox bbox,
        @JsonProperty("similarity") double similarity
    ) {
    }
}
