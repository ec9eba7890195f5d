package com.facefinder.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single face matched by a similarity search.
 *
 * @param expanded true if the hit was introduced by a relaxed-threshold search stage
 */
public record FaceHit(
    @JsonProperty("faceId")
    long faceId,

    @JsonProperty("photo")
    String photo,

    @JsonProperty("bbox")
    BoundingBox bbox,

    @JsonProperty("similarity")
    double similarity,

    @JsonProperty("expanded")
    boolean expanded,

    @JsonProperty("metadata")
    FaceMetadata metadata
) {
    public static FaceHit of(FaceRecord record, double similarity) {
        return new FaceHit(record.id(), record.photo(), record.bbox(), similarity, false, record.metadata());
    }

    public FaceHit asExpanded() {
        return expanded ? this : new FaceHit(faceId, photo, bbox, similarity, true, metadata);
    }
}
