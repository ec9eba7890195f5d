package com.facefinder.common.model;

/**
 * Kind of in-memory search structure serving a room.
 */
public enum IndexKind {
    /** Linear inner-product scan over every active face */
    EXACT,
    /** Inverted lists over k-means clusters, only the nearest clusters are scanned */
    APPROXIMATE
}
