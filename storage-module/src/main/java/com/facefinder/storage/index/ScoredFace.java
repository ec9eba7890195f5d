package com.facefinder.storage.index;

import com.facefinder.common.model.FaceRecord;

import java.util.Comparator;

/**
 * Face returned by an index scan together with its inner-product similarity to the query.
 */
public record ScoredFace(FaceRecord face, double similarity) {

    /** Best first: similarity descending, ties broken by ascending face id */
    public static final Comparator<ScoredFace> RANKING = Comparator
        .comparingDouble(ScoredFace::similarity).reversed()
        .thenComparingLong(scored -> scored.face().id());

    public long id() {
        return face.id();
    }
}
