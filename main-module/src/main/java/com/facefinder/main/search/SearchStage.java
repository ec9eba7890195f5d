package com.facefinder.main.search;

/**
 * Stages of a face search, in the order they may run.
 */
public enum SearchStage {
    /** High-precision search at the primary threshold */
    PRIMARY,
    /** Relaxed search after a weak primary stage; new faces are marked expanded */
    EXPAND,
    /** Low-threshold search after an empty primary stage */
    FALLBACK,
    /** Deduplicated union of every stage that ran */
    MERGED
}
