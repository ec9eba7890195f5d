package com.facefinder.main.search;

import com.facefinder.common.model.FaceHit;

import java.util.List;

/**
 * Merged hits of a staged search and the stages that produced them.
 */
public record OrchestratedSearch(List<FaceHit> hits, List<SearchStage> stages, int primaryCount) {

    public OrchestratedSearch {
        hits = List.copyOf(hits);
        stages = List.copyOf(stages);
    }

    public boolean ran(SearchStage stage) {
        return stages.contains(stage);
    }
}
