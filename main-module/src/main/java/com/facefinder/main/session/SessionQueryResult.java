package com.facefinder.main.session;

import com.facefinder.common.model.MatchGroup;
import com.facefinder.main.search.SearchStage;

import java.util.List;

public record SessionQueryResult(
    String sessionId,
    String query,
    String summary,
    List<MatchGroup> matches,
    int totalMatches,
    List<SearchStage> stages
) {
    public SessionQueryResult {
        matches = List.copyOf(matches);
        stages = List.copyOf(stages);
    }
}
