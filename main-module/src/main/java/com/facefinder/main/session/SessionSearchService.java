package com.facefinder.main.session;

import com.facefinder.common.model.MatchGroup;
import com.facefinder.main.config.SessionProperties;
import com.facefinder.main.filter.MatchFilters;
import com.facefinder.main.filter.SearchCriteria;
import com.facefinder.main.search.MatchAggregator;
import com.facefinder.main.search.OrchestratedSearch;
import com.facefinder.main.search.SearchOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Queries against a session's reference face: staged search, criteria filters,
 * photo grouping and a short textual summary recorded in the session log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionSearchService {

    private final SearchSessionRegistry registry;
    private final SearchOrchestrator orchestrator;
    private final MatchAggregator aggregator;
    private final MatchFilters filters;
    private final SessionProperties properties;

    public SessionQueryResult query(String sessionId, String text, SearchCriteria criteria) {
        SearchSession session = registry.require(sessionId);
        SearchCriteria effective = criteria != null ? criteria : SearchCriteria.none();
        log.info("Session {} query '{}' with criteria {}", sessionId, text, effective);

        OrchestratedSearch search = orchestrator.search(session.getRoomId(), session.getReferenceEmbedding(),
            properties.getSearchThreshold(), properties.getSearchLimit());
        List<MatchGroup> groups = filters.apply(aggregator.aggregate(search.hits()), effective);
        List<MatchGroup> limited = groups.size() > properties.getResultLimit()
            ? groups.subList(0, properties.getResultLimit())
            : groups;

        String summary = summarize(groups.size(), effective);
        registry.appendQuery(sessionId, text, summary);
        log.info("Session {}: {}", sessionId, summary);
        return new SessionQueryResult(sessionId, text, summary, limited, groups.size(), search.stages());
    }

    static String summarize(int count, SearchCriteria criteria) {
        if (count == 0) {
            return "No photos found.";
        }
        String photos = count == 1 ? "1 photo" : count + " photos";
        if (criteria.hasLocation()) {
            return "Found " + photos + " from " + criteria.location();
        }
        return "Found " + photos;
    }
}
