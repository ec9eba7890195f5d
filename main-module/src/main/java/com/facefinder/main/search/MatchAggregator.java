package com.facefinder.main.search;

import com.facefinder.common.model.FaceHit;
import com.facefinder.common.model.MatchGroup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Группировка найденных лиц по фото.
 * Порядок: лучшее сходство, затем среднее сходство, затем идентификатор фото.
 */
@Component
public class MatchAggregator {

    static final Comparator<MatchGroup> ORDER = Comparator
        .comparingDouble(MatchGroup::maxSimilarity).reversed()
        .thenComparing(Comparator.comparingDouble(MatchGroup::avgSimilarity).reversed())
        .thenComparing(MatchGroup::photo);

    public List<MatchGroup> aggregate(List<FaceHit> hits) {
        Map<String, List<FaceHit>> byPhoto = new LinkedHashMap<>();
        for (FaceHit hit : hits) {
            byPhoto.computeIfAbsent(hit.photo(), photo -> new ArrayList<>()).add(hit);
        }

        List<MatchGroup> groups = new ArrayList<>(byPhoto.size());
        for (Map.Entry<String, List<FaceHit>> entry : byPhoto.entrySet()) {
            groups.add(toGroup(entry.getKey(), entry.getValue()));
        }
        groups.sort(ORDER);
        return groups;
    }

    private MatchGroup toGroup(String photo, List<FaceHit> hits) {
        List<MatchGroup.FaceMatch> faces = new ArrayList<>(hits.size());
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        boolean expanded = false;
        FaceHit best = hits.get(0);
        for (FaceHit hit : hits) {
            faces.add(new MatchGroup.FaceMatch(hit.faceId(), hit.bbox(), hit.similarity()));
            if (hit.similarity() > max) {
                max = hit.similarity();
                best = hit;
            }
            sum += hit.similarity();
            expanded |= hit.expanded();
        }
        return new MatchGroup(photo, photoName(photo), faces, max, sum / hits.size(),
            hits.size(), expanded, best.metadata());
    }

    /** Последний сегмент пути фото */
    static String photoName(String photo) {
        int slash = Math.max(photo.lastIndexOf('/'), photo.lastIndexOf('\\'));
        return slash >= 0 ? photo.substring(slash + 1) : photo;
    }
}
