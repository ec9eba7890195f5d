package com.facefinder.main.filter;

import com.facefinder.common.model.FaceMetadata;
import com.facefinder.common.model.MatchGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Narrows matched photos by their capture metadata.
 * A photo without the field a filter needs never passes that filter.
 */
@Slf4j
@Component
public class MatchFilters {

    public List<MatchGroup> apply(List<MatchGroup> groups, SearchCriteria criteria) {
        if (criteria == null) {
            return groups;
        }
        List<MatchGroup> result = groups;
        if (criteria.hasLocation()) {
            result = filter(result, byLocation(criteria.location()));
            log.debug("After location filter '{}': {} photos", criteria.location(), result.size());
        }
        if (criteria.hasDateRange()) {
            result = filter(result, byDate(criteria.dateFrom(), criteria.dateTo()));
            log.debug("After date filter {}..{}: {} photos", criteria.dateFrom(), criteria.dateTo(), result.size());
        }
        if (criteria.hasRadius()) {
            result = filter(result, byRadius(criteria.latitude(), criteria.longitude(), criteria.radiusKm()));
            log.debug("After radius filter {}km: {} photos", criteria.radiusKm(), result.size());
        }
        return result;
    }

    static Predicate<MatchGroup> byLocation(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return group -> {
            String name = group.metadata().locationName();
            return name != null && name.toLowerCase(Locale.ROOT).contains(needle);
        };
    }

    static Predicate<MatchGroup> byDate(LocalDate from, LocalDate to) {
        return group -> {
            if (group.metadata().takenAt() == null) {
                return false;
            }
            LocalDate day = group.metadata().takenAt().toLocalDate();
            return (from == null || !day.isBefore(from)) && (to == null || !day.isAfter(to));
        };
    }

    static Predicate<MatchGroup> byRadius(double latitude, double longitude, double radiusKm) {
        return group -> {
            FaceMetadata metadata = group.metadata();
            return metadata.hasLocation()
                && GeoDistance.haversineKm(latitude, longitude, metadata.latitude(), metadata.longitude()) <= radiusKm;
        };
    }

    private static List<MatchGroup> filter(List<MatchGroup> groups, Predicate<MatchGroup> predicate) {
        return groups.stream().filter(predicate).toList();
    }
}
