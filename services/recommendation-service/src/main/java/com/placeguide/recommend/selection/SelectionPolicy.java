package com.placeguide.recommend.selection;

import com.placeguide.recommend.execution.StageDeadline;
import com.placeguide.recommend.model.Candidate;
import com.placeguide.recommend.model.Districts;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class SelectionPolicy {
    private final SelectionProperties properties;

    public SelectionPolicy(SelectionProperties properties) {
        properties.validate();
        this.properties = properties;
    }

    public SelectionResult select(List<Candidate> scored) {
        return select(scored, StageDeadline.none());
    }

    public SelectionResult select(List<Candidate> scored, StageDeadline deadline) {
        if (scored == null || scored.isEmpty()) {
            return new SelectionResult(List.of(), 0, properties.getMinResults() > 0);
        }
        List<Candidate> selected = walk(scored, properties.getMaxPerDistrict(), true, deadline);
        int level = 0;
        if (selected.size() < properties.getMinResults()) {
            level = 1;
            selected = walk(scored, properties.getRelaxedMaxPerDistrict(), true, deadline);
        }
        if (selected.size() < properties.getMinResults()) {
            level = 2;
            selected = walk(scored, properties.getRelaxedMaxPerDistrict(), false, deadline);
        }
        return new SelectionResult(selected, level, selected.size() < properties.getMinResults());
    }

    public List<Candidate> topWithoutDiversity(List<Candidate> scored) {
        List<Candidate> selected = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        if (scored == null) {
            return selected;
        }
        for (Candidate candidate : scored) {
            if (selected.size() >= properties.getMaxResults()) {
                break;
            }
            if (seen.add(candidate.getVenueId())) {
                selected.add(candidate);
            }
        }
        return selected;
    }

    private List<Candidate> walk(
        List<Candidate> scored,
        int districtCap,
        boolean checkOverlap,
        StageDeadline deadline
    ) {
        List<Candidate> selected = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        Map<String, Integer> perDistrict = new HashMap<>();
        for (Candidate candidate : scored) {
            if (selected.size() >= properties.getMaxResults()) {
                break;
            }
            if (deadline.isExpired()) {
                throw new SelectionTimeoutException("selection exceeded " + deadline.getBudgetMs() + "ms");
            }
            if (seen.contains(candidate.getVenueId())) {
                continue;
            }
            String district = Districts.key(candidate.getVenue().getDistrict());
            if (district != null && perDistrict.getOrDefault(district, 0) >= districtCap) {
                continue;
            }
            if (checkOverlap && nearDuplicateOfAny(candidate, selected)) {
                continue;
            }
            selected.add(candidate);
            seen.add(candidate.getVenueId());
            if (district != null) {
                perDistrict.merge(district, 1, Integer::sum);
            }
        }
        return selected;
    }

    private boolean nearDuplicateOfAny(Candidate candidate, List<Candidate> selected) {
        Set<String> tags = candidate.getVenue().getNormalizedTags();
        if (tags.isEmpty()) {
            return false;
        }
        for (Candidate accepted : selected) {
            if (tagOverlap(tags, accepted.getVenue().getNormalizedTags()) > properties.getTagOverlapThreshold()) {
                return true;
            }
        }
        return false;
    }

    static double tagOverlap(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String tag : left) {
            if (right.contains(tag)) {
                shared++;
            }
        }
        int union = left.size() + right.size() - shared;
        return union == 0 ? 0.0 : (double) shared / union;
    }
}
