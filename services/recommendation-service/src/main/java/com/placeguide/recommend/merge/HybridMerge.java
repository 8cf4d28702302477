package com.placeguide.recommend.merge;

import com.placeguide.recommend.model.Candidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class HybridMerge {
    public static final int DEFAULT_RANK_CONSTANT = 60;

    private HybridMerge() {
    }

    public static List<Candidate> merge(List<Candidate> semantic, List<Candidate> geo, int k) {
        int rankConstant = k > 0 ? k : DEFAULT_RANK_CONSTANT;
        Map<Long, Entry> entries = new LinkedHashMap<>();

        int rank = 0;
        for (Candidate candidate : nullSafe(semantic)) {
            Entry entry = entries.get(candidate.getVenueId());
            if (entry != null) {
                continue;
            }
            rank++;
            entry = new Entry(candidate);
            entry.semanticRank = rank;
            entry.score += 1.0 / (rankConstant + rank);
            entries.put(candidate.getVenueId(), entry);
        }

        rank = 0;
        for (Candidate candidate : nullSafe(geo)) {
            Entry entry = entries.get(candidate.getVenueId());
            if (entry != null && entry.geoRank != null) {
                continue;
            }
            rank++;
            if (entry == null) {
                entry = new Entry(candidate);
                entries.put(candidate.getVenueId(), entry);
            } else if (candidate.getDistanceMeters() != null) {
                entry.candidate = entry.candidate.withDistance(candidate.getDistanceMeters());
            }
            entry.geoRank = rank;
            entry.score += 1.0 / (rankConstant + rank);
        }

        List<Entry> ordered = new ArrayList<>(entries.values());
        ordered.sort(
            Comparator.comparingDouble(Entry::getScore).reversed()
                .thenComparing(Entry::hasSemantic, Comparator.reverseOrder())
                .thenComparingInt(Entry::bestRank)
        );
        List<Candidate> merged = new ArrayList<>(ordered.size());
        for (Entry entry : ordered) {
            merged.add(entry.candidate);
        }
        return merged;
    }

    private static List<Candidate> nullSafe(List<Candidate> candidates) {
        return candidates == null ? List.of() : candidates;
    }

    private static final class Entry {
        private Candidate candidate;
        private double score;
        private Integer semanticRank;
        private Integer geoRank;

        private Entry(Candidate candidate) {
            this.candidate = candidate;
        }

        private double getScore() {
            return score;
        }

        private boolean hasSemantic() {
            return semanticRank != null;
        }

        private int bestRank() {
            return semanticRank != null ? semanticRank : geoRank;
        }
    }
}
