package com.property.knowledge.merge;

import com.property.knowledge.core.model.SourceTag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Ranks the recognized sources for field-by-field conflict resolution.
 *
 * <p>Rank 1 is the highest precedence. Sources sharing a rank form one tier,
 * within which conflicting values are settled by content rather than by source.
 * Every recognized source must be ranked and every ranked source must be recognized.</p>
 */
public final class PrecedencePolicy {

    private final String name;
    private final Map<SourceTag, Integer> ranks;

    private PrecedencePolicy(String name, Map<SourceTag, Integer> ranks) {
        this.name = name;
        this.ranks = Collections.unmodifiableMap(new TreeMap<>(ranks));
    }

    /**
     * Creates a policy from explicit ranks.
     *
     * @param name       name of the policy, reported in logs and summaries
     * @param recognized the fixed list of recognized sources
     * @param ranks      rank per source, 1 = highest
     * @throws PrecedenceConfigurationException if ranks and recognized sources disagree or a rank is not positive
     */
    public static PrecedencePolicy of(String name, Set<SourceTag> recognized, Map<SourceTag, Integer> ranks) {
        if (name == null || name.isBlank()) {
            throw new PrecedenceConfigurationException("Precedence policy name is required");
        }
        if (recognized == null || recognized.isEmpty()) {
            throw new PrecedenceConfigurationException("No recognized sources configured");
        }
        if (ranks == null) {
            throw new PrecedenceConfigurationException("No source ranks configured");
        }

        SortedSet<SourceTag> unknown = new TreeSet<>(ranks.keySet());
        unknown.removeAll(recognized);
        if (!unknown.isEmpty()) {
            throw new PrecedenceConfigurationException(
                    "Precedence policy '" + name + "' references unknown sources: " + unknown);
        }

        SortedSet<SourceTag> unranked = new TreeSet<>(recognized);
        unranked.removeAll(ranks.keySet());
        if (!unranked.isEmpty()) {
            throw new PrecedenceConfigurationException(
                    "Precedence policy '" + name + "' does not rank sources: " + unranked);
        }

        for (Map.Entry<SourceTag, Integer> entry : ranks.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 1) {
                throw new PrecedenceConfigurationException(
                        "Rank of source " + entry.getKey() + " must be >= 1, was " + entry.getValue());
            }
        }
        return new PrecedencePolicy(name, ranks);
    }

    /**
     * Creates a policy from an ordered list, highest precedence first, one source per tier.
     */
    public static PrecedencePolicy ordered(String name, List<SourceTag> highestFirst) {
        Map<SourceTag, Integer> ranks = new LinkedHashMap<>();
        int rank = 1;
        for (SourceTag tag : highestFirst) {
            if (ranks.putIfAbsent(tag, rank++) != null) {
                throw new PrecedenceConfigurationException("Source listed twice in precedence: " + tag);
            }
        }
        return of(name, Set.copyOf(highestFirst), ranks);
    }

    public String getName() {
        return name;
    }

    public boolean recognizes(SourceTag tag) {
        return ranks.containsKey(tag);
    }

    /**
     * Returns the rank of a source.
     *
     * @throws PrecedenceConfigurationException if the source is not recognized
     */
    public int rankOf(SourceTag tag) {
        Integer rank = ranks.get(tag);
        if (rank == null) {
            throw new PrecedenceConfigurationException(
                    "Source " + tag + " is not recognized by precedence policy '" + name + "'");
        }
        return rank;
    }

    public Set<SourceTag> sources() {
        return ranks.keySet();
    }

    /**
     * Returns the tiers from highest to lowest precedence.
     */
    public List<SortedSet<SourceTag>> tiers() {
        SortedMap<Integer, SortedSet<SourceTag>> tiers = new TreeMap<>();
        ranks.forEach((tag, rank) -> tiers.computeIfAbsent(rank, r -> new TreeSet<>()).add(tag));
        List<SortedSet<SourceTag>> result = new ArrayList<>();
        tiers.values().forEach(tier -> result.add(Collections.unmodifiableSortedSet(tier)));
        return List.copyOf(result);
    }

    @Override
    public String toString() {
        return "PrecedencePolicy{name='" + name + "', tiers=" + tiers() + '}';
    }
}
