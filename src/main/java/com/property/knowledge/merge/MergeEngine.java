package com.property.knowledge.merge;

import com.property.knowledge.core.model.CandidateEntry;
import com.property.knowledge.core.model.CanonicalEntry;
import com.property.knowledge.core.model.PropertyKey;
import com.property.knowledge.core.model.RecordField;
import com.property.knowledge.core.model.SourceTag;
import com.property.knowledge.kb.KnowledgeBase;
import com.property.knowledge.logging.LogContext;
import com.property.knowledge.metrics.MetricsService;
import com.property.knowledge.metrics.NoOpMetricsService;
import com.property.knowledge.source.CandidateSequence;
import com.property.knowledge.source.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Merges candidate entries from several sources into one knowledge base.
 *
 * Merge process:
 * 1. Source collection: every sequence is read completely; unreadable sources are skipped
 * 2. Grouping by property key, regardless of source
 * 3. Field-by-field resolution: per field, the highest ranked source with a value wins;
 *    within a tier the longer value wins, then the lexicographically smaller one
 * 4. Conflict recording for every field where sources disagreed
 *
 * The outcome depends only on the candidates and the precedence policy, never on
 * the order in which sources or candidates arrive.
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final PrecedencePolicy policy;
    private final MetricsService metricsService;

    public MergeEngine(PrecedencePolicy policy) {
        this(policy, new NoOpMetricsService());
    }

    public MergeEngine(PrecedencePolicy policy, MetricsService metricsService) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public PrecedencePolicy getPolicy() {
        return policy;
    }

    /**
     * Merges the candidates of all given sequences.
     *
     * @throws PrecedenceConfigurationException if a sequence comes from a source the policy does not rank
     * @throws SourceUnavailableException       if every sequence failed to read
     */
    public MergeResult merge(Iterable<? extends CandidateSequence> candidateSequences) {
        long started = System.nanoTime();

        List<CandidateSequence> sequences = new ArrayList<>();
        candidateSequences.forEach(sequences::add);
        for (CandidateSequence sequence : sequences) {
            policy.rankOf(sequence.tag());
        }
        // collection order does not influence the result; sorting only keeps logs stable
        sequences.sort(Comparator.comparing(CandidateSequence::tag));

        log.info("merge.starting sources={} policy={}", sequences.size(), policy.getName());

        Map<PropertyKey, List<CandidateEntry>> groups = new TreeMap<>();
        List<SourceTag> unavailable = new ArrayList<>();
        long consumed = 0;

        for (CandidateSequence sequence : sequences) {
            List<CandidateEntry> candidates;
            try (LogContext ctx = LogContext.forSource(sequence.tag().name())) {
                candidates = collect(sequence);
            } catch (SourceUnavailableException e) {
                log.warn("merge.source-unavailable source={} error={}", sequence.tag(), e.getMessage());
                metricsService.incrementSourceUnavailable(sequence.tag());
                unavailable.add(sequence.tag());
                continue;
            }
            for (CandidateEntry candidate : candidates) {
                groups.computeIfAbsent(candidate.key(), k -> new ArrayList<>()).add(candidate);
            }
            consumed += candidates.size();
        }

        if (!sequences.isEmpty() && unavailable.size() == sequences.size()) {
            throw new SourceUnavailableException("Every source failed to load: " + unavailable);
        }

        ConflictLedger ledger = new ConflictLedger();
        KnowledgeBase.Builder builder = KnowledgeBase.builder();
        for (Map.Entry<PropertyKey, List<CandidateEntry>> group : groups.entrySet()) {
            builder.add(resolve(group.getKey(), group.getValue(), ledger));
        }
        KnowledgeBase knowledgeBase = builder.build();

        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        metricsService.recordMergeDuration(duration);
        metricsService.recordEntriesMerged(knowledgeBase.size());

        log.info("merge.completed entries={} candidates={} conflicts={} unavailable={} durationMs={}",
                knowledgeBase.size(), consumed, ledger.size(), unavailable, duration.toMillis());

        return new MergeResult(knowledgeBase, ledger.getAll(), consumed, unavailable, policy.getName());
    }

    /**
     * Resolves the candidates of one key into a canonical entry.
     */
    CanonicalEntry resolve(PropertyKey key, List<CandidateEntry> candidates, ConflictLedger ledger) {
        CanonicalEntry.Builder builder = CanonicalEntry.builder().key(key);
        SortedSet<SourceTag> contributors = new TreeSet<>();

        for (RecordField field : RecordField.values()) {
            List<FieldConflict.Claim> claims = candidates.stream()
                    .filter(candidate -> candidate.get(field) != null)
                    .map(candidate -> new FieldConflict.Claim(
                            candidate.source(), policy.rankOf(candidate.source()), candidate.get(field)))
                    .sorted(CLAIM_ORDER)
                    .collect(Collectors.toList());
            if (claims.isEmpty()) {
                continue;
            }

            FieldConflict.Claim chosen = claims.get(0);
            builder.field(field, chosen.value());
            contributors.add(chosen.source());

            List<FieldConflict.Claim> rejected = claims.stream()
                    .filter(claim -> !claim.value().equals(chosen.value()))
                    .collect(Collectors.toList());
            if (!rejected.isEmpty()) {
                boolean sameTier = rejected.stream().anyMatch(claim -> claim.rank() == chosen.rank());
                if (field == RecordField.NAME) {
                    // a same-tier name that lost still counts as a contribution
                    rejected.stream()
                            .filter(claim -> claim.rank() == chosen.rank())
                            .forEach(claim -> contributors.add(claim.source()));
                }
                ledger.record(new FieldConflict(key, field, chosen, rejected, sameTier));
                metricsService.incrementConflict(field);
            }
        }

        if (contributors.isEmpty()) {
            candidates.forEach(candidate -> contributors.add(candidate.source()));
        }
        contributors.forEach(builder::addProvenance);
        return builder.build();
    }

    private static List<CandidateEntry> collect(CandidateSequence sequence) {
        try (Stream<CandidateEntry> stream = sequence.stream()) {
            return stream.collect(Collectors.toList());
        }
    }

    /**
     * Rank first, then the longer and more specific value, then lexicographic order,
     * then source name so that identical values from different sources sort stably.
     */
    private static final Comparator<FieldConflict.Claim> CLAIM_ORDER = Comparator
            .comparingInt(FieldConflict.Claim::rank)
            .thenComparing(claim -> claim.value().length(), Comparator.reverseOrder())
            .thenComparing(FieldConflict.Claim::value)
            .thenComparing(FieldConflict.Claim::source);
}
