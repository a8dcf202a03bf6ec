package com.ifip.fundamentals.analysis;

import com.ifip.fundamentals.domain.LogicalMetric;
import com.ifip.fundamentals.domain.RawFact;
import com.ifip.fundamentals.domain.RawFactSet;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks, per logical metric, the XBRL alias a company actually reports it under.
 *
 * <p>Candidates are ranked by usable quarterly coverage, then most recent filing, then longest
 * history, then their position in the metric's alias list.
 */
@Component
public class ConceptSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConceptSelector.class);

    public Optional<ConceptSelection> select(RawFactSet factSet, LogicalMetric metric) {
        Map<String, List<RawFact>> byConcept = new HashMap<>();
        for (RawFact fact : factSet.facts()) {
            if (metric.aliases().contains(fact.concept()) && metric.acceptsUnit(fact.unit())) {
                byConcept.computeIfAbsent(fact.concept(), k -> new ArrayList<>()).add(fact);
            }
        }
        if (byConcept.isEmpty()) {
            return Optional.empty();
        }

        List<Candidate> candidates = new ArrayList<>();
        for (int priority = 0; priority < metric.aliases().size(); priority++) {
            String alias = metric.aliases().get(priority);
            List<RawFact> facts = byConcept.get(alias);
            if (facts != null) {
                candidates.add(Candidate.of(metric, alias, priority, facts));
            }
        }

        Candidate best = candidates.stream().min(Candidate.RANKING).orElseThrow();
        if (candidates.size() > 1) {
            LOGGER.debug("{} for {}: chose {} over {}", metric.metricName(), factSet.ticker(), best.concept(),
                candidates.stream().filter(c -> c != best).map(Candidate::concept).collect(Collectors.joining(", ")));
        }
        return Optional.of(new ConceptSelection(metric, best.concept(), best.facts(), best.coverage()));
    }

    /**
     * Distinct period ends a concept can contribute to the quarterly series. Instant metrics count
     * every balance date.
     */
    static int usableCoverage(LogicalMetric metric, List<RawFact> facts) {
        return (int) facts.stream()
            .filter(f -> metric.isInstant() || f.isQuarterlyForm() || (f.hasDuration() && f.durationDays() <= PeriodClassifier.MAX_QUARTER_DAYS))
            .map(RawFact::periodEnd)
            .distinct()
            .count();
    }

    private record Candidate(
        String concept,
        int priority,
        List<RawFact> facts,
        int coverage,
        LocalDate latestFiled,
        LocalDate earliestPeriod
    ) {
        static final Comparator<Candidate> RANKING = Comparator
            .comparingInt(Candidate::coverage).reversed()
            .thenComparing(Candidate::latestFiled, Comparator.reverseOrder())
            .thenComparing(Candidate::earliestPeriod)
            .thenComparingInt(Candidate::priority);

        static Candidate of(LogicalMetric metric, String concept, int priority, List<RawFact> facts) {
            LocalDate latestFiled = facts.stream().map(RawFact::filedDate).max(Comparator.naturalOrder()).orElseThrow();
            LocalDate earliestPeriod = facts.stream().map(RawFact::periodEnd).min(Comparator.naturalOrder()).orElseThrow();
            return new Candidate(concept, priority, facts, usableCoverage(metric, facts), latestFiled, earliestPeriod);
        }
    }
}
