package com.ifip.fundamentals.analysis;

import com.ifip.fundamentals.domain.LogicalMetric;
import com.ifip.fundamentals.domain.RawFact;
import java.util.List;

/**
 * The alias chosen for a metric together with its facts in the metric's unit.
 */
public record ConceptSelection(LogicalMetric metric, String concept, List<RawFact> facts, int coverage) {

    public ConceptSelection {
        facts = List.copyOf(facts);
    }
}
