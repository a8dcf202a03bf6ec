package com.ifip.fundamentals.domain;

import java.time.Instant;
import java.util.List;

public record RawFactSet(
    String ticker,
    String cik,
    String companyName,
    List<RawFact> facts,
    int droppedEntries,
    Instant fetchedAt
) {
    public RawFactSet {
        facts = facts == null ? List.of() : List.copyOf(facts);
    }

    public boolean isEmpty() {
        return facts.isEmpty();
    }
}
