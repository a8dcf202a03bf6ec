package com.ifip.fundamentals.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.ifip.fundamentals.domain.CompanyIdentity;
import com.ifip.fundamentals.domain.RawFact;
import com.ifip.fundamentals.domain.RawFactSet;
import com.ifip.fundamentals.exception.MalformedPayloadException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flattens provider payloads into {@link RawFact}s.
 *
 * <p>Two shapes are understood: SEC companyfacts ({@code facts.<taxonomy>.<concept>.units.<unit>[]})
 * and the flat list used by financial-data proxies ({@code facts: [{concept, unit, val, ...}]}).
 * Entries that cannot be read are dropped one by one; the rest of the payload is kept.
 */
@Component
public class CompanyFactsNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompanyFactsNormalizer.class);

    private static final List<String> TAXONOMIES = List.of("us-gaap", "ifrs-full");

    public RawFactSet normalize(CompanyIdentity company, JsonNode payload, Instant fetchedAt) {
        List<RawFact> facts = new ArrayList<>();
        int dropped = 0;

        String companyName = company.companyName();
        if (payload != null && !payload.path("entityName").asText("").isBlank()) {
            companyName = payload.path("entityName").asText().trim();
        }

        JsonNode factsNode = payload == null ? null : payload.get("facts");
        if (factsNode == null || factsNode.isNull()) {
            LOGGER.info("No facts in payload for {}", company.ticker());
        } else if (factsNode.isArray()) {
            for (JsonNode entry : factsNode) {
                try {
                    facts.add(toFact(text(entry, "concept"), text(entry, "unit"), entry));
                } catch (MalformedPayloadException e) {
                    dropped++;
                    LOGGER.debug("Dropping fact for {}: {}", company.ticker(), e.getMessage());
                }
            }
        } else {
            for (String taxonomy : TAXONOMIES) {
                Iterator<Map.Entry<String, JsonNode>> concepts = factsNode.path(taxonomy).fields();
                while (concepts.hasNext()) {
                    Map.Entry<String, JsonNode> concept = concepts.next();
                    Iterator<Map.Entry<String, JsonNode>> units = concept.getValue().path("units").fields();
                    while (units.hasNext()) {
                        Map.Entry<String, JsonNode> unit = units.next();
                        for (JsonNode entry : unit.getValue()) {
                            try {
                                facts.add(toFact(concept.getKey(), unit.getKey(), entry));
                            } catch (MalformedPayloadException e) {
                                dropped++;
                                LOGGER.debug("Dropping {} fact for {}: {}", concept.getKey(), company.ticker(), e.getMessage());
                            }
                        }
                    }
                }
            }
        }

        if (dropped > 0) {
            LOGGER.warn("Dropped {} malformed facts for {}, kept {}", dropped, company.ticker(), facts.size());
        }
        return new RawFactSet(company.ticker(), company.cik(), companyName, facts, dropped, fetchedAt);
    }

    private RawFact toFact(String concept, String unit, JsonNode entry) {
        if (concept == null || concept.isBlank()) {
            throw new MalformedPayloadException("missing concept");
        }
        if (unit == null || unit.isBlank()) {
            throw new MalformedPayloadException("missing unit");
        }

        JsonNode valueNode = entry.has("val") ? entry.get("val") : entry.get("value");
        if (valueNode == null || !valueNode.isNumber()) {
            throw new MalformedPayloadException("non-numeric value " + valueNode);
        }
        double value = valueNode.asDouble();
        if (!Double.isFinite(value)) {
            throw new MalformedPayloadException("non-finite value");
        }

        LocalDate end = date(entry, "end", true);
        LocalDate start = date(entry, "start", false);
        LocalDate filed = date(entry, "filed", true);
        if (start != null && start.isAfter(end)) {
            throw new MalformedPayloadException("period start " + start + " after end " + end);
        }

        String form = text(entry, "form");
        if (form == null || form.isBlank()) {
            throw new MalformedPayloadException("missing form");
        }

        Integer fiscalYear = entry.path("fy").canConvertToInt() ? entry.path("fy").asInt() : null;
        return new RawFact(
            concept,
            unit,
            value,
            start,
            end,
            filed,
            form.trim(),
            fiscalYear,
            text(entry, "fp"),
            text(entry, "accn")
        );
    }

    private LocalDate date(JsonNode entry, String field, boolean required) {
        String raw = text(entry, field);
        if (raw == null || raw.isBlank()) {
            if (required) {
                throw new MalformedPayloadException("missing " + field);
            }
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new MalformedPayloadException("unparseable " + field + " '" + raw + "'", e);
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
