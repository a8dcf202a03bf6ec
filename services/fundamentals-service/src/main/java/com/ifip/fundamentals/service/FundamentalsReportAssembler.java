package com.ifip.fundamentals.service;

import com.ifip.fundamentals.analysis.ConceptSelection;
import com.ifip.fundamentals.analysis.ConceptSelector;
import com.ifip.fundamentals.analysis.ConsistencyValidator;
import com.ifip.fundamentals.analysis.FiscalCalendar;
import com.ifip.fundamentals.analysis.GrowthCalculator;
import com.ifip.fundamentals.analysis.PeriodClassifier;
import com.ifip.fundamentals.analysis.QualityScorer;
import com.ifip.fundamentals.analysis.RatioCalculator;
import com.ifip.fundamentals.domain.CompanyIdentity;
import com.ifip.fundamentals.domain.ConceptSeries;
import com.ifip.fundamentals.domain.FundamentalsReport;
import com.ifip.fundamentals.domain.GrowthMetric;
import com.ifip.fundamentals.domain.LogicalMetric;
import com.ifip.fundamentals.domain.QualityReport;
import com.ifip.fundamentals.domain.RawFact;
import com.ifip.fundamentals.domain.RawFactSet;
import com.ifip.fundamentals.domain.Warning;
import com.ifip.fundamentals.domain.WarningCode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Runs selection, classification, growth, ratios, validation and scoring over one fact set.
 * Holds no state; the same fact set and clock always give the same report.
 */
@Component
public class FundamentalsReportAssembler {

    private final ConceptSelector conceptSelector;
    private final PeriodClassifier periodClassifier;
    private final GrowthCalculator growthCalculator;
    private final RatioCalculator ratioCalculator;
    private final ConsistencyValidator consistencyValidator;
    private final QualityScorer qualityScorer;
    private final Clock clock;

    public FundamentalsReportAssembler(
        ConceptSelector conceptSelector,
        PeriodClassifier periodClassifier,
        GrowthCalculator growthCalculator,
        RatioCalculator ratioCalculator,
        ConsistencyValidator consistencyValidator,
        QualityScorer qualityScorer,
        Clock clock
    ) {
        this.conceptSelector = conceptSelector;
        this.periodClassifier = periodClassifier;
        this.growthCalculator = growthCalculator;
        this.ratioCalculator = ratioCalculator;
        this.consistencyValidator = consistencyValidator;
        this.qualityScorer = qualityScorer;
        this.clock = clock;
    }

    public FundamentalsReport assemble(RawFactSet factSet) {
        List<Warning> warnings = new ArrayList<>();
        if (factSet.droppedEntries() > 0) {
            warnings.add(Warning.of(WarningCode.MALFORMED_FACTS_DROPPED,
                factSet.droppedEntries() + " malformed facts were dropped during ingestion"));
        }

        FiscalCalendar calendar = FiscalCalendar.detect(factSet.facts());
        if (calendar.isAssumed() && !factSet.isEmpty()) {
            warnings.add(Warning.of(WarningCode.FISCAL_YEAR_END_ASSUMED,
                "No annual filings found; fiscal year assumed to end in December"));
        }

        Map<LogicalMetric, ConceptSeries> series = new EnumMap<>(LogicalMetric.class);
        List<LogicalMetric> unavailable = new ArrayList<>();
        for (LogicalMetric metric : LogicalMetric.values()) {
            Optional<ConceptSelection> selection = conceptSelector.select(factSet, metric);
            if (selection.isEmpty()) {
                unavailable.add(metric);
                warnings.add(Warning.of(WarningCode.METRIC_UNAVAILABLE, metric,
                    metric.metricName() + " is not reported under any known XBRL tag"));
                continue;
            }
            List<RawFact> facts = selection.get().facts();
            ConceptSeries classified = periodClassifier.classify(metric, selection.get().concept(), facts, calendar);
            series.put(metric, classified);
            warnings.addAll(classified.warnings());
        }

        if (series.values().stream().noneMatch(ConceptSeries::hasUsableData)) {
            warnings.add(Warning.of(WarningCode.NO_USABLE_DATA, factSet.ticker() + " reported no usable metrics"));
        }

        List<GrowthMetric> growth = new ArrayList<>();
        for (ConceptSeries s : series.values()) {
            for (GrowthMetric g : growthCalculator.calculate(s)) {
                growth.add(g);
                if (g.flagged()) {
                    warnings.add(Warning.of(WarningCode.GROWTH_FLAGGED, s.metric(), String.format(Locale.ROOT,
                        "%s %s %s growth of %.1f%% at %s exceeds the plausibility ceiling",
                        g.metricName(), g.kind(), g.bucket(), g.growthPct(), g.currentPeriod())));
                }
            }
        }

        warnings.addAll(consistencyValidator.validate(series));
        QualityReport quality = qualityScorer.score(factSet.ticker(), factSet.companyName(), series);

        return new FundamentalsReport(
            factSet.ticker(),
            factSet.cik(),
            factSet.companyName(),
            series,
            unavailable,
            growth,
            ratioCalculator.calculate(series),
            quality,
            warnings,
            false,
            clock.instant()
        );
    }

    /**
     * Report for a company whose facts could not be fetched. Graded F and flagged degraded.
     */
    public FundamentalsReport degraded(CompanyIdentity company, String reason) {
        Warning warning = Warning.of(WarningCode.UPSTREAM_UNAVAILABLE, reason);
        return new FundamentalsReport(
            company.ticker(),
            company.cik(),
            company.companyName(),
            Map.of(),
            List.of(LogicalMetric.values()),
            List.of(),
            List.of(),
            QualityScorer.unavailable(company.ticker(), company.companyName()),
            List.of(warning),
            true,
            clock.instant()
        );
    }
}
