package com.specsim.infrastructure.sim.arbiter;

import com.specsim.domain.sim.model.CoverageGap;
import com.specsim.domain.sim.model.ExtractionMethod;
import com.specsim.domain.sim.model.GapReason;
import com.specsim.domain.sim.model.PageRegion;
import com.specsim.domain.sim.model.TableCandidate;
import com.specsim.domain.sim.service.TableExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Selects at most one table candidate per page region.
 * <p>
 * Candidates are never merged: the higher score wins, equal scores go to the configured
 * {@link TieBreakPolicy}, and a winner below the minimum score becomes a coverage gap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionArbiter {

    private static final double SCORE_EPSILON = 1e-9;

    private final CandidateScorer candidateScorer;

    @Value("${sim.arbiter.min-score:0.35}")
    private double minScore = 0.35;

    @Value("${sim.arbiter.tie-break:DENSITY}")
    private String tieBreak = TieBreakPolicy.DENSITY.name();

    /**
     * Run both extractors on a region and arbitrate. An extractor that throws is treated as
     * having found nothing.
     */
    public ArbitrationOutcome select(PageRegion region, TableExtractor primary, TableExtractor secondary) {
        Optional<TableCandidate> first = runExtractor(region, primary, ExtractionMethod.PRIMARY);
        Optional<TableCandidate> second = runExtractor(region, secondary, ExtractionMethod.SECONDARY);
        return arbitrate(region, first, second);
    }

    /**
     * Deterministic selection between two (possibly absent) candidates.
     */
    public ArbitrationOutcome arbitrate(PageRegion region, Optional<TableCandidate> primary,
                                        Optional<TableCandidate> secondary) {
        if (primary.isEmpty() && secondary.isEmpty()) {
            log.warn("[Arbiter] {}: no candidate from either extractor", region.describe());
            return ArbitrationOutcome.gap(region,
                    new CoverageGap(region.page(), region.index(), GapReason.NO_CANDIDATE, "no table candidate"));
        }

        SelectedTable selection;
        if (primary.isPresent() && secondary.isPresent()) {
            CandidateScore a = candidateScorer.score(primary.get());
            CandidateScore b = candidateScorer.score(secondary.get());
            selection = firstWins(primary.get(), a, secondary.get(), b)
                    ? new SelectedTable(primary.get(), a, b)
                    : new SelectedTable(secondary.get(), b, a);
        } else {
            TableCandidate only = primary.orElseGet(secondary::get);
            selection = new SelectedTable(only, candidateScorer.score(only), null);
        }

        if (selection.score().total() < minScore) {
            log.warn("[Arbiter] {}: best candidate {} scored {} below minimum {}",
                    region.describe(), selection.candidate().method(), selection.score(), minScore);
            return ArbitrationOutcome.gap(region, new CoverageGap(region.page(), region.index(),
                    GapReason.BELOW_THRESHOLD,
                    String.format(Locale.ROOT, "score %.2f below %.2f", selection.score().total(), minScore)));
        }

        log.info("[Arbiter] {}: selected {} (score={}{})", region.describe(), selection.candidate().method(),
                String.format(Locale.ROOT, "%.2f", selection.score().total()),
                selection.rivalScore() == null ? ""
                        : String.format(Locale.ROOT, " vs %.2f", selection.rivalScore().total()));
        return ArbitrationOutcome.selected(region, selection);
    }

    public TieBreakPolicy tieBreakPolicy() {
        return TieBreakPolicy.valueOf(tieBreak.trim().toUpperCase(Locale.ROOT));
    }

    private boolean firstWins(TableCandidate first, CandidateScore firstScore,
                              TableCandidate second, CandidateScore secondScore) {
        double diff = firstScore.total() - secondScore.total();
        if (Math.abs(diff) > SCORE_EPSILON) {
            return diff > 0;
        }
        return tieBreakPolicy().compare(first.method(), firstScore, second.method(), secondScore) >= 0;
    }

    private Optional<TableCandidate> runExtractor(PageRegion region, TableExtractor extractor, ExtractionMethod method) {
        if (extractor == null) {
            return Optional.empty();
        }
        try {
            Optional<TableCandidate> candidate = extractor.extract(region);
            return candidate == null ? Optional.empty() : candidate;
        } catch (RuntimeException e) {
            log.warn("[Arbiter] {}: {} extractor failed, treating as absent: {}",
                    region.describe(), method, e.getMessage());
            return Optional.empty();
        }
    }
}
