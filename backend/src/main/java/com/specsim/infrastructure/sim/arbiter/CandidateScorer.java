package com.specsim.infrastructure.sim.arbiter;

import com.specsim.domain.sim.model.TableCandidate;
import com.specsim.infrastructure.sim.normalize.BitRangeParser;
import com.specsim.infrastructure.sim.normalize.ColumnRole;
import com.specsim.infrastructure.sim.normalize.HeaderMapping;
import com.specsim.infrastructure.sim.normalize.HeaderVocabulary;
import com.specsim.infrastructure.sim.normalize.SegmentMarkers;
import com.specsim.infrastructure.sim.normalize.TextCleaner;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Pure scoring function over three enumerable features of a table candidate:
 * header keyword ratio, column-count consistency and position-cell parse ratio.
 * <p>
 * {@code total = (wH * header + wC * consistency + wB * bitParse) / (wH + wC + wB)}
 */
@Component
@RequiredArgsConstructor
public class CandidateScorer {

    private final HeaderVocabulary headerVocabulary;
    private final BitRangeParser bitRangeParser;
    private final TextCleaner textCleaner;

    @Value("${sim.arbiter.weights.header:0.4}")
    private double headerWeight = ScoringWeights.DEFAULT_HEADER;

    @Value("${sim.arbiter.weights.consistency:0.2}")
    private double consistencyWeight = ScoringWeights.DEFAULT_CONSISTENCY;

    @Value("${sim.arbiter.weights.bit-parse:0.4}")
    private double bitParseWeight = ScoringWeights.DEFAULT_BIT_PARSE;

    public ScoringWeights weights() {
        return new ScoringWeights(headerWeight, consistencyWeight, bitParseWeight);
    }

    public CandidateScore score(TableCandidate candidate) {
        int density = candidate.nonEmptyCellCount();
        // A header without data rows carries no field information
        if (candidate.rows().size() < 2) {
            return CandidateScore.zero(density);
        }

        double header = headerRatio(candidate.header());
        double consistency = consistencyRatio(candidate.rows());
        double bitParse = bitParseRatio(candidate);

        ScoringWeights w = weights();
        double total = (w.header() * header + w.consistency() * consistency + w.bitParse() * bitParse) / w.sum();
        return new CandidateScore(header, consistency, bitParse, density, total);
    }

    double headerRatio(List<String> header) {
        if (header.isEmpty()) {
            return 0;
        }
        long known = header.stream()
                .map(textCleaner::cell)
                .filter(headerVocabulary::isKnown)
                .count();
        return (double) known / header.size();
    }

    double consistencyRatio(List<List<String>> rows) {
        // TreeMap so that ties in the mode resolve to the widest row, deterministically
        Map<Integer, Integer> counts = new TreeMap<>();
        for (List<String> row : rows) {
            counts.merge(row.size(), 1, Integer::sum);
        }
        int modalCount = 0;
        for (int occurrences : counts.values()) {
            modalCount = Math.max(modalCount, occurrences);
        }
        return (double) modalCount / rows.size();
    }

    double bitParseRatio(TableCandidate candidate) {
        HeaderMapping mapping = HeaderMapping.of(candidate.header(), headerVocabulary, textCleaner);

        ColumnRole role;
        Predicate<String> parses;
        if (mapping.has(ColumnRole.BIT_RANGE)) {
            role = ColumnRole.BIT_RANGE;
            parses = bitRangeParser::isParseable;
        } else if (mapping.has(ColumnRole.START_BIT)) {
            role = ColumnRole.START_BIT;
            parses = cell -> bitRangeParser.parsePosition(cell).isPresent();
        } else if (mapping.has(ColumnRole.LENGTH)) {
            role = ColumnRole.LENGTH;
            parses = bitRangeParser::isLengthCell;
        } else {
            return 0;
        }

        int dataRows = 0;
        int parsed = 0;
        for (List<String> row : candidate.dataRows()) {
            if (isBlank(row) || isMarkerRow(row)) {
                continue;
            }
            dataRows++;
            String cell = mapping.view(row, textCleaner).get(role);
            if (parses.test(cell)) {
                parsed++;
            }
        }
        return dataRows == 0 ? 0 : (double) parsed / dataRows;
    }

    private static boolean isBlank(List<String> row) {
        return row.stream().allMatch(c -> c == null || c.isBlank());
    }

    private boolean isMarkerRow(List<String> row) {
        List<String> nonEmpty = row.stream()
                .map(textCleaner::cell)
                .filter(c -> !c.isEmpty())
                .toList();
        return nonEmpty.size() == 1 && SegmentMarkers.isMarker(nonEmpty.get(0));
    }
}
