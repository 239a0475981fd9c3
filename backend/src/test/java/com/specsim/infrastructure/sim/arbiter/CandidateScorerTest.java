package com.specsim.infrastructure.sim.arbiter;

import com.specsim.domain.sim.model.ExtractionMethod;
import com.specsim.domain.sim.model.PageRegion;
import com.specsim.domain.sim.model.TableCandidate;
import com.specsim.infrastructure.sim.normalize.BitRangeParser;
import com.specsim.infrastructure.sim.normalize.HeaderVocabulary;
import com.specsim.infrastructure.sim.normalize.TextCleaner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CandidateScorerTest {

    private CandidateScorer scorer;

    @BeforeEach
    void setUp() {
        TextCleaner cleaner = new TextCleaner();
        scorer = new CandidateScorer(HeaderVocabulary.standard(), new BitRangeParser(cleaner), cleaner);
    }

    private void setField(String name, double value) throws Exception {
        Field field = CandidateScorer.class.getDeclaredField(name);
        field.setAccessible(true);
        field.set(scorer, value);
    }

    private static TableCandidate candidate(List<List<String>> rows) {
        return new TableCandidate(ExtractionMethod.PRIMARY, PageRegion.wholePage(1), rows);
    }

    @Test
    @DisplayName("a clean table scores 1.0")
    void perfect_table() {
        CandidateScore score = scorer.score(candidate(List.of(
                List.of("Field", "Bits", "Units", "Description"),
                List.of("Altitude", "0-15", "feet", "Current altitude"),
                List.of("Heading", "16-24", "deg", ""))));

        assertThat(score.headerRatio()).isEqualTo(1.0);
        assertThat(score.consistencyRatio()).isEqualTo(1.0);
        assertThat(score.bitParseRatio()).isEqualTo(1.0);
        assertThat(score.total()).isCloseTo(1.0, within(1e-9));
        assertThat(score.density()).isEqualTo(11);
    }

    @Test
    @DisplayName("total is the normalized weighted sum of the three features")
    void weighted_sum() {
        CandidateScore score = scorer.score(candidate(List.of(
                List.of("Field", "Bits", "Colour", "Shape"),
                List.of("Altitude", "0-15", "", ""),
                List.of("Speed", "N/A", "", ""),
                List.of("Heading", "16-24", ""))));

        assertThat(score.headerRatio()).isCloseTo(0.5, within(1e-9));
        assertThat(score.consistencyRatio()).isCloseTo(0.75, within(1e-9));
        assertThat(score.bitParseRatio()).isCloseTo(2.0 / 3, within(1e-9));
        double expected = (0.4 * 0.5 + 0.2 * 0.75 + 0.4 * (2.0 / 3)) / 1.0;
        assertThat(score.total()).isCloseTo(expected, within(1e-9));
    }

    @Test
    @DisplayName("a header without data rows scores zero")
    void header_only() {
        CandidateScore score = scorer.score(candidate(List.of(List.of("Field", "Bits"))));
        assertThat(score.total()).isZero();
        assertThat(score.density()).isEqualTo(2);
    }

    @Test
    @DisplayName("marker and blank rows do not count against the parse ratio")
    void marker_rows_excluded() {
        CandidateScore score = scorer.score(candidate(List.of(
                List.of("Field", "Bits"),
                List.of("Initial Word", ""),
                List.of("", ""),
                List.of("Label", "0-1"))));
        assertThat(score.bitParseRatio()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("length columns are scored when there is no position column")
    void length_column() {
        CandidateScore score = scorer.score(candidate(List.of(
                List.of("Name", "Length"),
                List.of("Packet Type", "4"),
                List.of("Remaining Length", "Variable"),
                List.of("Properties", "see below"))));
        assertThat(score.bitParseRatio()).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    @DisplayName("configured weights change the total")
    void custom_weights() throws Exception {
        setField("headerWeight", 1.0);
        setField("consistencyWeight", 0.0);
        setField("bitParseWeight", 0.0);

        CandidateScore score = scorer.score(candidate(List.of(
                List.of("Field", "Colour"),
                List.of("Altitude", "0-15"))));
        assertThat(score.total()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("weights must be non-negative with a positive sum")
    void invalid_weights() {
        assertThatThrownBy(() -> new ScoringWeights(-0.1, 0.5, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScoringWeights(0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
