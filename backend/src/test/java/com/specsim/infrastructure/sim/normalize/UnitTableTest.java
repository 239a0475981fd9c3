package com.specsim.infrastructure.sim.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class UnitTableTest {

    private final UnitTable units = UnitTable.standard();

    @Nested
    @DisplayName("unit column resolution")
    class Resolve {

        @ParameterizedTest
        @ValueSource(strings = {"feet", "ft", "FT", "Foot", " feet "})
        void foot_variants_resolve_to_foot(String token) {
            assertThat(units.resolve(token)).hasValueSatisfying(r -> {
                assertThat(r.symbol()).isEqualTo("foot");
                assertThat(r.resolved()).isTrue();
            });
        }

        @Test
        void raw_token_is_kept() {
            assertThat(units.resolve("Feet").orElseThrow().raw()).isEqualTo("Feet");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "-", "N/A", "none"})
        void placeholders_resolve_to_nothing(String token) {
            assertThat(units.resolve(token)).isEmpty();
        }

        @Test
        void unknown_token_is_kept_verbatim_and_unresolved() {
            assertThat(units.resolve("furlongs")).hasValueSatisfying(r -> {
                assertThat(r.symbol()).isEqualTo("furlongs");
                assertThat(r.resolved()).isFalse();
            });
        }

        @Test
        void bracketed_token_resolves() {
            assertThat(units.resolve("(deg)").orElseThrow().symbol()).isEqualTo("degree");
        }
    }

    @Nested
    @DisplayName("unit mentioned in free text")
    class DetectInText {

        @Test
        void finds_unit_word() {
            assertThat(units.detectInText("Altitude in feet above MSL")).hasValueSatisfying(r -> {
                assertThat(r.symbol()).isEqualTo("foot");
                assertThat(r.raw()).isEqualTo("feet");
            });
        }

        @Test
        void longest_alias_wins() {
            assertThat(units.detectInText("Climb rate in feet per minute").orElseThrow().symbol())
                    .isEqualTo("foot-per-minute");
        }

        @Test
        void short_aliases_and_common_words_are_ignored() {
            assertThat(units.detectInText("Time of day in seconds since m")).isEmpty();
            assertThat(units.detectInText("Track number")).isEmpty();
            assertThat(units.detectInText(null)).isEmpty();
        }

        @Test
        void alias_must_stand_alone() {
            assertThat(units.detectInText("Parameter defaults")).isEmpty();
        }

        @Test
        void aliases_match_literally_and_repeatably() {
            assertThat(units.detectInText("Rate given in m/s").orElseThrow().symbol()).isEqualTo("metre-per-second");
            assertThat(units.detectInText("Rate given in mxs")).isEmpty();
            assertThat(units.detectInText("Rate given in m/s").orElseThrow().raw()).isEqualTo("m/s");
        }
    }

    @Test
    @DisplayName("custom tables can be built")
    void builder() {
        UnitTable custom = UnitTable.builder()
                .unit("byte", "bit", 8, 0, "Octet", "octet", "octets")
                .build();
        assertThat(custom.resolve("octets").orElseThrow().symbol()).isEqualTo("byte");
        assertThat(custom.resolve("feet").orElseThrow().resolved()).isFalse();
        assertThat(custom.lookup("octet").orElseThrow().baseSi()).isEqualTo("bit");
    }
}
