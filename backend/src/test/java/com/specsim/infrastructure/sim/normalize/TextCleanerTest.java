package com.specsim.infrastructure.sim.normalize;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleanerTest {

    private TextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new TextCleaner();
    }

    @Test
    @DisplayName("null and empty input are returned as-is")
    void null_and_empty() {
        assertThat(cleaner.normalize(null)).isNull();
        assertThat(cleaner.normalize("")).isEmpty();
        assertThat(cleaner.cell(null)).isEmpty();
    }

    @Test
    @DisplayName("en dash, em dash and minus sign become '-'")
    void dash_variants() {
        assertThat(cleaner.normalize("6–15")).isEqualTo("6-15");
        assertThat(cleaner.normalize("6—15")).isEqualTo("6-15");
        assertThat(cleaner.normalize("6−15")).isEqualTo("6-15");
    }

    @Test
    @DisplayName("full-width digits are folded to ASCII")
    void full_width_digits() {
        assertThat(cleaner.normalize("１２")).isEqualTo("12");
    }

    @Test
    @DisplayName("ligatures are expanded")
    void ligatures() {
        assertThat(cleaner.normalize("ﬁeld")).isEqualTo("field");
    }

    @Test
    @DisplayName("invisible characters are removed")
    void invisible_characters() {
        assertThat(cleaner.normalize("Alti\u200Btude\uFEFF")).isEqualTo("Altitude");
    }

    @Test
    @DisplayName("line breaks inside a cell collapse to one space")
    void line_breaks() {
        assertThat(cleaner.normalize("Track\r\nNumber\tIndex")).isEqualTo("Track Number Index");
    }

    @Test
    @DisplayName("whitespace runs collapse and ends are trimmed")
    void whitespace() {
        assertThat(cleaner.normalize("  Air   Track  ")).isEqualTo("Air Track");
    }

    @Test
    @DisplayName("plain text is unchanged")
    void plain_text_unchanged() {
        String input = "Current altitude above MSL";
        assertThat(cleaner.normalize(input)).isEqualTo(input);
    }

    @Test
    @DisplayName("indentation counts two spaces or one tab per step")
    void indentation() {
        assertThat(cleaner.indentation("Name")).isZero();
        assertThat(cleaner.indentation("  Name")).isEqualTo(1);
        assertThat(cleaner.indentation("\t\tName")).isEqualTo(2);
        assertThat(cleaner.indentation(null)).isZero();
    }
}
