package com.specsim.infrastructure.sim.normalize;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans raw cell text before parsing:
 * - Unicode NFKC normalization (full-width digits and punctuation become ASCII)
 * - Ligature replacement
 * - Invisible/control character removal
 * - Hyphen and dash variants collapsed to '-'
 * - Whitespace normalization (collapse runs, trim)
 */
@Component
public class TextCleaner {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // All C0 control characters and DEL; line breaks inside a cell are folded into spaces first
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // Hyphen, non-breaking hyphen, figure dash, en dash, em dash, horizontal bar, minus sign, small/full-width hyphen
    private static final Pattern DASH_VARIANTS = Pattern.compile(
            "[\\u2010\\u2011\\u2012\\u2013\\u2014\\u2015\\u2212\\uFE58\\uFE63\\uFF0D]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Normalize a piece of text.
     *
     * @param text raw cell or heading text
     * @return cleaned text, or the input unchanged when null or empty
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        // 1. Compatibility normalization (full-width → ASCII, "…" → "...")
        String result = Normalizer.normalize(text, Normalizer.Form.NFKC);

        // 2. Ligatures NFKC leaves alone in some fonts' private mappings
        result = result.replace("ﬁ", "fi").replace("ﬂ", "fl");

        // 3. Remove invisible characters
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");

        // 4. Line breaks and tabs become spaces, then drop remaining control characters
        result = result.replace('\r', ' ').replace('\n', ' ').replace('\t', ' ');
        result = CONTROL_CHARS.matcher(result).replaceAll("");

        // 5. Dash variants → '-'
        result = DASH_VARIANTS.matcher(result).replaceAll("-");

        // 6. Collapse whitespace and trim
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ").strip();

        return result;
    }

    /**
     * Normalize a cell, mapping null to the empty string.
     */
    public String cell(String text) {
        String cleaned = normalize(text);
        return cleaned == null ? "" : cleaned;
    }

    /**
     * Number of leading indentation steps (two spaces or one tab each) before cleaning.
     */
    public int indentation(String text) {
        if (text == null) {
            return 0;
        }
        int spaces = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ' || c == ' ' || c == '　') {
                spaces++;
            } else if (c == '\t') {
                spaces += 2;
            } else {
                break;
            }
        }
        return spaces / 2;
    }
}
