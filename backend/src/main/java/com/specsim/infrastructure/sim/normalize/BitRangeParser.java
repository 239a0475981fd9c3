package com.specsim.infrastructure.sim.normalize;

import com.specsim.domain.sim.model.BitRange;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bit-range grammar shared by the arbiter's scorer and the field normalizer.
 * <p>
 * Accepted: {@code a-b}, {@code a–b}, {@code a..b}, {@code a to b}, {@code a~b}, each optionally
 * prefixed by {@code bit}/{@code bits}; a single integer denotes a one-bit range.
 * Input is cleaned first, so dash variants and full-width digits are already ASCII.
 */
@Component
@RequiredArgsConstructor
public class BitRangeParser {

    private static final Pattern RANGE = Pattern.compile(
            "(?:\\bbits?\\s*)?(\\d+)\\s*(?:-|~|\\.\\.|\\bto\\b)\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SINGLE = Pattern.compile(
            "^(?:bits?\\s*)?(\\d+)(?:\\s*\\([^)]*\\))?$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern VARIABLE_LENGTH = Pattern.compile(
            "\\b(?:variable|varies|var\\.?|vbi|variable\\s+byte\\s+integer|var[-\\s]*bytes?)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern FIXED_LENGTH = Pattern.compile(
            "^(\\d+)\\s*(?:bytes?|octets?|bits?)?\\b",
            Pattern.CASE_INSENSITIVE
    );

    private final TextCleaner textCleaner;

    /**
     * A parsed range and whether the source had to be reordered to satisfy start &lt;= end.
     */
    public record ParsedRange(BitRange range, boolean reordered) {}

    public Optional<ParsedRange> parse(String cell) {
        String text = textCleaner.cell(cell);
        if (text.isEmpty()) {
            return Optional.empty();
        }

        Matcher range = RANGE.matcher(text);
        if (range.find()) {
            OptionalInt a = toInt(range.group(1));
            OptionalInt b = toInt(range.group(2));
            if (a.isEmpty() || b.isEmpty()) {
                return Optional.empty();
            }
            int start = a.getAsInt();
            int end = b.getAsInt();
            if (start > end) {
                return Optional.of(new ParsedRange(new BitRange(end, start), true));
            }
            return Optional.of(new ParsedRange(new BitRange(start, end), false));
        }

        Matcher single = SINGLE.matcher(text);
        if (single.matches()) {
            OptionalInt bit = toInt(single.group(1));
            if (bit.isPresent()) {
                return Optional.of(new ParsedRange(BitRange.single(bit.getAsInt()), false));
            }
        }
        return Optional.empty();
    }

    public boolean isParseable(String cell) {
        return parse(cell).isPresent();
    }

    /**
     * Single integer cell (START or END column).
     */
    public OptionalInt parsePosition(String cell) {
        Matcher single = SINGLE.matcher(textCleaner.cell(cell));
        return single.matches() ? toInt(single.group(1)) : OptionalInt.empty();
    }

    public boolean isVariableLength(String cell) {
        return VARIABLE_LENGTH.matcher(textCleaner.cell(cell)).find();
    }

    /**
     * Fixed length such as "2", "2 bytes", "16 bits".
     */
    public OptionalInt parseFixedLength(String cell) {
        Matcher m = FIXED_LENGTH.matcher(textCleaner.cell(cell));
        if (!m.find()) {
            return OptionalInt.empty();
        }
        OptionalInt length = toInt(m.group(1));
        return length.isPresent() && length.getAsInt() > 0 ? length : OptionalInt.empty();
    }

    public boolean isLengthCell(String cell) {
        return isVariableLength(cell) || parseFixedLength(cell).isPresent();
    }

    private static OptionalInt toInt(String digits) {
        try {
            return OptionalInt.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            // more digits than an int holds; not a plausible bit position
            return OptionalInt.empty();
        }
    }
}
