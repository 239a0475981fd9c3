package com.specsim.infrastructure.sim.normalize;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes segment-boundary labels ("Initial Word", "Extension Word 1", "Fixed Header", ...)
 * and derives the segment type they open.
 */
public final class SegmentMarkers {

    public static final String DEFAULT_TYPE = "General";

    private static final Pattern WORD_MARKER = Pattern.compile(
            "^(?:(initial|extension|continuation)\\s+)?word(?:\\s*(?:no\\.?|#)?\\s*(\\d{1,4}))?(?:\\s*[:(].*)?$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern TYPED_WORD = Pattern.compile(
            "^(initial|extension|continuation)(?:\\s+word)?(?:\\s*(\\d{1,4}))?$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PACKET_PART = Pattern.compile(
            "^(fixed header|variable header|properties|payload)(?:\\s*[:(].*)?$",
            Pattern.CASE_INSENSITIVE
    );

    private SegmentMarkers() {
    }

    /**
     * Canonical marker label for a cell, e.g. {@code "extension word 1"} becomes {@code "Extension Word 1"}.
     */
    public static Optional<String> parse(String cell) {
        if (cell == null || cell.isBlank()) {
            return Optional.empty();
        }
        String text = cell.strip();

        Matcher packet = PACKET_PART.matcher(text);
        if (packet.matches()) {
            return Optional.of(titleCase(packet.group(1)));
        }

        Matcher word = WORD_MARKER.matcher(text);
        if (word.matches()) {
            return Optional.of(wordLabel(word.group(1), word.group(2)));
        }

        Matcher typed = TYPED_WORD.matcher(text);
        if (typed.matches()) {
            return Optional.of(wordLabel(typed.group(1), typed.group(2)));
        }
        return Optional.empty();
    }

    public static boolean isMarker(String cell) {
        return parse(cell).isPresent();
    }

    /**
     * Segment type a marker opens. Null marker means the default type.
     */
    public static String typeOf(String marker) {
        if (marker == null || marker.isBlank()) {
            return DEFAULT_TYPE;
        }
        String lower = marker.toLowerCase(Locale.ROOT);
        if (lower.startsWith("initial")) {
            return "Initial";
        }
        if (lower.startsWith("extension")) {
            return "Extension";
        }
        if (lower.startsWith("continuation")) {
            return "Continuation";
        }
        if (lower.startsWith("word")) {
            return lower.matches("word 0") ? "Initial" : "Word";
        }
        Matcher packet = PACKET_PART.matcher(marker);
        return packet.matches() ? titleCase(packet.group(1)) : marker;
    }

    private static String wordLabel(String kind, String number) {
        StringBuilder label = new StringBuilder();
        if (kind != null) {
            label.append(titleCase(kind)).append(' ');
        }
        label.append("Word");
        if (number != null) {
            label.append(' ').append(Integer.parseInt(number));
        }
        return label.toString();
    }

    private static String titleCase(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean upper = true;
        for (char c : text.toLowerCase(Locale.ROOT).toCharArray()) {
            out.append(upper ? Character.toUpperCase(c) : c);
            upper = c == ' ';
        }
        return out.toString();
    }
}
