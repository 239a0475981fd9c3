package com.specsim.infrastructure.sim.validation;

/**
 * Stable dotted paths for issue targets.
 * <p>
 * Model paths ({@code messages}, {@code dictionary}) point into the serialized SIM. Pipeline artefact
 * paths point into the build response: {@code coverageGaps[i]} and {@code skippedRows[i]} by index,
 * {@code sections[label]} by section label.
 */
final class TargetPaths {

    private TargetPaths() {
    }

    static String message(int message) {
        return "messages[" + message + "]";
    }

    static String segment(int message, int segment) {
        return message(message) + ".segments[" + segment + "]";
    }

    static String field(int message, int segment, int field) {
        return segment(message, segment) + ".fields[" + field + "]";
    }

    static String dictionary(int entry) {
        return "dictionary[" + entry + "]";
    }

    static String coverage(int gap) {
        return "coverageGaps[" + gap + "]";
    }

    static String skippedRow(int row) {
        return "skippedRows[" + row + "]";
    }

    static String section(String label) {
        return "sections[" + label + "]";
    }

    static String messages() {
        return "messages";
    }
}
