package com.specsim.infrastructure.sim.normalize;

import com.specsim.domain.sim.model.UnitDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable mapping from unit-token variants to canonical unit definitions.
 * Built once by {@code SimLookupConfig} and shared read-only.
 */
public final class UnitTable {

    // Aliases shorter than this are too ambiguous to detect inside free text ("m", "s", "ft")
    private static final int MIN_TEXT_ALIAS_LENGTH = 3;

    // Ordinary English words that name a unit only in a unit column
    private static final Set<String> TEXT_STOP_WORDS = Set.of(
            "second", "seconds", "sec", "secs", "minute", "minutes", "min", "mins");

    private final Map<String, UnitDefinition> units;
    private final Map<String, String> aliases;
    private final List<TextAlias> textAliases;

    private UnitTable(Map<String, UnitDefinition> units, Map<String, String> aliases) {
        this.units = Collections.unmodifiableMap(new LinkedHashMap<>(units));
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        // longest first so "feet per second" wins over "feet"
        this.textAliases = aliases.keySet().stream()
                .filter(a -> a.length() >= MIN_TEXT_ALIAS_LENGTH)
                .filter(a -> !TEXT_STOP_WORDS.contains(a))
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .map(a -> new TextAlias(a, standalone(a)))
                .toList();
    }

    private static Pattern standalone(String alias) {
        return Pattern.compile("(?<![\\p{L}\\d])" + Pattern.quote(alias) + "(?![\\p{L}\\d])");
    }

    private record TextAlias(String alias, Pattern pattern) {}

    /**
     * Resolution of one unit token.
     *
     * @param symbol   canonical symbol when resolved, otherwise the cleaned token
     * @param raw      the token as given
     * @param resolved whether the table knew the token
     */
    public record Resolution(String symbol, String raw, boolean resolved) {}

    public Optional<UnitDefinition> lookup(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String symbol = aliases.get(key(token));
        return symbol == null ? Optional.empty() : Optional.ofNullable(units.get(symbol));
    }

    /**
     * Resolve a unit cell. Blank and placeholder cells resolve to empty.
     */
    public Optional<Resolution> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String cleaned = token.strip();
        String k = key(cleaned);
        if (k.isEmpty() || k.equals("-") || k.equals("n/a") || k.equals("na") || k.equals("none")) {
            return Optional.empty();
        }
        return lookup(cleaned)
                .map(def -> new Resolution(def.symbol(), cleaned, true))
                .or(() -> Optional.of(new Resolution(cleaned, cleaned, false)));
    }

    /**
     * Find the first known unit mentioned in free text, e.g. "Altitude in feet above MSL".
     */
    public Optional<Resolution> detectInText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (TextAlias textAlias : textAliases) {
            Matcher m = textAlias.pattern().matcher(lower);
            if (m.find()) {
                String raw = text.substring(m.start(), m.end());
                return Optional.of(new Resolution(aliases.get(textAlias.alias()), raw, true));
            }
        }
        return Optional.empty();
    }

    private static String key(String token) {
        return token.strip().toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .replaceAll("[()\\[\\]]", "");
    }

    /**
     * Units found in message standards and their SI conversion factors.
     */
    public static UnitTable standard() {
        Builder b = new Builder();
        b.unit("degree", "radian", Math.PI / 180.0, 0, "Angle in degrees",
                "deg", "degs", "degree", "degrees", "°", "dgr");
        b.unit("radian", "radian", 1.0, 0, "Angle in radians",
                "rad", "rads", "radian", "radians");
        b.unit("foot", "metre", 0.3048, 0, "Length in feet",
                "ft", "feet", "foot", "'");
        b.unit("metre", "metre", 1.0, 0, "Length in metres",
                "m", "meter", "meters", "metre", "metres");
        b.unit("nautical-mile", "metre", 1852.0, 0, "Distance in nautical miles",
                "nm", "nmi", "nautical mile", "nautical miles", "data mile", "data miles");
        b.unit("knot", "metre-per-second", 0.514444, 0, "Speed in knots",
                "kt", "kts", "knot", "knots");
        b.unit("metre-per-second", "metre-per-second", 1.0, 0, "Speed in metres per second",
                "m/s", "mps", "meters per second", "metres per second", "meter/second", "metre/second");
        b.unit("foot-per-second", "metre-per-second", 0.3048, 0, "Speed in feet per second",
                "ft/s", "fps", "feet per second", "feet/second");
        b.unit("foot-per-minute", "metre-per-second", 0.00508, 0, "Rate in feet per minute",
                "ft/min", "fpm", "feet per minute");
        b.unit("second", "second", 1.0, 0, "Time in seconds",
                "s", "sec", "secs", "second", "seconds");
        b.unit("millisecond", "second", 0.001, 0, "Time in milliseconds",
                "ms", "msec", "millisecond", "milliseconds");
        b.unit("minute", "second", 60.0, 0, "Time in minutes",
                "min", "mins", "minute", "minutes");
        b.unit("hertz", "hertz", 1.0, 0, "Frequency in hertz",
                "hz", "hertz");
        b.unit("megahertz", "hertz", 1.0e6, 0, "Frequency in megahertz",
                "mhz", "megahertz");
        b.unit("celsius", "kelvin", 1.0, 273.15, "Temperature in degrees Celsius",
                "°c", "degc", "deg c", "celsius");
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, UnitDefinition> units = new LinkedHashMap<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();

        public Builder unit(String symbol, String baseSi, double factor, double offset, String description,
                            String... variants) {
            units.put(symbol, new UnitDefinition(symbol, baseSi, factor, offset, description));
            aliases.put(key(symbol), symbol);
            for (String variant : variants) {
                aliases.put(key(variant), symbol);
            }
            return this;
        }

        public UnitTable build() {
            return new UnitTable(units, aliases);
        }
    }
}
