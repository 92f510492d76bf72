package com.notes.ingestion.identity;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Two-letter codes for common countries and cities. Names outside the tables fall back to their
 * first letters.
 */
public final class LocationCodes {

    private static final Map<String, String> COUNTRIES = Map.ofEntries(
            Map.entry("united states", "US"),
            Map.entry("usa", "US"),
            Map.entry("us", "US"),
            Map.entry("united kingdom", "UK"),
            Map.entry("uk", "UK"),
            Map.entry("canada", "CA"),
            Map.entry("germany", "DE"),
            Map.entry("france", "FR"),
            Map.entry("japan", "JP"),
            Map.entry("china", "CN"),
            Map.entry("australia", "AU"),
            Map.entry("netherlands", "NL"),
            Map.entry("switzerland", "CH"),
            Map.entry("italy", "IT"),
            Map.entry("spain", "SP"));

    private static final Map<String, String> CITIES = Map.ofEntries(
            Map.entry("san francisco", "SF"),
            Map.entry("new york", "NY"),
            Map.entry("los angeles", "LA"),
            Map.entry("chicago", "CH"),
            Map.entry("london", "LD"),
            Map.entry("paris", "PR"),
            Map.entry("berlin", "BL"),
            Map.entry("tokyo", "TK"),
            Map.entry("sydney", "SY"),
            Map.entry("toronto", "TO"),
            Map.entry("vancouver", "VC"),
            Map.entry("amsterdam", "AM"),
            Map.entry("zurich", "ZH"),
            Map.entry("milan", "ML"),
            Map.entry("madrid", "MD"));

    private LocationCodes() {
    }

    /**
     * Lower-case city and country names from the tables, without the two-letter abbreviations.
     */
    public static Set<String> placeNames() {
        return Stream.concat(COUNTRIES.keySet().stream(), CITIES.keySet().stream())
                .filter(name -> name.length() > 2)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static String countryCode(String country) {
        return lookup(COUNTRIES, country);
    }

    public static String cityCode(String city) {
        return lookup(CITIES, city);
    }

    /**
     * First {@code length} characters of the value, uppercased, with anything outside A-Z replaced by
     * {@code X} and short values padded with {@code X}.
     */
    public static String letters(String value, int length) {
        String upper = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            char c = i < upper.length() ? upper.charAt(i) : 'X';
            code.append(c >= 'A' && c <= 'Z' ? c : 'X');
        }
        return code.toString();
    }

    /**
     * Like {@link #letters} but drops non-alphanumerics instead of masking them, so
     * "Foster + Partners" becomes "FOST".
     */
    public static String compact(String value, int length) {
        String cleaned = value == null ? "" : value.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
        StringBuilder code = new StringBuilder(cleaned.length() >= length ? cleaned.substring(0, length) : cleaned);
        while (code.length() < length) {
            code.append('X');
        }
        return code.toString();
    }

    private static String lookup(Map<String, String> table, String name) {
        if (name == null) {
            return letters(null, 2);
        }
        String code = table.get(name.trim().toLowerCase(Locale.ROOT));
        return code != null ? code : letters(name, 2);
    }
}
