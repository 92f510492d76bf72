package com.notes.ingestion.enrichment;

import com.notes.ingestion.identity.LocationCodes;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Checks whether the text around an office's name already says where it is.
 * Matches whole words only, so short tokens do not hit inside longer words.
 */
public class LocationTextScanner {

    private static final List<String> PHRASES = List.of(
            "based in", "located in", "headquarters in", "headquartered in",
            "office in", "offices in", "studio in");

    private final List<Pattern> indicators;
    private final int window;

    public LocationTextScanner(int window) {
        if (window < 0) {
            throw new IllegalArgumentException("window must be >= 0");
        }
        this.window = window;
        this.indicators = Stream.concat(
                        PHRASES.stream(),
                        Stream.concat(LocationCodes.placeNames().stream(), Stream.of("barcelona")))
                .map(token -> Pattern.compile("\\b" + Pattern.quote(token) + "\\b"))
                .toList();
    }

    /**
     * True when a location phrase or a known city or country appears within {@code window} characters
     * of the first mention of {@code officeName}. False when the name does not occur in the text.
     */
    public boolean mentionsLocation(String text, String officeName) {
        if (text == null || officeName == null || officeName.isBlank()) {
            return false;
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        String lowerName = officeName.trim().toLowerCase(Locale.ROOT);
        int index = lowerText.indexOf(lowerName);
        if (index < 0) {
            return false;
        }
        int start = Math.max(0, index - window);
        int end = Math.min(lowerText.length(), index + lowerName.length() + window);
        String context = lowerText.substring(start, end);
        return indicators.stream().anyMatch(p -> p.matcher(context).find());
    }
}
