package com.notes.ingestion.workforce;

import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.resolution.IdentityResolver;
import com.notes.ingestion.resolution.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Works out which existing office a note's employees belong to when extraction named none.
 * Only offices already in the store are returned; nothing is created here.
 */
public class EmployerInference {
    private static final Logger log = LoggerFactory.getLogger(EmployerInference.class);

    private static final String NAME = "([^,\\-.]+?)";
    private static final String FIRM = "\\s+(?:office|firm|company)";

    // first match wins
    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("goes?\\s+(?:into|in\\s+to|in|to)\\s+" + NAME + FIRM, Pattern.CASE_INSENSITIVE),
            Pattern.compile("employees?\\s+of\\s+" + NAME + FIRM, Pattern.CASE_INSENSITIVE),
            Pattern.compile("part\\s+of\\s+" + NAME + FIRM, Pattern.CASE_INSENSITIVE),
            Pattern.compile("works?\\s+for\\s+" + NAME + FIRM, Pattern.CASE_INSENSITIVE),
            Pattern.compile(NAME + "\\s+office(?:[\\s,]|$)", Pattern.CASE_INSENSITIVE));

    private final IdentityResolver resolver;

    public EmployerInference(IdentityResolver resolver) {
        this.resolver = resolver;
    }

    public Optional<Office> inferEmployer(String text) {
        Optional<String> mentioned = mentionedOfficeName(text);
        if (mentioned.isEmpty()) {
            return Optional.empty();
        }
        for (String name : candidateNames(mentioned.get())) {
            SearchResult<Office> match = resolver.searchExistingOffice(name, null, true);
            if (match.found()) {
                log.info("Employees attributed to existing office '{}' ({})", match.entity().name(),
                        match.entity().id());
                return Optional.of(match.entity());
            }
        }
        log.debug("No existing office matches '{}'", mentioned.get());
        return Optional.empty();
    }

    static Optional<String> mentionedOfficeName(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && !matcher.group(1).isBlank()) {
                return Optional.of(matcher.group(1).trim());
            }
        }
        return Optional.empty();
    }

    /**
     * The phrase itself, then the phrase with leading words dropped while two or more words remain.
     * Handles captures such as "Ana joined Boris Pena Architecture".
     */
    static List<String> candidateNames(String phrase) {
        List<String> words = Arrays.asList(phrase.trim().split("\\s+"));
        List<String> names = new ArrayList<>();
        names.add(String.join(" ", words));
        for (int start = 1; words.size() - start >= 2; start++) {
            names.add(String.join(" ", words.subList(start, words.size())));
        }
        return names;
    }
}
