package com.notes.ingestion.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Alternative spellings tried when an office name has no direct match: without the organisational
 * suffix, as initials, as first word plus initials, and with Architecture and Architects swapped.
 */
public class OfficeNameVariants {

    private static final String SUFFIXES = "Architects|Architecture|Architect|Associates|LLC|Ltd|Inc|Studio|Design";

    private final List<NameVariantRule> rules;

    public OfficeNameVariants() {
        this(defaultRules());
    }

    public OfficeNameVariants(List<NameVariantRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<NameVariantRule> defaultRules() {
        return List.of(
                NameVariantRule.replacing("strip-suffix", "[\\s,]+(?:" + SUFFIXES + ")\\.?\\s*$", ""),
                NameVariantRule.of("initials", OfficeNameVariants::initials),
                NameVariantRule.of("first-word-initials", OfficeNameVariants::firstWordAndInitials),
                NameVariantRule.replacing("architecture-to-architects", "\\bArchitecture\\b", "Architects"),
                NameVariantRule.replacing("architects-to-architecture", "\\bArchitects\\b", "Architecture"));
    }

    /**
     * Distinct variants in rule order, never including the name itself.
     */
    public List<String> generate(String name) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        Set<String> variants = new LinkedHashSet<>();
        for (NameVariantRule rule : rules) {
            rule.apply(name).ifPresent(variants::add);
        }
        variants.removeIf(v -> v.equalsIgnoreCase(name.trim()));
        return new ArrayList<>(variants);
    }

    private static String initials(String name) {
        List<String> words = words(name);
        if (words.size() < 2) {
            return null;
        }
        return words.stream()
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT))
                .collect(Collectors.joining());
    }

    private static String firstWordAndInitials(String name) {
        List<String> words = words(name);
        if (words.size() < 3) {
            return null;
        }
        String rest = words.subList(1, words.size()).stream()
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT))
                .collect(Collectors.joining());
        return words.get(0) + " " + rest;
    }

    private static List<String> words(String name) {
        return Arrays.stream(name.trim().split("\\s+"))
                .filter(w -> !w.isEmpty() && Character.isLetterOrDigit(w.charAt(0)))
                .toList();
    }
}
