package com.notes.ingestion.rules;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * One way of deriving an alternative spelling of an office name.
 */
public final class NameVariantRule {

    private final String name;
    private final Function<String, String> transform;

    private NameVariantRule(String name, Function<String, String> transform) {
        this.name = name;
        this.transform = transform;
    }

    /**
     * Case-insensitive regex replacement.
     */
    public static NameVariantRule replacing(String name, String regex, String replacement) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return new NameVariantRule(name, input -> pattern.matcher(input).replaceAll(replacement));
    }

    public static NameVariantRule of(String name, Function<String, String> transform) {
        return new NameVariantRule(name, transform);
    }

    public String getName() {
        return name;
    }

    /**
     * The variant for {@code input}, if the rule produces a different, non-blank name.
     */
    public Optional<String> apply(String input) {
        String result = transform.apply(input);
        if (result == null) {
            return Optional.empty();
        }
        String cleaned = result.replaceAll("\\s+", " ").trim();
        if (cleaned.isEmpty() || cleaned.equals(input.trim())) {
            return Optional.empty();
        }
        return Optional.of(cleaned);
    }

    @Override
    public String toString() {
        return "NameVariantRule{" + name + "}";
    }
}
