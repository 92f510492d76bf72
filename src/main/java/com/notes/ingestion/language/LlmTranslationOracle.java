package com.notes.ingestion.language;

import com.notes.ingestion.llm.LLMClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link TranslationOracle} that prompts a language model.
 */
public class LlmTranslationOracle implements TranslationOracle {
    private static final Logger log = LoggerFactory.getLogger(LlmTranslationOracle.class);

    private static final Pattern YES_NO_PATTERN = Pattern.compile("(?i)\\b(yes|no)\\b");

    private final LLMClient client;

    public LlmTranslationOracle(LLMClient client) {
        this.client = client;
    }

    /**
     * Asks for a bare YES/NO answer. Anything other than a clear NO counts as English.
     */
    @Override
    public boolean detectEnglish(String text) {
        String prompt = "Is the following text written in English? Reply with only YES or NO.\n\n"
                + "Text: \"" + text + "\"";
        String answer = client.generate(prompt);
        Matcher matcher = YES_NO_PATTERN.matcher(answer);
        if (!matcher.find()) {
            log.debug("Ambiguous language detection answer, assuming English: {}", answer);
            return true;
        }
        return !"no".equals(matcher.group(1).toLowerCase(Locale.ROOT));
    }

    @Override
    public String translate(String text) {
        String prompt = "Translate the following text to English. Keep names of people, firms, "
                + "projects and places unchanged. Reply with only the translation.\n\n"
                + "Text: \"" + text + "\"";
        String translation = client.generate(prompt).trim();
        if (translation.length() >= 2 && translation.startsWith("\"") && translation.endsWith("\"")) {
            translation = translation.substring(1, translation.length() - 1);
        }
        return translation;
    }
}
