package com.shelf.matching.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link NormalizationRule}s to text in priority order (lower number first),
 * then lower-cases, trims and collapses whitespace.
 *
 * <p>The rule list is fixed at construction so one engine can be shared by
 * concurrently running pipelines.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this(List.of());
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes text that is not tied to a particular field; only unscoped rules run.
     */
    public String normalize(String text) {
        return normalize(text, null);
    }

    /**
     * Normalizes text for the given field. Null or blank input yields the empty string.
     */
    public String normalize(String text, TextField field) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = text;
        for (NormalizationRule rule : rules) {
            if (field == null ? rule.getFields().isEmpty() : rule.appliesTo(field)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }
}
