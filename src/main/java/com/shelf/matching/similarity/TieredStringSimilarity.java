package com.shelf.matching.similarity;

import com.shelf.matching.rules.DefaultNormalizationRules;
import com.shelf.matching.rules.NormalizationEngine;
import com.shelf.matching.rules.TextField;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Discrete-tier similarity used by the text pre-filter.
 *
 * <ul>
 *   <li>1.0 when the normalized strings are equal</li>
 *   <li>0.8 when one normalized string contains the other</li>
 *   <li>0.5 + 0.3 * overlap when they share significant words, where overlap is
 *       the number of shared words divided by the word count of the longer string</li>
 *   <li>0.0 otherwise</li>
 * </ul>
 *
 * <p>Words of {@value #MIN_SIGNIFICANT_WORD_LENGTH} characters or fewer never count
 * as shared, so "of" or "&amp;" alone cannot produce a match.</p>
 */
public class TieredStringSimilarity {

    public static final double EXACT = 1.0;
    public static final double CONTAINS = 0.8;
    public static final double OVERLAP_BASE = 0.5;
    public static final double OVERLAP_RANGE = 0.3;

    static final int MIN_SIGNIFICANT_WORD_LENGTH = 2;

    private final NormalizationEngine normalizer;
    private final TextField field;

    public TieredStringSimilarity() {
        this(DefaultNormalizationRules.createDefaultEngine(), TextField.BRAND);
    }

    public TieredStringSimilarity(NormalizationEngine normalizer, TextField field) {
        this.normalizer = normalizer;
        this.field = field;
    }

    /**
     * Scores two strings after normalizing both for this scorer's field.
     *
     * @return 1.0 for equal text, down to 0.0 when no significant word is shared
     */
    public double compute(String s1, String s2) {
        String a = normalizer.normalize(s1, field);
        String b = normalizer.normalize(s2, field);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return EXACT;
        }
        if (a.contains(b) || b.contains(a)) {
            return CONTAINS;
        }

        String[] words1 = a.split(" ");
        String[] words2 = b.split(" ");
        Set<String> other = Set.of(dedupe(words2));
        int shared = 0;
        for (String word : dedupe(words1)) {
            if (word.length() > MIN_SIGNIFICANT_WORD_LENGTH && other.contains(word)) {
                shared++;
            }
        }
        if (shared == 0) {
            return 0.0;
        }
        double overlap = (double) shared / Math.max(words1.length, words2.length);
        return OVERLAP_BASE + Math.min(overlap, 1.0) * OVERLAP_RANGE;
    }

    /**
     * Returns a scorer using the same normalizer for a different field.
     */
    public TieredStringSimilarity forField(TextField otherField) {
        return new TieredStringSimilarity(normalizer, otherField);
    }

    private static String[] dedupe(String[] words) {
        Set<String> unique = new LinkedHashSet<>();
        for (String word : words) {
            if (!word.isEmpty()) {
                unique.add(word);
            }
        }
        return unique.toArray(new String[0]);
    }
}
