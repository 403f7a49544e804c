package com.shelf.matching.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for retail catalog and shelf-extracted text.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>(getCommonRules());
        rules.addAll(getBrandRules());
        rules.addAll(getStoreNameRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Rules for every field: symbols and punctuation that carry no identity.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("trademark-symbols")
                        .pattern("[\\u2122\\u00AE\\u00A9]|\\((tm|r|c)\\)")
                        .replacement("")
                        .priority(5)
                        .build(),

                NormalizationRule.builder()
                        .name("typographic-apostrophes")
                        .pattern("[\\u2018\\u2019\\u02BC`]")
                        .replacement("'")
                        .priority(5)
                        .build(),

                NormalizationRule.builder()
                        .name("ampersand-spacing")
                        .pattern("\\s*&\\s*")
                        .replacement(" & ")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("separator-punctuation")
                        .pattern("[,;:!?()\"\\[\\]{}|/]+")
                        .replacement(" ")
                        .priority(50)
                        .build()
        );
    }

    /**
     * Brand and manufacturer names: drop legal-entity suffixes.
     */
    public static List<NormalizationRule> getBrandRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("brand-legal-suffix")
                        .pattern(",?\\s+(Inc\\.?|Incorporated|LLC|L\\.L\\.C\\.|Corp\\.?|Corporation|Ltd\\.?)\\s*$")
                        .replacement("")
                        .fields(TextField.BRAND)
                        .priority(10)
                        .build()
        );
    }

    /**
     * Store names: drop store numbers and trailing addresses ("Target Store #1234 - Main St").
     */
    public static List<NormalizationRule> getStoreNameRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("store-address-suffix")
                        .pattern("\\s+-\\s+.*$")
                        .replacement("")
                        .fields(TextField.STORE_NAME)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("store-number")
                        .pattern("\\s*(store\\s*)?#\\s*\\d+")
                        .replacement("")
                        .fields(TextField.STORE_NAME)
                        .priority(15)
                        .build()
        );
    }
}
