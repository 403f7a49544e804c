package com.shelf.matching.similarity;

import com.shelf.matching.rules.DefaultNormalizationRules;
import com.shelf.matching.rules.NormalizationEngine;
import com.shelf.matching.rules.TextField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves canonical retailer identifiers from free-text store names and from
 * product page URLs, so shelf context and catalog availability can be compared.
 */
public class RetailerResolver {

    /** Known chains, checked in order; the first one contained in the store name wins. */
    static final List<String> KNOWN_RETAILERS = List.of(
            "target", "walmart", "walgreens", "cvs", "kroger", "safeway",
            "albertsons", "publix", "whole foods", "trader joe", "costco",
            "sam's club", "aldi", "lidl", "food lion", "giant", "stop & shop");

    private static final Map<String, String> DOMAIN_RETAILERS = createDomainMap();

    private final NormalizationEngine normalizer;

    public RetailerResolver() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public RetailerResolver(NormalizationEngine normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Resolves a store name such as "Walgreens Store #6105 - 12 Main St" to "walgreens".
     * Unknown chains fall back to the first word of the normalized name.
     */
    public Optional<String> fromStoreName(String storeName) {
        String normalized = normalizer.normalize(storeName, TextField.STORE_NAME);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (String retailer : KNOWN_RETAILERS) {
            if (normalized.contains(retailer)) {
                return Optional.of(retailer);
            }
        }
        return Optional.of(normalized.split(" ")[0]);
    }

    /**
     * Extracts the retailers whose domains appear in the given product page URLs.
     */
    public List<String> fromUrls(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        Set<String> retailers = new LinkedHashSet<>();
        for (String url : urls) {
            if (url == null) {
                continue;
            }
            String lower = url.toLowerCase(Locale.ROOT);
            DOMAIN_RETAILERS.forEach((domain, retailer) -> {
                if (lower.contains(domain)) {
                    retailers.add(retailer);
                }
            });
        }
        return new ArrayList<>(retailers);
    }

    /**
     * Canonical form of a retailer identifier supplied by the catalog. Resolved the
     * same way as a shelf store name, so "Walmart Supercenter" and "walmart" agree.
     */
    public String canonicalize(String retailer) {
        return fromStoreName(retailer).orElse("");
    }

    private static Map<String, String> createDomainMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("walmart.com", "walmart");
        map.put("target.com", "target");
        map.put("walgreens.com", "walgreens");
        map.put("cvs.com", "cvs");
        map.put("kroger.com", "kroger");
        map.put("safeway.com", "safeway");
        map.put("albertsons.com", "albertsons");
        map.put("publix.com", "publix");
        map.put("wholefoodsmarket.com", "whole foods");
        map.put("traderjoes.com", "trader joe");
        map.put("costco.com", "costco");
        map.put("samsclub.com", "sam's club");
        map.put("aldi.", "aldi");
        map.put("lidl.", "lidl");
        map.put("foodlion.com", "food lion");
        map.put("giantfood.com", "giant");
        map.put("stopandshop.com", "stop & shop");
        return Collections.unmodifiableMap(map);
    }
}
