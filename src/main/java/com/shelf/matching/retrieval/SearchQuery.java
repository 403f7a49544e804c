package com.shelf.matching.retrieval;

import com.shelf.matching.core.model.DetectionItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Catalog search request derived from a detection item.
 *
 * @param term       combined search term: known brand, product name and size joined by spaces
 * @param brand      item brand, or null if unknown
 * @param retailer   free-text retailer context, or null if unknown
 * @param maxResults upper bound on candidates the provider should return
 */
public record SearchQuery(String term, String brand, String retailer, int maxResults) {

    public SearchQuery {
        Objects.requireNonNull(term, "term is required");
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }
    }

    /**
     * Builds the query for an item. Attributes that are blank or "Unknown" are left out of the term.
     */
    public static SearchQuery forItem(DetectionItem item, int maxResults) {
        List<String> parts = new ArrayList<>(3);
        if (item.hasBrand()) {
            parts.add(item.brand().trim());
        }
        if (item.hasProductName()) {
            parts.add(item.productName().trim());
        }
        if (item.hasSize()) {
            parts.add(item.size().trim());
        }
        return new SearchQuery(
                String.join(" ", parts),
                item.hasBrand() ? item.brand().trim() : null,
                item.hasRetailerContext() ? item.retailerContext().trim() : null,
                maxResults);
    }

    public boolean isBlank() {
        return term.isBlank();
    }
}
