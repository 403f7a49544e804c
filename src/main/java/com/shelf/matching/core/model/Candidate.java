package com.shelf.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A raw catalog entry returned by the retrieval capability.
 *
 * <p>An empty {@code retailers} list means availability is unknown, which is
 * not the same as "not sold anywhere".</p>
 */
public record Candidate(
        String id,
        String title,
        String brand,
        String manufacturer,
        String measures,
        List<String> retailers,
        String imageUrl
) {
    public Candidate {
        Objects.requireNonNull(id, "id is required");
        retailers = retailers != null ? List.copyOf(retailers) : List.of();
    }

    public boolean hasKnownRetailers() {
        return !retailers.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String title;
        private String brand;
        private String manufacturer;
        private String measures;
        private List<String> retailers;
        private String imageUrl;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder manufacturer(String manufacturer) {
            this.manufacturer = manufacturer;
            return this;
        }

        public Builder measures(String measures) {
            this.measures = measures;
            return this;
        }

        public Builder retailers(List<String> retailers) {
            this.retailers = retailers;
            return this;
        }

        public Builder imageUrl(String imageUrl) {
            this.imageUrl = imageUrl;
            return this;
        }

        public Candidate build() {
            return new Candidate(id, title, brand, manufacturer, measures, retailers, imageUrl);
        }
    }
}
