package com.shelf.matching.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A single product detected on a shelf image, with the text attributes
 * extracted for it upstream and a handle to its cropped reference image.
 *
 * <p>Attributes that are blank or carry the extraction sentinel {@code "Unknown"}
 * are treated as absent by every consumer; use {@link #isKnown(String)} rather
 * than null checks.</p>
 */
public record DetectionItem(
        String id,
        String brand,
        String productName,
        String size,
        Double sizeConfidence,
        String retailerContext,
        String referenceImage
) {
    private static final String UNKNOWN = "unknown";

    public DetectionItem {
        Objects.requireNonNull(id, "id is required");
        if (sizeConfidence != null && (sizeConfidence < 0.0 || sizeConfidence > 1.0)) {
            throw new IllegalArgumentException("sizeConfidence must be between 0.0 and 1.0");
        }
    }

    /**
     * Returns true if the value carries usable information.
     */
    public static boolean isKnown(String value) {
        return value != null && !value.isBlank() && !UNKNOWN.equals(value.trim().toLowerCase(Locale.ROOT));
    }

    public boolean hasBrand() {
        return isKnown(brand);
    }

    public boolean hasProductName() {
        return isKnown(productName);
    }

    public boolean hasSize() {
        return isKnown(size);
    }

    public boolean hasRetailerContext() {
        return isKnown(retailerContext);
    }

    public boolean hasReferenceImage() {
        return referenceImage != null && !referenceImage.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String brand;
        private String productName;
        private String size;
        private Double sizeConfidence;
        private String retailerContext;
        private String referenceImage;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder productName(String productName) {
            this.productName = productName;
            return this;
        }

        public Builder size(String size) {
            this.size = size;
            return this;
        }

        public Builder sizeConfidence(Double sizeConfidence) {
            this.sizeConfidence = sizeConfidence;
            return this;
        }

        public Builder retailerContext(String retailerContext) {
            this.retailerContext = retailerContext;
            return this;
        }

        public Builder referenceImage(String referenceImage) {
            this.referenceImage = referenceImage;
            return this;
        }

        public DetectionItem build() {
            return new DetectionItem(id, brand, productName, size, sizeConfidence,
                    retailerContext, referenceImage);
        }
    }
}
