package com.shelf.matching.similarity;

import com.shelf.matching.rules.TextField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TieredStringSimilarity Tests")
class TieredStringSimilarityTest {

    private final TieredStringSimilarity similarity = new TieredStringSimilarity();

    @Test
    @DisplayName("Exact match after normalization scores 1.0")
    void exactMatch() {
        assertEquals(1.0, similarity.compute("Coca-Cola", "coca-cola"));
        assertEquals(1.0, similarity.compute("Procter & Gamble, Inc.", "PROCTER & GAMBLE"));
    }

    @Test
    @DisplayName("Containment in either direction scores 0.8")
    void containment() {
        assertEquals(0.8, similarity.compute("Secret", "Secret Clinical Strength"));
        assertEquals(0.8, similarity.compute("Secret Clinical Strength", "Secret"));
    }

    @ParameterizedTest
    @DisplayName("Word overlap scores 0.5 + 0.3 * shared / longer word count")
    @CsvSource(delimiter = '|', value = {
            "Secret Clinical Strength|Secret Invisible Solid Deodorant|0.575",
            "Tom & Jerry|Ben & Jerry|0.6",
            "Nature Valley Crunchy|Crunchy Nature Valley|0.8"
    })
    void wordOverlap(String a, String b, double expected) {
        assertEquals(expected, similarity.compute(a, b), 1e-9);
    }

    @Test
    @DisplayName("Words of two characters or fewer never count as shared")
    void shortWordsIgnored() {
        assertEquals(0.0, similarity.compute("Bag of Chips", "Box of Nails"));
    }

    @Test
    @DisplayName("Unrelated or missing text scores 0")
    void noMatch() {
        assertEquals(0.0, similarity.compute("Dove", "Axe Body Spray"));
        assertEquals(0.0, similarity.compute(null, "Dove"));
        assertEquals(0.0, similarity.compute("Dove", ""));
    }

    @Test
    @DisplayName("Scores are symmetric and within the documented tiers")
    void symmetricAndBounded() {
        String[] values = {"Secret", "Secret Clinical", "Dove Men+Care", "Men Care", "Old Spice", "Spice Girls"};
        for (String a : values) {
            for (String b : values) {
                double ab = similarity.compute(a, b);
                assertEquals(ab, similarity.compute(b, a), 1e-12, a + " vs " + b);
                assertTrue(ab == 0.0 || (ab >= 0.5 && ab <= 1.0), a + " vs " + b + " = " + ab);
            }
        }
    }

    @Test
    @DisplayName("forField applies the rules of the other field")
    void forField() {
        TieredStringSimilarity title = similarity.forField(TextField.TITLE);
        assertEquals(1.0, similarity.compute("Acme Inc", "Acme"));
        assertEquals(0.8, title.compute("Acme Inc", "Acme"));
    }
}
