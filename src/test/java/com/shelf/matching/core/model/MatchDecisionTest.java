package com.shelf.matching.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Core model Tests")
class MatchDecisionTest {

    private static ClassifiedCandidate candidate(String id) {
        return new ClassifiedCandidate(
                new ScoredCandidate(Candidate.builder().id(id).build(), 0.9, 0, List.of()),
                MatchStatus.IDENTICAL, 0.9, 0.9, null);
    }

    @Nested
    @DisplayName("MatchDecision")
    class DecisionTests {

        @Test
        @DisplayName("Auto-saved carries selection and method")
        void autoSaved() {
            MatchDecision decision = MatchDecision.autoSaved(candidate("a"), SelectionMethod.AUTO_SELECT, "ok");

            assertTrue(decision.isAutoSaved());
            assertEquals("a", decision.selected().orElseThrow().candidateId());
            assertNull(decision.failureKind());
        }

        @Test
        @DisplayName("Error carries its failure kind and nothing else")
        void error() {
            MatchDecision decision = MatchDecision.error(FailureKind.TIMEOUT, "too slow");

            assertTrue(decision.isError());
            assertEquals(FailureKind.TIMEOUT, decision.failureKind());
            assertTrue(decision.selected().isEmpty());
            assertTrue(decision.alternatives().isEmpty());
        }

        @Test
        @DisplayName("Inconsistent combinations are rejected")
        void inconsistentRejected() {
            ClassifiedCandidate c = candidate("a");
            assertThrows(IllegalArgumentException.class,
                    () -> new MatchDecision(MatchOutcome.AUTO_SAVED, c, null, List.of(), null, "x"));
            assertThrows(IllegalArgumentException.class,
                    () -> new MatchDecision(MatchOutcome.NO_MATCH, c, SelectionMethod.AUTO_SELECT, List.of(), null, "x"));
            assertThrows(IllegalArgumentException.class,
                    () -> new MatchDecision(MatchOutcome.NO_MATCH, null, null, List.of(c), null, "x"));
            assertThrows(IllegalArgumentException.class,
                    () -> new MatchDecision(MatchOutcome.ERROR, null, null, List.of(), null, "x"));
            assertThrows(IllegalArgumentException.class,
                    () -> new MatchDecision(MatchOutcome.NO_MATCH, null, null, List.of(), FailureKind.INTERNAL, "x"));
        }

        @Test
        @DisplayName("Null reason becomes empty")
        void nullReason() {
            assertEquals("", MatchDecision.noMatch(null).reason());
        }
    }

    @Nested
    @DisplayName("DetectionItem")
    class DetectionItemTests {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"  ", "Unknown", "UNKNOWN", " unknown "})
        @DisplayName("Blank and sentinel values are not known")
        void notKnown(String value) {
            assertFalse(DetectionItem.isKnown(value));
        }

        @Test
        @DisplayName("Real values are known")
        void known() {
            DetectionItem item = DetectionItem.builder().id("1").brand("Secret").size("Unknown").build();

            assertTrue(item.hasBrand());
            assertFalse(item.hasSize());
            assertFalse(item.hasReferenceImage());
        }

        @Test
        @DisplayName("Size confidence must be a unit-interval value")
        void sizeConfidenceValidated() {
            assertThrows(IllegalArgumentException.class,
                    () -> DetectionItem.builder().id("1").sizeConfidence(1.5).build());
        }
    }

    @Nested
    @DisplayName("MatchStatus")
    class MatchStatusTests {

        @ParameterizedTest
        @CsvSource({
                "identical, IDENTICAL",
                "almost_same, ALMOST_SAME",
                "ALMOST-SAME, ALMOST_SAME",
                "' not_match ', NOT_MATCH"
        })
        @DisplayName("Wire values parse leniently")
        void fromWire(String wire, MatchStatus expected) {
            assertEquals(expected, MatchStatus.fromWire(wire));
        }

        @Test
        @DisplayName("Unknown wire values are rejected")
        void unknownRejected() {
            assertThrows(IllegalArgumentException.class, () -> MatchStatus.fromWire("maybe"));
            assertThrows(IllegalArgumentException.class, () -> MatchStatus.fromWire(""));
        }
    }

    @Test
    @DisplayName("Scores are clamped into the unit interval")
    void scoresClamped() {
        assertEquals(0.0, Scores.clamp(-0.5));
        assertEquals(1.0, Scores.clamp(3.0));
        assertEquals(0.0, Scores.clamp(Double.NaN));

        ClassifiedCandidate c = new ClassifiedCandidate(
                new ScoredCandidate(Candidate.builder().id("a").build(), 1.7, 0, null),
                MatchStatus.NOT_MATCH, -1.0, 2.0, null);
        assertEquals(1.0, c.scored().similarityScore());
        assertEquals(0.0, c.confidence());
        assertEquals(1.0, c.visualSimilarity());
        assertEquals("", c.reasoning());
    }
}
