package com.shelf.matching.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal, immutable decision for one detection item.
 *
 * <ul>
 *   <li>{@link MatchOutcome#AUTO_SAVED}: exactly one {@code selectedCandidate} and a {@code selectionMethod}</li>
 *   <li>{@link MatchOutcome#NEEDS_MANUAL_REVIEW}: no selection, the competing candidates in {@code alternatives}</li>
 *   <li>{@link MatchOutcome#NO_MATCH}: nothing selected, nothing retained</li>
 *   <li>{@link MatchOutcome#ERROR}: nothing selected, {@code failureKind} set</li>
 * </ul>
 */
public record MatchDecision(
        MatchOutcome outcome,
        ClassifiedCandidate selectedCandidate,
        SelectionMethod selectionMethod,
        List<ClassifiedCandidate> alternatives,
        FailureKind failureKind,
        String reason
) {
    public MatchDecision {
        Objects.requireNonNull(outcome, "outcome is required");
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
        reason = reason != null ? reason : "";

        boolean autoSaved = outcome == MatchOutcome.AUTO_SAVED;
        if (autoSaved != (selectedCandidate != null)) {
            throw new IllegalArgumentException("selectedCandidate must be set exactly when outcome is AUTO_SAVED");
        }
        if (autoSaved != (selectionMethod != null)) {
            throw new IllegalArgumentException("selectionMethod must be set exactly when outcome is AUTO_SAVED");
        }
        if (outcome != MatchOutcome.NEEDS_MANUAL_REVIEW && !alternatives.isEmpty()) {
            throw new IllegalArgumentException("alternatives are only retained for NEEDS_MANUAL_REVIEW");
        }
        if ((outcome == MatchOutcome.ERROR) != (failureKind != null)) {
            throw new IllegalArgumentException("failureKind must be set exactly when outcome is ERROR");
        }
    }

    public static MatchDecision autoSaved(ClassifiedCandidate selected, SelectionMethod method, String reason) {
        Objects.requireNonNull(selected, "selected is required");
        Objects.requireNonNull(method, "method is required");
        return new MatchDecision(MatchOutcome.AUTO_SAVED, selected, method, List.of(), null, reason);
    }

    public static MatchDecision manualReview(List<ClassifiedCandidate> alternatives, String reason) {
        return new MatchDecision(MatchOutcome.NEEDS_MANUAL_REVIEW, null, null, alternatives, null, reason);
    }

    public static MatchDecision noMatch(String reason) {
        return new MatchDecision(MatchOutcome.NO_MATCH, null, null, List.of(), null, reason);
    }

    public static MatchDecision error(FailureKind kind, String reason) {
        Objects.requireNonNull(kind, "kind is required");
        return new MatchDecision(MatchOutcome.ERROR, null, null, List.of(), kind, reason);
    }

    public Optional<ClassifiedCandidate> selected() {
        return Optional.ofNullable(selectedCandidate);
    }

    public boolean isAutoSaved() {
        return outcome == MatchOutcome.AUTO_SAVED;
    }

    public boolean needsReview() {
        return outcome == MatchOutcome.NEEDS_MANUAL_REVIEW;
    }

    public boolean isError() {
        return outcome == MatchOutcome.ERROR;
    }
}
