package com.shelf.matching.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelf.matching.core.model.ClassifiedCandidate;
import com.shelf.matching.core.model.MatchStatus;
import com.shelf.matching.core.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns the JSON verdict of a visual classifier into a {@link ClassifiedCandidate}.
 *
 * <p>Expected payload, optionally wrapped in a Markdown {@code ```json} fence:</p>
 * <pre>
 * {"matchStatus": "almost_same", "confidence": 0.9, "visualSimilarity": 0.85, "reason": "..."}
 * </pre>
 * <p>Numbers are clamped into [0, 1]; a missing {@code visualSimilarity} or
 * {@code confidence} reads as 0. A missing or unrecognized {@code matchStatus}
 * is a {@link ClassificationException}.</p>
 */
public class ClassificationResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ClassificationResponseParser.class);

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public ClassificationResponseParser() {
        this(new ObjectMapper());
    }

    public ClassificationResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    /**
     * Parses one classifier answer for the given candidate.
     */
    public ClassifiedCandidate parse(ScoredCandidate candidate, String payload) {
        Objects.requireNonNull(candidate, "candidate is required");
        if (payload == null || payload.isBlank()) {
            throw new ClassificationException("Empty classifier response for candidate " + candidate.candidateId());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripFence(payload));
        } catch (JsonProcessingException e) {
            throw new ClassificationException(
                    "Malformed classifier response for candidate " + candidate.candidateId(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ClassificationException("Classifier response is not a JSON object for candidate "
                    + candidate.candidateId());
        }

        MatchStatus status;
        try {
            status = MatchStatus.fromWire(root.path("matchStatus").asText(null));
        } catch (IllegalArgumentException e) {
            throw new ClassificationException("Unknown matchStatus '" + root.path("matchStatus").asText("")
                    + "' for candidate " + candidate.candidateId(), e);
        }

        double confidence = root.path("confidence").asDouble(0.0);
        double visualSimilarity = root.path("visualSimilarity").asDouble(0.0);
        String reason = root.hasNonNull("reason")
                ? root.get("reason").asText()
                : root.path("reasoning").asText("");

        log.debug("classification.parsed candidateId={} status={} confidence={} visualSimilarity={}",
                candidate.candidateId(), status.wireName(), confidence, visualSimilarity);
        return new ClassifiedCandidate(candidate, status, confidence, visualSimilarity, reason);
    }

    static String stripFence(String payload) {
        String text = payload.trim();
        if (text.startsWith(JSON_FENCE)) {
            text = text.substring(JSON_FENCE.length());
        } else if (text.startsWith(FENCE)) {
            text = text.substring(FENCE.length());
        }
        if (text.endsWith(FENCE)) {
            text = text.substring(0, text.length() - FENCE.length());
        }
        return text.trim();
    }
}
