package com.flow.mapper.service.translate;

import com.flow.mapper.service.model.ProcessNode;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether two step labels describe the same step.
 *
 * Exact: equal after lower-casing and collapsing whitespace. Fuzzy: the two
 * labels share at least {@code minSharedTokens} words and the shared words
 * make up at least {@code minOverlapRatio} of the shorter label.
 */
public class LabelSimilarity {

    public static final int DEFAULT_MIN_SHARED_TOKENS = 3;
    public static final double DEFAULT_MIN_OVERLAP_RATIO = 0.7;

    private final int minSharedTokens;
    private final double minOverlapRatio;

    public LabelSimilarity() {
        this(DEFAULT_MIN_SHARED_TOKENS, DEFAULT_MIN_OVERLAP_RATIO);
    }

    public LabelSimilarity(int minSharedTokens, double minOverlapRatio) {
        if (minSharedTokens < 1) {
            throw new IllegalArgumentException("minSharedTokens must be positive: " + minSharedTokens);
        }
        if (minOverlapRatio <= 0 || minOverlapRatio > 1) {
            throw new IllegalArgumentException("minOverlapRatio must be in (0, 1]: " + minOverlapRatio);
        }
        this.minSharedTokens = minSharedTokens;
        this.minOverlapRatio = minOverlapRatio;
    }

    public static String normalize(String label) {
        if (label == null) {
            return "";
        }
        return label.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public boolean isExactMatch(String first, String second) {
        var left = normalize(first);
        return !left.isEmpty() && left.equals(normalize(second));
    }

    public boolean isFuzzyMatch(String first, String second) {
        Set<String> left = tokens(first);
        Set<String> right = tokens(second);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }

        var shared = new HashSet<>(left);
        shared.retainAll(right);
        int shorter = Math.min(left.size(), right.size());
        return shared.size() >= minSharedTokens
                && (double) shared.size() / shorter >= minOverlapRatio;
    }

    public boolean matches(String first, String second) {
        return isExactMatch(first, second) || isFuzzyMatch(first, second);
    }

    /**
     * Exact matches win over fuzzy ones; within each kind the first node in order wins.
     */
    public Optional<ProcessNode> findMatch(String label, Collection<ProcessNode> candidates) {
        var exact = candidates.stream()
                .filter(node -> isExactMatch(label, node.getLabel()))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return candidates.stream()
                .filter(node -> isFuzzyMatch(label, node.getLabel()))
                .findFirst();
    }

    static Set<String> tokens(String label) {
        var normalized = normalize(label);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" "))
                .collect(Collectors.toSet());
    }
}
