package dev.opportunityfeed.service;

import dev.opportunityfeed.config.IngestionConfig;
import dev.opportunityfeed.entity.Opportunity;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Title similarity used by fuzzy deduplication.
 */
@Component
public class TitleSimilarity {

    public static final String LEVENSHTEIN = "levenshtein";
    public static final String TOKEN_OVERLAP = "token-overlap";

    private static final LevenshteinDistance LEVENSHTEIN_DISTANCE = LevenshteinDistance.getDefaultInstance();

    private final String strategy;
    private final double threshold;

    @Autowired
    public TitleSimilarity(IngestionConfig config) {
        this(config.getDedup().getSimilarityStrategy(), config.getDedup().getSimilarityThreshold());
    }

    public TitleSimilarity(String strategy, double threshold) {
        this.strategy = strategy == null ? LEVENSHTEIN : strategy.trim().toLowerCase(Locale.ROOT);
        this.threshold = threshold;
    }

    /**
     * Similarity of two titles in [0,1], case-insensitive.
     */
    public double score(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (TOKEN_OVERLAP.equals(strategy)) {
            return tokenOverlap(left, right);
        }
        return levenshteinRatio(left, right);
    }

    public boolean isSimilar(String a, String b) {
        return score(a, b) >= threshold;
    }

    /**
     * Most similar record to the given title, if it reaches the threshold.
     */
    public Optional<Opportunity> bestMatch(String title, Collection<Opportunity> records) {
        Opportunity best = null;
        double bestScore = -1;
        for (Opportunity record : records) {
            double s = score(title, record.getTitle());
            if (s > bestScore) {
                bestScore = s;
                best = record;
            }
        }
        return bestScore >= threshold ? Optional.ofNullable(best) : Optional.empty();
    }

    static double levenshteinRatio(String a, String b) {
        int maxLength = Math.max(a.length(), b.length());
        int distance = LEVENSHTEIN_DISTANCE.apply(a, b);
        return 1.0 - ((double) distance / maxLength);
    }

    static double tokenOverlap(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.contains(b) || b.contains(a)) {
            return 1.0;
        }
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> common = new HashSet<>(left);
        common.retainAll(right);
        return (double) common.size() / Math.max(left.size(), right.size());
    }

    private static Set<String> tokens(String text) {
        return Arrays.stream(text.split("\\s+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
