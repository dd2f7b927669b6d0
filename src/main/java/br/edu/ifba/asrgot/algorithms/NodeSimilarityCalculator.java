package br.edu.ifba.asrgot.algorithms;

import br.edu.ifba.asrgot.core.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Label similarity between graph nodes.
 *
 * Combines four complementary metrics with configurable weights:
 * - Jaccard similarity (token overlap)
 * - Containment (substring matching)
 * - Levenshtein distance (edit distance)
 * - Abbreviation matching
 *
 * Nodes of different types are never similar.
 */
public class NodeSimilarityCalculator {

    private static final Logger logger = LoggerFactory.getLogger(NodeSimilarityCalculator.class);

    private static final Set<String> STOP_WORDS =
        Set.of("a", "an", "the", "of", "and", "or", "for", "in", "on", "at", "to", "from");

    private final SimilarityWeights weights;

    public NodeSimilarityCalculator(SimilarityWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
    }

    public NodeSimilarityCalculator() {
        this(SimilarityWeights.DEFAULT);
    }

    /**
     * Computes the similarity between two nodes.
     *
     * @throws IllegalArgumentException if either node is null
     */
    public NodeSimilarityScore computeSimilarity(GraphNode first, GraphNode second) {
        if (first == null) {
            throw new IllegalArgumentException("first node cannot be null");
        }
        if (second == null) {
            throw new IllegalArgumentException("second node cannot be null");
        }

        if (first.getType() != second.getType()) {
            return NodeSimilarityScore.none(first.getId(), second.getId());
        }

        String label1 = first.getLabel();
        String label2 = second.getLabel();

        // Labels of very different length rarely describe the same concept
        int maxLen = Math.max(label1.length(), label2.length());
        int minLen = Math.min(label1.length(), label2.length());
        if (minLen > 10 && maxLen > minLen * 5) {
            return NodeSimilarityScore.none(first.getId(), second.getId());
        }

        double jaccard = computeJaccardSimilarity(label1, label2);
        double containment = computeContainmentScore(label1, label2);
        double edit = computeLevenshteinSimilarity(label1, label2);
        double abbreviation = computeAbbreviationScore(label1, label2);

        double finalScore = weights.jaccard() * jaccard
                          + weights.containment() * containment
                          + weights.edit() * edit
                          + weights.abbreviation() * abbreviation;

        if (finalScore > 0.5) {
            logger.debug("Similarity '{}' vs '{}': jaccard={}, containment={}, edit={}, abbr={}, final={}",
                label1, label2, jaccard, containment, edit, abbreviation, finalScore);
        }

        return new NodeSimilarityScore(first.getId(), second.getId(),
            jaccard, containment, edit, abbreviation, finalScore);
    }

    /**
     * |intersection| / |union| of the token sets; 0.0 when either label has no tokens.
     */
    public double computeJaccardSimilarity(String label1, String label2) {
        Set<String> tokens1 = tokenize(label1);
        Set<String> tokens2 = tokenize(label2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(tokens1);
        intersection.retainAll(tokens2);
        Set<String> union = new HashSet<>(tokens1);
        union.addAll(tokens2);
        return (double) intersection.size() / union.size();
    }

    /**
     * 1.0 if one normalized label contains the other, 0.0 otherwise.
     */
    public double computeContainmentScore(String label1, String label2) {
        String normalized1 = normalizeLabel(label1);
        String normalized2 = normalizeLabel(label2);
        if (normalized1.isEmpty() || normalized2.isEmpty()) {
            return 0.0;
        }
        return normalized1.contains(normalized2) || normalized2.contains(normalized1) ? 1.0 : 0.0;
    }

    /**
     * {@code 1 - editDistance / maxLength} over the normalized labels.
     */
    public double computeLevenshteinSimilarity(String label1, String label2) {
        String normalized1 = normalizeLabel(label1);
        String normalized2 = normalizeLabel(label2);
        if (normalized1.equals(normalized2)) {
            return 1.0;
        }
        int maxLength = Math.max(normalized1.length(), normalized2.length());
        int distance = levenshteinDistance(normalized1, normalized2);
        return 1.0 - ((double) distance / maxLength);
    }

    /**
     * 1.0 when the labels are identical or one is the acronym of the other
     * (e.g. "RCT" and "Randomized Controlled Trial").
     */
    public double computeAbbreviationScore(String label1, String label2) {
        String normalized1 = normalizeLabel(label1);
        String normalized2 = normalizeLabel(label2);
        if (normalized1.equals(normalized2)) {
            return 1.0;
        }
        return isAcronymMatch(normalized1, normalized2) || isAcronymMatch(normalized2, normalized1) ? 1.0 : 0.0;
    }

    /**
     * Lowercases, strips punctuation and collapses whitespace.
     */
    public String normalizeLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        return label.replaceAll("[^a-zA-Z0-9\\s]", "")
                    .toLowerCase(Locale.ROOT)
                    .trim()
                    .replaceAll("\\s+", " ");
    }

    public Set<String> tokenize(String label) {
        String normalized = normalizeLabel(label);
        Set<String> result = new HashSet<>();
        if (normalized.isEmpty()) {
            return result;
        }
        for (String token : normalized.split("\\s+")) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }

    private boolean isAcronymMatch(String shortLabel, String longLabel) {
        if (shortLabel.isEmpty() || shortLabel.contains(" ") || shortLabel.length() >= longLabel.length()) {
            return false;
        }
        String[] words = longLabel.split("\\s+");
        if (words.length < 2) {
            return false;
        }
        StringBuilder acronym = new StringBuilder();
        for (String word : words) {
            if (!word.isEmpty() && !STOP_WORDS.contains(word)) {
                acronym.append(word.charAt(0));
            }
        }
        return shortLabel.equals(acronym.toString());
    }

    private int levenshteinDistance(String s1, String s2) {
        int len1 = s1.length();
        int len2 = s2.length();
        if (len1 == 0) return len2;
        if (len2 == 0) return len1;

        int[] previous = new int[len2 + 1];
        int[] current = new int[len2 + 1];
        for (int j = 0; j <= len2; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= len1; i++) {
            current[0] = i;
            for (int j = 1; j <= len2; j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[len2];
    }
}
