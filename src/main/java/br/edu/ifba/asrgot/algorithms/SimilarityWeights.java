package br.edu.ifba.asrgot.algorithms;

/**
 * Weights of the four label similarity metrics. Must sum to 1.0.
 *
 * @param jaccard      token overlap
 * @param containment  one label contains the other
 * @param edit         normalized Levenshtein similarity
 * @param abbreviation one label is an acronym of the other
 */
public record SimilarityWeights(double jaccard, double containment, double edit, double abbreviation) {

    public static final SimilarityWeights DEFAULT = new SimilarityWeights(0.35, 0.25, 0.30, 0.10);

    public SimilarityWeights {
        double sum = jaccard + containment + edit + abbreviation;
        if (Math.abs(sum - 1.0) > 0.01) {
            throw new IllegalArgumentException(
                String.format("Similarity weights must sum to 1.0, got %.3f", sum));
        }
    }
}
