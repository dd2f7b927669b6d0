package br.edu.ifba.asrgot.algorithms;

/**
 * Breakdown of the similarity between two node labels.
 */
public record NodeSimilarityScore(
    String firstId,
    String secondId,
    double jaccardScore,
    double containmentScore,
    double editScore,
    double abbreviationScore,
    double finalScore
) {

    static NodeSimilarityScore none(String firstId, String secondId) {
        return new NodeSimilarityScore(firstId, secondId, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public boolean isAbove(double threshold) {
        return finalScore >= threshold;
    }
}
