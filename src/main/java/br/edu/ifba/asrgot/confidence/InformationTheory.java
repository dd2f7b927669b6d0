package br.edu.ifba.asrgot.confidence;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EvidenceDetails;
import br.edu.ifba.asrgot.core.EvidenceQuality;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.InformationMetrics;
import org.jetbrains.annotations.NotNull;

/**
 * Shannon-style scores for nodes, evidence and whole graphs. All logarithms are base 2.
 */
public class InformationTheory {

    private static final double LN_2 = Math.log(2.0);

    /** Graph size assumed when a node is scored in isolation. */
    public static final int DEFAULT_GRAPH_SIZE = 10;

    /**
     * Shannon entropy {@code -Σ p log2 p} of a distribution. Values are normalized by
     * their sum first; an empty or all-zero distribution has entropy 0.
     */
    public double entropy(@NotNull double[] probabilities) {
        double sum = 0.0;
        for (double p : probabilities) {
            sum += p;
        }
        if (sum <= 0.0) {
            return 0.0;
        }
        double entropy = 0.0;
        for (double p : probabilities) {
            double normalized = p / sum;
            if (normalized > 0) {
                entropy -= normalized * log2(normalized);
            }
        }
        return entropy;
    }

    /**
     * Metrics for an evidence item.
     *
     * <ul>
     *   <li>entropy of the quality distribution (high [0.8, 0.15, 0.05], medium [0.3, 0.6, 0.1],
     *       low [0.1, 0.3, 0.6])</li>
     *   <li>information gain {@code -log2(1 - power + 0.01)}</li>
     *   <li>complexity 0.5 when peer-reviewed, 0.7 for a preprint, 1.0 otherwise</li>
     * </ul>
     */
    @NotNull
    public InformationMetrics evidenceMetrics(@NotNull EvidenceQuality quality, double statisticalPower,
                                              String peerReviewStatus) {
        double[] distribution = switch (quality) {
            case HIGH -> new double[] {0.8, 0.15, 0.05};
            case MEDIUM -> new double[] {0.3, 0.6, 0.1};
            case LOW -> new double[] {0.1, 0.3, 0.6};
        };
        double power = ConfidenceVector.clamp(statisticalPower);
        double gain = -log2(1.0 - power + 0.01);
        double complexity;
        if (EvidenceDetails.PEER_REVIEWED.equals(peerReviewStatus)) {
            complexity = 0.5;
        } else if (EvidenceDetails.PREPRINT.equals(peerReviewStatus)) {
            complexity = 0.7;
        } else {
            complexity = 1.0;
        }
        return new InformationMetrics(entropy(distribution), complexity, gain);
    }

    /**
     * Metrics for a node given its confidence, its connection count and the graph size.
     *
     * <p>entropy of the confidence vector, gain {@code log2(size / (connections + 1))},
     * complexity {@code log2(4) + log2(connections + 1)}.</p>
     */
    @NotNull
    public InformationMetrics nodeMetrics(@NotNull ConfidenceVector confidence, int connections, int graphSize) {
        int size = graphSize > 0 ? graphSize : DEFAULT_GRAPH_SIZE;
        int links = Math.max(0, connections);
        double entropy = entropy(confidence.toArray());
        double gain = log2((double) size / (links + 1));
        double complexity = log2(ConfidenceVector.DIMENSIONS) + log2(links + 1);
        return new InformationMetrics(entropy, complexity, gain);
    }

    /**
     * {@code log2(n + 1) + log2(e + 1)}, plus {@code log2(h + 1)} when there are hyperedges.
     */
    public double graphComplexity(int nodeCount, int edgeCount, int hyperedgeCount) {
        double basic = log2(nodeCount + 1) + log2(edgeCount + 1);
        double hyper = hyperedgeCount > 0 ? log2(hyperedgeCount + 1) : 0.0;
        return basic + hyper;
    }

    public double graphComplexity(@NotNull GraphDocument graph) {
        return graphComplexity(graph.nodeCount(), graph.edgeCount(), graph.hyperedgeCount());
    }

    /**
     * Information gained by going from one graph state to another, measured as the change
     * in structural complexity. Negative when the graph was simplified.
     */
    public double informationGain(double complexityBefore, double complexityAfter) {
        return complexityAfter - complexityBefore;
    }

    private static double log2(double value) {
        return Math.log(value) / LN_2;
    }
}
