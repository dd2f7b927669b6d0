package br.edu.ifba.asrgot.confidence;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.GraphNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * Computes, blends and normalizes confidence values.
 *
 * <p>Stateless and thread-safe.</p>
 */
public class ConfidenceModel {

    /** Confidence contributed by each non-blank evidence item. */
    public static final double PER_ITEM_INCREMENT = 0.15;

    /** Ceiling of the per-item contribution. */
    public static final double ITEM_CAP = 0.9;

    /** Bonus once more than {@link #BONUS_THRESHOLD} items are present. */
    public static final double VOLUME_BONUS = 0.1;

    public static final int BONUS_THRESHOLD = 3;

    /**
     * Aggregate confidence from a list of evidence texts.
     *
     * <p>Null and blank items are ignored. The score is
     * {@code min(n * 0.15, 0.9) + (n > 3 ? 0.1 : 0)}, capped at 1.0; an empty list yields 0.</p>
     *
     * @param evidence evidence texts, may be null
     * @return confidence in [0.0, 1.0]
     */
    public double calculateConfidence(@Nullable List<String> evidence) {
        if (evidence == null || evidence.isEmpty()) {
            return 0.0;
        }
        long count = evidence.stream()
            .filter(item -> item != null && !item.isBlank())
            .count();
        if (count == 0) {
            return 0.0;
        }
        double base = Math.min(count * PER_ITEM_INCREMENT, ITEM_CAP);
        double bonus = count > BONUS_THRESHOLD ? VOLUME_BONUS : 0.0;
        return Math.min(1.0, base + bonus);
    }

    /**
     * Blends a prior vector with the vector derived from a new piece of evidence.
     *
     * <p>The prior counts as one observation plus {@code priorEvidenceCount} earlier
     * evidence items, so the first evidence item weighs 0.5, the second 1/3, and so on.</p>
     */
    @NotNull
    public ConfidenceVector blend(@NotNull ConfidenceVector prior, @NotNull ConfidenceVector evidence,
                                  int priorEvidenceCount) {
        double weight = 1.0 / (Math.max(0, priorEvidenceCount) + 2);
        return prior.blend(evidence, weight);
    }

    /**
     * Turns raw values into a valid vector.
     *
     * <p>Anything other than exactly four values yields {@link ConfidenceVector#DEFAULT};
     * out-of-range values are clamped and NaN becomes 0.</p>
     */
    @NotNull
    public ConfidenceVector normalize(@Nullable List<Double> raw) {
        if (raw == null || raw.size() != ConfidenceVector.DIMENSIONS) {
            return ConfidenceVector.DEFAULT;
        }
        for (Double value : raw) {
            if (value == null) {
                return ConfidenceVector.DEFAULT;
            }
        }
        return ConfidenceVector.clamped(raw.get(0), raw.get(1), raw.get(2), raw.get(3));
    }

    /**
     * Mean over the nodes' mean confidence; 0 for no nodes.
     */
    public double aggregate(@NotNull Collection<GraphNode> nodes) {
        if (nodes.isEmpty()) {
            return 0.0;
        }
        return nodes.stream()
            .mapToDouble(node -> node.getConfidence().mean())
            .average()
            .orElse(0.0);
    }
}
