package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;

/**
 * Four-dimensional confidence assigned to every graph node.
 *
 * <p>Dimensions, in serialization order:</p>
 * <ol>
 *   <li>empirical support</li>
 *   <li>theoretical basis</li>
 *   <li>methodological rigor</li>
 *   <li>consensus alignment</li>
 * </ol>
 *
 * <p>Serialized as a plain JSON array of four numbers, e.g. {@code [0.8, 0.7, 0.9, 0.6]}.</p>
 *
 * @param empiricalSupport    support from observed data [0.0, 1.0]
 * @param theoreticalBasis    grounding in established theory [0.0, 1.0]
 * @param methodologicalRigor quality of the underlying methods [0.0, 1.0]
 * @param consensusAlignment  agreement with the scientific community [0.0, 1.0]
 */
public record ConfidenceVector(
    double empiricalSupport,
    double theoreticalBasis,
    double methodologicalRigor,
    double consensusAlignment
) {

    /** Number of dimensions. */
    public static final int DIMENSIONS = 4;

    /** Fallback vector used when no signal can be extracted. */
    public static final ConfidenceVector DEFAULT = new ConfidenceVector(0.8, 0.7, 0.9, 0.6);

    /** Vector used for seeded knowledge nodes. */
    public static final ConfidenceVector CERTAIN = new ConfidenceVector(1.0, 1.0, 1.0, 1.0);

    /**
     * Compact constructor with validation.
     */
    public ConfidenceVector {
        requireUnit("empiricalSupport", empiricalSupport);
        requireUnit("theoreticalBasis", theoreticalBasis);
        requireUnit("methodologicalRigor", methodologicalRigor);
        requireUnit("consensusAlignment", consensusAlignment);
    }

    /**
     * Creates a vector, clamping each value into [0.0, 1.0].
     */
    public static ConfidenceVector clamped(double empirical, double theoretical, double methodological, double consensus) {
        return new ConfidenceVector(clamp(empirical), clamp(theoretical), clamp(methodological), clamp(consensus));
    }

    /**
     * Creates a vector from a four-element array.
     *
     * @throws IllegalArgumentException if the array is null or not of length 4
     */
    @JsonCreator
    public static ConfidenceVector of(double[] values) {
        if (values == null || values.length != DIMENSIONS) {
            throw new IllegalArgumentException("Confidence vector must have exactly " + DIMENSIONS + " values");
        }
        return new ConfidenceVector(values[0], values[1], values[2], values[3]);
    }

    /**
     * Arithmetic mean of a collection of vectors, dimension by dimension.
     * Returns {@link #DEFAULT} for an empty collection.
     */
    @NotNull
    public static ConfidenceVector average(@NotNull Collection<ConfidenceVector> vectors) {
        if (vectors.isEmpty()) {
            return DEFAULT;
        }
        double e = 0, t = 0, m = 0, c = 0;
        for (ConfidenceVector v : vectors) {
            e += v.empiricalSupport;
            t += v.theoreticalBasis;
            m += v.methodologicalRigor;
            c += v.consensusAlignment;
        }
        int n = vectors.size();
        return clamped(e / n, t / n, m / n, c / n);
    }

    /**
     * Blends this vector with another.
     *
     * @param other  vector to blend in
     * @param weight weight given to {@code other} [0.0, 1.0]
     * @return {@code (1 - weight) * this + weight * other}
     */
    @NotNull
    public ConfidenceVector blend(@NotNull ConfidenceVector other, double weight) {
        double w = clamp(weight);
        return clamped(
            (1 - w) * empiricalSupport + w * other.empiricalSupport,
            (1 - w) * theoreticalBasis + w * other.theoreticalBasis,
            (1 - w) * methodologicalRigor + w * other.methodologicalRigor,
            (1 - w) * consensusAlignment + w * other.consensusAlignment
        );
    }

    /**
     * Mean over the four dimensions.
     */
    public double mean() {
        return (empiricalSupport + theoreticalBasis + methodologicalRigor + consensusAlignment) / DIMENSIONS;
    }

    /**
     * Value of the dimension at {@code index} (0-based).
     */
    public double get(int index) {
        return switch (index) {
            case 0 -> empiricalSupport;
            case 1 -> theoreticalBasis;
            case 2 -> methodologicalRigor;
            case 3 -> consensusAlignment;
            default -> throw new IndexOutOfBoundsException("Confidence dimension out of range: " + index);
        };
    }

    @JsonValue
    public double[] toArray() {
        return new double[] {empiricalSupport, theoreticalBasis, methodologicalRigor, consensusAlignment};
    }

    public List<Double> toList() {
        return List.of(empiricalSupport, theoreticalBasis, methodologicalRigor, consensusAlignment);
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, value));
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0.0, 1.0], got: " + value);
        }
    }
}
