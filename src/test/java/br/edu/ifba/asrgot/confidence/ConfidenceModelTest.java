package br.edu.ifba.asrgot.confidence;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EvidenceDetails;
import br.edu.ifba.asrgot.core.EvidenceQuality;
import br.edu.ifba.asrgot.core.InformationMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfidenceModel} and {@link InformationTheory}.
 */
class ConfidenceModelTest {

    private static final double EPSILON = 1e-9;

    private ConfidenceModel model;
    private InformationTheory theory;

    @BeforeEach
    void setUp() {
        model = new ConfidenceModel();
        theory = new InformationTheory();
    }

    // ========================================================================
    // Evidence list aggregation
    // ========================================================================

    @Nested
    @DisplayName("calculateConfidence")
    class CalculateConfidenceTests {

        @Test
        @DisplayName("should return zero for null or empty evidence")
        void shouldReturnZeroForNoEvidence() {
            assertEquals(0.0, model.calculateConfidence(null), EPSILON);
            assertEquals(0.0, model.calculateConfidence(List.of()), EPSILON);
        }

        @Test
        @DisplayName("should add 0.15 per item up to three items")
        void shouldAddPerItem() {
            assertEquals(0.15, model.calculateConfidence(List.of("a")), EPSILON);
            assertEquals(0.30, model.calculateConfidence(List.of("a", "b")), EPSILON);
            assertEquals(0.45, model.calculateConfidence(List.of("a", "b", "c")), EPSILON);
        }

        @Test
        @DisplayName("should add volume bonus above three items")
        void shouldAddVolumeBonus() {
            assertEquals(0.70, model.calculateConfidence(List.of("a", "b", "c", "d")), EPSILON);
        }

        @Test
        @DisplayName("should never exceed 1.0")
        void shouldCapAtOne() {
            assertEquals(1.0, model.calculateConfidence(List.of("1", "2", "3", "4", "5", "6", "7", "8", "9")), EPSILON);
        }

        @Test
        @DisplayName("should ignore null and blank items")
        void shouldIgnoreBlankItems() {
            assertEquals(0.15, model.calculateConfidence(Arrays.asList("study", null, "  ")), EPSILON);
        }
    }

    // ========================================================================
    // Vector handling
    // ========================================================================

    @Nested
    @DisplayName("blend and normalize")
    class VectorTests {

        @Test
        @DisplayName("first evidence item should weigh half")
        void firstEvidenceShouldWeighHalf() {
            ConfidenceVector prior = new ConfidenceVector(0.8, 0.8, 0.8, 0.8);
            ConfidenceVector evidence = new ConfidenceVector(0.4, 0.4, 0.4, 0.4);

            ConfidenceVector blended = model.blend(prior, evidence, 0);

            assertEquals(0.6, blended.empiricalSupport(), EPSILON);
            assertEquals(0.6, blended.consensusAlignment(), EPSILON);
        }

        @Test
        @DisplayName("later evidence should weigh less")
        void laterEvidenceShouldWeighLess() {
            ConfidenceVector prior = new ConfidenceVector(0.9, 0.9, 0.9, 0.9);
            ConfidenceVector evidence = new ConfidenceVector(0.0, 0.0, 0.0, 0.0);

            ConfidenceVector blended = model.blend(prior, evidence, 2);

            assertEquals(0.675, blended.empiricalSupport(), EPSILON);
        }

        @Test
        @DisplayName("should fall back to default for wrong arity")
        void shouldFallBackForWrongArity() {
            assertEquals(ConfidenceVector.DEFAULT, model.normalize(List.of(0.1, 0.2)));
            assertEquals(ConfidenceVector.DEFAULT, model.normalize(null));
            assertEquals(ConfidenceVector.DEFAULT, model.normalize(Arrays.asList(0.1, null, 0.2, 0.3)));
        }

        @Test
        @DisplayName("should clamp out-of-range values")
        void shouldClampValues() {
            ConfidenceVector vector = model.normalize(List.of(1.4, -0.2, 0.5, Double.NaN));

            assertEquals(List.of(1.0, 0.0, 0.5, 0.0), vector.toList());
        }

        @Test
        @DisplayName("should reject out-of-range values on construction")
        void shouldRejectInvalidVector() {
            assertThrows(IllegalArgumentException.class, () -> new ConfidenceVector(1.2, 0.5, 0.5, 0.5));
        }

        @Test
        @DisplayName("average of no vectors should be the default")
        void averageOfNothingIsDefault() {
            assertEquals(ConfidenceVector.DEFAULT, ConfidenceVector.average(List.of()));
        }
    }

    // ========================================================================
    // Information theory
    // ========================================================================

    @Nested
    @DisplayName("InformationTheory")
    class InformationTheoryTests {

        @Test
        @DisplayName("uniform distribution over two outcomes should have one bit of entropy")
        void uniformEntropy() {
            assertEquals(1.0, theory.entropy(new double[] {0.5, 0.5}), EPSILON);
        }

        @Test
        @DisplayName("certain outcome should have zero entropy")
        void certainEntropy() {
            assertEquals(0.0, theory.entropy(new double[] {1.0, 0.0}), EPSILON);
        }

        @Test
        @DisplayName("peer-reviewed evidence should be least complex")
        void peerReviewedComplexity() {
            InformationMetrics reviewed = theory.evidenceMetrics(EvidenceQuality.HIGH, 0.9, EvidenceDetails.PEER_REVIEWED);
            InformationMetrics preprint = theory.evidenceMetrics(EvidenceQuality.HIGH, 0.9, EvidenceDetails.PREPRINT);

            assertEquals(0.5, reviewed.complexity(), EPSILON);
            assertEquals(0.7, preprint.complexity(), EPSILON);
        }

        @Test
        @DisplayName("higher power should yield more information gain")
        void powerIncreasesGain() {
            InformationMetrics strong = theory.evidenceMetrics(EvidenceQuality.HIGH, 0.95, EvidenceDetails.PEER_REVIEWED);
            InformationMetrics weak = theory.evidenceMetrics(EvidenceQuality.LOW, 0.3, EvidenceDetails.PEER_REVIEWED);

            assertTrue(strong.informationGain() > weak.informationGain());
        }

        @Test
        @DisplayName("graph complexity should ignore hyperedges when there are none")
        void graphComplexity() {
            assertEquals(3.0, theory.graphComplexity(3, 1, 0), EPSILON);
            assertEquals(4.0, theory.graphComplexity(3, 1, 1), EPSILON);
        }

        @Test
        @DisplayName("simplifying the graph should give negative information gain")
        void negativeGainOnSimplification() {
            double before = theory.graphComplexity(15, 7, 0);
            double after = theory.graphComplexity(7, 3, 0);

            assertTrue(theory.informationGain(before, after) < 0);
        }
    }
}
