package br.edu.ifba.asrgot.extraction;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EdgeType;
import br.edu.ifba.asrgot.core.EvidenceDetails;
import br.edu.ifba.asrgot.core.EvidenceQuality;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicTextSignalExtractorTest {

    private final HeuristicTextSignalExtractor extractor = new HeuristicTextSignalExtractor();

    @Nested
    @DisplayName("research context")
    class ResearchContextTests {

        @Test
        @DisplayName("field is read from a field marker and stops at punctuation")
        void extractsFieldFromMarker() {
            assertEquals("Neuroscience", extractor.extractField("Primary field: Neuroscience, with links to psychology"));
        }

        @Test
        @DisplayName("missing or blank text falls back to the default field")
        void defaultField() {
            assertEquals(TextSignalExtractor.DEFAULT_FIELD, extractor.extractField(null));
            assertEquals(TextSignalExtractor.DEFAULT_FIELD, extractor.extractField("   "));
            assertEquals(TextSignalExtractor.DEFAULT_FIELD, extractor.extractField("nothing relevant here"));
        }

        @Test
        @DisplayName("comma separated objectives are split")
        void commaSeparatedObjectives() {
            List<String> objectives = extractor.extractObjectives("Objectives: map pathways, measure recall");

            assertEquals(List.of("map pathways", "measure recall"), objectives);
        }

        @Test
        @DisplayName("bulleted objectives are split by line")
        void bulletedObjectives() {
            List<String> objectives = extractor.extractObjectives("Objectives:\n- First aim\n- Second aim");

            assertEquals(List.of("First aim", "Second aim"), objectives);
        }

        @Test
        @DisplayName("no objectives marker yields the default objectives")
        void defaultObjectives() {
            assertEquals(TextSignalExtractor.DEFAULT_OBJECTIVES, extractor.extractObjectives(""));
            assertEquals(TextSignalExtractor.DEFAULT_OBJECTIVES, extractor.extractObjectives("free text"));
        }

        @Test
        void dimensionContent() {
            assertEquals("memory in adults",
                extractor.extractDimensionContent("Scope: memory in adults\n\nOther notes", "Scope", "Neuroscience"));
            assertEquals("Scope analysis for Neuroscience research context",
                extractor.extractDimensionContent(null, "Scope", "Neuroscience"));
        }
    }

    @Nested
    @DisplayName("hypotheses")
    class HypothesisTests {

        private static final String ANALYSIS = """
            Hypothesis 1: Sleep improves recall
            A randomized controlled trial supports it.
            Falsification criteria 1: No recall difference after sleep
            Hypothesis 2: Naps help too
            Case study only.
            """;

        @Test
        void extractsHypothesisStatement() {
            assertEquals("Naps help too", extractor.extractHypothesisContent(ANALYSIS, 2, "Neuroscience"));
        }

        @Test
        void hypothesisFallback() {
            assertEquals("Hypothesis 3 for Neuroscience research context",
                extractor.extractHypothesisContent(ANALYSIS, 3, "Neuroscience"));
        }

        @Test
        void extractsFalsificationCriteria() {
            assertEquals("No recall difference after sleep",
                extractor.extractFalsificationCriteria(ANALYSIS, 1, "Neuroscience"));
            assertEquals("Specific testable criteria for Hypothesis 2 in Neuroscience research context",
                extractor.extractFalsificationCriteria(ANALYSIS, 2, "Neuroscience"));
        }

        @Test
        @DisplayName("a section ends at the next numbered heading")
        void sectionStopsAtNextHypothesis() {
            Optional<String> section = extractor.extractSection(ANALYSIS, "Hypothesis 1");

            assertTrue(section.isPresent());
            assertTrue(section.get().startsWith("Sleep improves recall"));
            assertTrue(section.get().contains("randomized controlled trial"));
            assertFalse(section.get().contains("Naps help too"));
        }

        @Test
        void missingSectionIsEmpty() {
            assertTrue(extractor.extractSection(ANALYSIS, "Hypothesis 7").isEmpty());
            assertTrue(extractor.extractSection(null, "Hypothesis 1").isEmpty());
        }

        @Test
        void markdownSections() {
            String text = "## Methods\nDouble-blind design\n## Results\nStrong effect";

            assertEquals(Optional.of("Double-blind design"), extractor.extractSection(text, "Methods"));
        }
    }

    @Nested
    @DisplayName("confidence signals")
    class ConfidenceTests {

        @Test
        @DisplayName("blank text parses to the default vector")
        void defaultVector() {
            assertEquals(ConfidenceVector.DEFAULT, extractor.parseConfidenceVector(null));
            assertEquals(ConfidenceVector.DEFAULT, extractor.parseConfidenceVector("   "));
            assertEquals(List.of(0.8, 0.7, 0.9, 0.6), extractor.parseConfidenceVector("").toList());
        }

        @Test
        @DisplayName("strong study design raises empirical support")
        void empiricalSupportKeywords() {
            assertEquals(0.95, extractor.extractEmpiricalSupport("A meta-analysis found p < 0.001"), 1e-9);
            assertEquals(0.3, extractor.extractEmpiricalSupport("a single case study"), 1e-9);
        }

        @Test
        void consensusKeywords() {
            assertEquals(0.75, extractor.extractConsensusAlignment("This is the scientific consensus"), 1e-9);
            assertEquals(0.3, extractor.extractConsensusAlignment("The claim is controversial"), 1e-9);
        }

        @Test
        void vectorStaysInUnitRange() {
            ConfidenceVector vector = extractor.parseConfidenceVector(
                "meta-analysis large sample p < 0.001 scientific consensus widely accepted expert agreement "
                    + "replicated findings multiple studies confirm rigorous methodology double-blind "
                    + "validated measures controlled for confounders well-established theory innovative");

            for (double value : vector.toArray()) {
                assertTrue(value >= 0.0 && value <= 1.0);
            }
            assertEquals(1.0, vector.consensusAlignment(), 1e-9);
        }

        @Test
        @DisplayName("identical text always yields the identical vector")
        void deterministic() {
            String text = "A cohort study with potential bias, widely accepted";

            assertEquals(extractor.parseConfidenceVector(text), extractor.parseConfidenceVector(text));
        }
    }

    @Nested
    @DisplayName("statistical power")
    class StatisticalPowerTests {

        @Test
        void explicitPowerWins() {
            assertEquals(0.92, extractor.extractStatisticalPower("Statistical power: 0.92 with a case study"), 1e-9);
        }

        @Test
        void blankTextUsesDefault() {
            assertEquals(TextSignalExtractor.DEFAULT_STATISTICAL_POWER, extractor.extractStatisticalPower(null), 1e-9);
        }

        @Test
        void designAndSampleSize() {
            assertEquals(0.85, extractor.extractStatisticalPower(
                "A randomized controlled trial with sample size: 1200"), 1e-9);
            assertEquals(0.3, extractor.extractStatisticalPower("An anecdotal report"), 1e-9);
        }

        @Test
        @DisplayName("a sentence-final period does not discard an explicit power")
        void explicitPowerBeforePunctuation() {
            assertEquals(0.85, extractor.extractStatisticalPower("The study reports statistical power: 0.85."), 1e-9);
            assertEquals(0.85, extractor.extractStatisticalPower("(statistical power: 0.85)"), 1e-9);
            assertEquals(0.85, extractor.extractStatisticalPower("statistical power: 0.85, which is adequate"), 1e-9);
        }

        @Test
        @DisplayName("p-values followed by punctuation still count")
        void pValueBeforePunctuation() {
            assertEquals(0.65, extractor.extractStatisticalPower("The effect held at p < 0.001."), 1e-9);
            assertEquals(0.65, extractor.extractStatisticalPower("The effect held (p < 0.001)"), 1e-9);
            assertEquals(0.4, extractor.extractStatisticalPower("Reported p-value: 0.2, not significant"), 1e-9);
        }

        @Test
        void effectSizeBeforePunctuation() {
            assertEquals(0.65, extractor.extractStatisticalPower("Large effect size: 0.9."), 1e-9);
            assertEquals(0.75, extractor.extractStatisticalPower("effect size: 0.9, p-value: 0.03)"), 1e-9);
        }

        @Test
        void sampleSizeBeforePunctuation() {
            assertEquals(0.7, extractor.extractStatisticalPower("Sample size: 1,200."), 1e-9);
            assertEquals(0.6, extractor.extractStatisticalPower("(sample size: 150)"), 1e-9);
            assertEquals(0.3, extractor.extractStatisticalPower("sample size: 12, too small"), 1e-9);
        }

        @Test
        void qualityFollowsPower() {
            assertEquals(EvidenceQuality.HIGH, extractor.assessEvidenceQuality("statistical power: 0.9"));
            assertEquals(EvidenceQuality.MEDIUM, extractor.assessEvidenceQuality("statistical power: 0.7"));
            assertEquals(EvidenceQuality.LOW, extractor.assessEvidenceQuality("statistical power: 0.4"));
        }
    }

    @Nested
    @DisplayName("evidence classification")
    class ClassificationTests {

        @Test
        void peerReviewStatus() {
            assertEquals(EvidenceDetails.PEER_REVIEWED, extractor.detectPeerReviewStatus("Published in Nature"));
            assertEquals(EvidenceDetails.PREPRINT, extractor.detectPeerReviewStatus("An arXiv preprint"));
            assertEquals(EvidenceDetails.UNKNOWN, extractor.detectPeerReviewStatus("a blog post"));
            assertEquals(EvidenceDetails.UNKNOWN, extractor.detectPeerReviewStatus(null));
        }

        @Test
        @DisplayName("causal markers take precedence over correlation")
        void relationTypes() {
            assertEquals(Optional.of(EdgeType.CAUSAL),
                extractor.detectRelationType("a correlation, but also a direct causal link"));
            assertEquals(Optional.of(EdgeType.CONTRADICTORY), extractor.detectRelationType("This contradicts H1"));
            assertEquals(Optional.of(EdgeType.CORRELATIVE), extractor.detectRelationType("a weak correlation"));
            assertEquals(Optional.of(EdgeType.TEMPORAL), extractor.detectRelationType("exposure precedes onset"));
            assertTrue(extractor.detectRelationType("no relation words").isEmpty());
        }
    }
}
