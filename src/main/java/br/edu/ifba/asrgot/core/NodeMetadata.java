package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata attached to a {@link GraphNode}.
 *
 * <p>Common fields apply to every node. At most one of the typed detail records is
 * expected to be set, matching the node's {@link NodeType}. {@code extensions} holds
 * free-form tags that do not belong to any typed record.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeMetadata(
    @JsonProperty("stage") int stage,
    @JsonProperty("impact_score") double impactScore,
    @JsonProperty("evidence_count") int evidenceCount,
    @JsonProperty("disciplinary_tags") List<String> disciplinaryTags,
    @JsonProperty("notes") @Nullable String notes,
    @JsonProperty("value") @Nullable String value,
    @JsonProperty("info_metrics") @Nullable InformationMetrics infoMetrics,
    @JsonProperty("hypothesis") @Nullable HypothesisDetails hypothesis,
    @JsonProperty("evidence") @Nullable EvidenceDetails evidence,
    @JsonProperty("audit") @Nullable AuditDetails audit,
    @JsonProperty("synthesis") @Nullable SynthesisDetails synthesis,
    @JsonProperty("knowledge") @Nullable KnowledgeDetails knowledge,
    @JsonProperty("extensions") Map<String, String> extensions,
    @JsonProperty("timestamp") Instant timestamp
) {

    /**
     * Compact constructor with validation.
     */
    public NodeMetadata {
        if (stage < 0 || stage > ResearchStage.LAST) {
            throw new IllegalArgumentException("stage must be in [0, 9], got: " + stage);
        }
        if (impactScore < 0.0 || impactScore > 1.0 || Double.isNaN(impactScore)) {
            throw new IllegalArgumentException("impactScore must be in [0.0, 1.0], got: " + impactScore);
        }
        if (evidenceCount < 0) {
            throw new IllegalArgumentException("evidenceCount must be >= 0, got: " + evidenceCount);
        }
        disciplinaryTags = disciplinaryTags != null ? List.copyOf(disciplinaryTags) : List.of();
        extensions = extensions != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(extensions))
            : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public NodeMetadata withImpactScore(double newImpactScore) {
        return toBuilder().impactScore(newImpactScore).build();
    }

    public NodeMetadata withEvidenceCount(int newEvidenceCount) {
        return toBuilder().evidenceCount(newEvidenceCount).build();
    }

    public NodeMetadata withInfoMetrics(@Nullable InformationMetrics metrics) {
        return toBuilder().infoMetrics(metrics).build();
    }

    /**
     * Merges another node's metadata into this one.
     *
     * <p>Keeps this node's stage, notes and typed details. Takes the maximum impact,
     * sums evidence counts, unions tags (this node's first) and extensions.</p>
     */
    @NotNull
    public NodeMetadata mergeWith(@NotNull NodeMetadata other) {
        Objects.requireNonNull(other, "other must not be null");

        LinkedHashSet<String> tags = new LinkedHashSet<>(disciplinaryTags);
        tags.addAll(other.disciplinaryTags);

        Map<String, String> mergedExtensions = new LinkedHashMap<>(other.extensions);
        mergedExtensions.putAll(extensions);

        return toBuilder()
            .impactScore(Math.max(impactScore, other.impactScore))
            .evidenceCount(evidenceCount + other.evidenceCount)
            .disciplinaryTags(new ArrayList<>(tags))
            .extensions(mergedExtensions)
            .timestamp(Instant.now())
            .build();
    }

    public Builder toBuilder() {
        return new Builder()
            .stage(stage)
            .impactScore(impactScore)
            .evidenceCount(evidenceCount)
            .disciplinaryTags(disciplinaryTags)
            .notes(notes)
            .value(value)
            .infoMetrics(infoMetrics)
            .hypothesis(hypothesis)
            .evidence(evidence)
            .audit(audit)
            .synthesis(synthesis)
            .knowledge(knowledge)
            .extensions(extensions)
            .timestamp(timestamp);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for NodeMetadata instances.
     */
    public static class Builder {
        private int stage;
        private double impactScore;
        private int evidenceCount;
        private List<String> disciplinaryTags = new ArrayList<>();
        private String notes;
        private String value;
        private InformationMetrics infoMetrics;
        private HypothesisDetails hypothesis;
        private EvidenceDetails evidence;
        private AuditDetails audit;
        private SynthesisDetails synthesis;
        private KnowledgeDetails knowledge;
        private Map<String, String> extensions = new LinkedHashMap<>();
        private Instant timestamp;

        public Builder stage(int stage) {
            this.stage = stage;
            return this;
        }

        public Builder impactScore(double impactScore) {
            this.impactScore = impactScore;
            return this;
        }

        public Builder evidenceCount(int evidenceCount) {
            this.evidenceCount = evidenceCount;
            return this;
        }

        public Builder disciplinaryTags(@Nullable List<String> disciplinaryTags) {
            this.disciplinaryTags = disciplinaryTags != null ? new ArrayList<>(disciplinaryTags) : new ArrayList<>();
            return this;
        }

        public Builder addTag(@NotNull String tag) {
            if (!disciplinaryTags.contains(tag)) {
                disciplinaryTags.add(tag);
            }
            return this;
        }

        public Builder notes(@Nullable String notes) {
            this.notes = notes;
            return this;
        }

        public Builder value(@Nullable String value) {
            this.value = value;
            return this;
        }

        public Builder infoMetrics(@Nullable InformationMetrics infoMetrics) {
            this.infoMetrics = infoMetrics;
            return this;
        }

        public Builder hypothesis(@Nullable HypothesisDetails hypothesis) {
            this.hypothesis = hypothesis;
            return this;
        }

        public Builder evidence(@Nullable EvidenceDetails evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder audit(@Nullable AuditDetails audit) {
            this.audit = audit;
            return this;
        }

        public Builder synthesis(@Nullable SynthesisDetails synthesis) {
            this.synthesis = synthesis;
            return this;
        }

        public Builder knowledge(@Nullable KnowledgeDetails knowledge) {
            this.knowledge = knowledge;
            return this;
        }

        public Builder extensions(@Nullable Map<String, String> extensions) {
            this.extensions = extensions != null ? new LinkedHashMap<>(extensions) : new LinkedHashMap<>();
            return this;
        }

        public Builder extension(@NotNull String key, @NotNull String value) {
            this.extensions.put(key, value);
            return this;
        }

        public Builder timestamp(@Nullable Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public NodeMetadata build() {
            return new NodeMetadata(stage, impactScore, evidenceCount, disciplinaryTags, notes, value,
                infoMetrics, hypothesis, evidence, audit, synthesis, knowledge, extensions, timestamp);
        }
    }
}
