package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Evidence-specific node metadata.
 *
 * @param statisticalPower estimated statistical power [0.0, 1.0]
 * @param quality          graded evidence quality
 * @param peerReviewStatus "peer-reviewed", "preprint" or "unknown"
 * @param hypothesisId     id of the hypothesis this evidence was gathered for
 */
public record EvidenceDetails(
    @JsonProperty("statistical_power") double statisticalPower,
    @JsonProperty("quality") EvidenceQuality quality,
    @JsonProperty("peer_review_status") String peerReviewStatus,
    @JsonProperty("hypothesis_id") String hypothesisId
) {
    public static final String PEER_REVIEWED = "peer-reviewed";
    public static final String PREPRINT = "preprint";
    public static final String UNKNOWN = "unknown";
}
