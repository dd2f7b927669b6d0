package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Information-theoretic scores attached to a node.
 *
 * @param entropy         Shannon entropy in bits
 * @param complexity      structural complexity score
 * @param informationGain bits of information contributed
 */
public record InformationMetrics(
    @JsonProperty("entropy") double entropy,
    @JsonProperty("complexity") double complexity,
    @JsonProperty("information_gain") double informationGain
) {
}
