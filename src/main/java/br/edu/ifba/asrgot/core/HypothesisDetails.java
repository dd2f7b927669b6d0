package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hypothesis-specific node metadata.
 *
 * @param falsificationCriteria testable criteria that would refute the hypothesis
 * @param dimensionId           id of the dimension node the hypothesis was generated for
 */
public record HypothesisDetails(
    @JsonProperty("falsification_criteria") String falsificationCriteria,
    @JsonProperty("dimension_id") String dimensionId
) {
}
