package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Composition section carried by a synthesis node.
 *
 * @param section   section name
 * @param citations ids of the evidence nodes the section cites
 * @param wordCount target word count proposed for the section
 */
public record SynthesisDetails(
    @JsonProperty("section") String section,
    @JsonProperty("citations") List<String> citations,
    @JsonProperty("word_count") int wordCount
) {
    public SynthesisDetails {
        citations = citations != null ? List.copyOf(citations) : List.of();
    }
}
