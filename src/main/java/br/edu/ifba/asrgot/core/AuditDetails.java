package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of the reflection audit.
 *
 * @param passed               true when the audit found no critical issue
 * @param issues               critical issues found
 * @param qualityImprovements  suggested improvements
 */
public record AuditDetails(
    @JsonProperty("passed") boolean passed,
    @JsonProperty("issues") List<String> issues,
    @JsonProperty("quality_improvements") List<String> qualityImprovements
) {
    public AuditDetails {
        issues = issues != null ? List.copyOf(issues) : List.of();
        qualityImprovements = qualityImprovements != null ? List.copyOf(qualityImprovements) : List.of();
    }
}
