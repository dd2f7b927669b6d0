package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The nine ordered steps of the reasoning pipeline.
 */
public enum ResearchStage {
    INITIALIZATION(1, "Initialization"),
    DECOMPOSITION(2, "Decomposition"),
    HYPOTHESIS_GENERATION(3, "Hypothesis/Planning"),
    EVIDENCE_INTEGRATION(4, "Evidence Integration"),
    PRUNING_MERGING(5, "Pruning/Merging"),
    SUBGRAPH_EXTRACTION(6, "Subgraph Extraction"),
    COMPOSITION(7, "Composition"),
    REFLECTION(8, "Reflection"),
    FINAL_SYNTHESIS(9, "Final Synthesis");

    public static final int FIRST = 1;
    public static final int LAST = 9;

    private final int number;
    private final String displayName;

    ResearchStage(int number, String displayName) {
        this.number = number;
        this.displayName = displayName;
    }

    @JsonValue
    public int getNumber() {
        return number;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static boolean isValid(int number) {
        return number >= FIRST && number <= LAST;
    }

    /**
     * @throws IllegalArgumentException if {@code number} is outside 1..9
     */
    public static ResearchStage of(int number) {
        if (!isValid(number)) {
            throw new IllegalArgumentException("Invalid stage number: " + number);
        }
        return values()[number - 1];
    }
}
