package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse quality grade assigned to an evidence node.
 */
public enum EvidenceQuality {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    EvidenceQuality(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Grades a statistical power value: above 0.8 is high, above 0.6 medium, anything else low.
     */
    public static EvidenceQuality fromPower(double statisticalPower) {
        if (statisticalPower > 0.8) {
            return HIGH;
        }
        if (statisticalPower > 0.6) {
            return MEDIUM;
        }
        return LOW;
    }
}
