package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StageStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    StageStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
