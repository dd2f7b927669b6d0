package br.edu.ifba.asrgot.session;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionCreatedResponse(
        @JsonProperty("session_id") String sessionId
) {
}
