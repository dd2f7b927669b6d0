package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Relation spanning two or more nodes.
 *
 * @param id         unique id
 * @param nodes      member node ids, at least two
 * @param type       hyperedge label
 * @param label      human-readable description
 * @param confidence single confidence for the whole relation
 */
public record HyperEdge(
    @JsonProperty("id") String id,
    @JsonProperty("nodes") List<String> nodes,
    @JsonProperty("type") HyperEdgeType type,
    @JsonProperty("label") String label,
    @JsonProperty("confidence") double confidence
) {

    public HyperEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (nodes == null || nodes.size() < 2) {
            throw new IllegalArgumentException("Hyperedge " + id + " must reference at least 2 nodes");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0.0, 1.0], got: " + confidence);
        }
        nodes = List.copyOf(nodes);
        label = label != null ? label : type.getValue();
    }

    /**
     * Redirects member {@code from} to {@code to}, dropping duplicates.
     *
     * @return the redirected hyperedge, or {@code null} when fewer than two distinct members remain
     */
    public HyperEdge redirect(@NotNull String from, @NotNull String to) {
        if (!nodes.contains(from)) {
            return this;
        }
        LinkedHashSet<String> members = new LinkedHashSet<>();
        for (String member : nodes) {
            members.add(member.equals(from) ? to : member);
        }
        if (members.size() < 2) {
            return null;
        }
        return new HyperEdge(id, new ArrayList<>(members), type, label, confidence);
    }
}
