package br.edu.ifba.asrgot.algorithms;

import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphEdge;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.HyperEdge;
import br.edu.ifba.asrgot.core.HyperEdgeType;
import br.edu.ifba.asrgot.core.NodeType;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives evidence hyperedges from the current graph.
 *
 * <ul>
 *   <li>interdisciplinary: evidence nodes sharing a disciplinary tag (at least two), confidence 0.7</li>
 *   <li>multi_causal: a hypothesis with at least two evidence nodes linked from it, confidence 0.8</li>
 *   <li>complex_relationship: at least three evidence nodes whose mean confidence exceeds 0.8, confidence 0.85</li>
 * </ul>
 *
 * Ids are deterministic so rebuilding over the same graph yields the same hyperedges.
 */
public class HyperedgeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(HyperedgeBuilder.class);

    public static final double INTERDISCIPLINARY_CONFIDENCE = 0.7;
    public static final double MULTI_CAUSAL_CONFIDENCE = 0.8;
    public static final double COMPLEX_CONFIDENCE = 0.85;
    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.8;
    public static final int COMPLEX_MIN_NODES = 3;

    private static final Set<HyperEdgeType> DERIVED_TYPES = EnumSet.of(
        HyperEdgeType.INTERDISCIPLINARY, HyperEdgeType.MULTI_CAUSAL, HyperEdgeType.COMPLEX_RELATIONSHIP);

    @NotNull
    public List<HyperEdge> build(@NotNull GraphDocument graph) {
        List<GraphNode> evidence = graph.nodesOfType(NodeType.EVIDENCE);
        List<HyperEdge> result = new ArrayList<>();
        result.addAll(interdisciplinary(evidence));
        result.addAll(multiCausal(graph, evidence));
        HyperEdge complex = complexRelationship(evidence);
        if (complex != null) {
            result.add(complex);
        }
        return result;
    }

    /**
     * Replaces the derived hyperedges of the graph with a fresh build. Hyperedges of other
     * types (synthesis) are kept.
     *
     * @return the derived hyperedges now present in the graph
     */
    @NotNull
    public List<HyperEdge> rebuild(@NotNull GraphDocument graph) {
        List<HyperEdge> derived = build(graph);
        List<HyperEdge> kept = new ArrayList<>();
        for (HyperEdge hyperedge : graph.getHyperedges()) {
            if (!DERIVED_TYPES.contains(hyperedge.type())) {
                kept.add(hyperedge);
            }
        }
        kept.addAll(derived);
        graph.replaceHyperedges(kept);
        logger.debug("Rebuilt {} evidence hyperedges", derived.size());
        return derived;
    }

    private List<HyperEdge> interdisciplinary(List<GraphNode> evidence) {
        Map<String, List<String>> byTag = new LinkedHashMap<>();
        for (GraphNode node : evidence) {
            for (String tag : node.getMetadata().disciplinaryTags()) {
                byTag.computeIfAbsent(tag, k -> new ArrayList<>()).add(node.getId());
            }
        }

        List<HyperEdge> result = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : byTag.entrySet()) {
            if (entry.getValue().size() < 2) {
                continue;
            }
            result.add(new HyperEdge(
                "hyper_interdisciplinary_" + slug(entry.getKey()),
                entry.getValue(),
                HyperEdgeType.INTERDISCIPLINARY,
                "Interdisciplinary connection in " + entry.getKey(),
                INTERDISCIPLINARY_CONFIDENCE));
        }
        return result;
    }

    private List<HyperEdge> multiCausal(GraphDocument graph, List<GraphNode> evidence) {
        Set<String> evidenceIds = new HashSet<>();
        for (GraphNode node : evidence) {
            evidenceIds.add(node.getId());
        }

        List<HyperEdge> result = new ArrayList<>();
        for (GraphNode hypothesis : graph.nodesOfType(NodeType.HYPOTHESIS)) {
            List<String> members = new ArrayList<>();
            members.add(hypothesis.getId());
            for (GraphEdge edge : graph.getEdges()) {
                if (edge.source().equals(hypothesis.getId())
                        && evidenceIds.contains(edge.target())
                        && !members.contains(edge.target())) {
                    members.add(edge.target());
                }
            }
            if (members.size() - 1 >= 2) {
                result.add(new HyperEdge(
                    "hyper_causal_" + hypothesis.getId(),
                    members,
                    HyperEdgeType.MULTI_CAUSAL,
                    "Multiple evidence sources supporting " + hypothesis.getLabel(),
                    MULTI_CAUSAL_CONFIDENCE));
            }
        }
        return result;
    }

    private HyperEdge complexRelationship(List<GraphNode> evidence) {
        List<String> strong = new ArrayList<>();
        for (GraphNode node : evidence) {
            if (node.getConfidence().mean() > HIGH_CONFIDENCE_THRESHOLD) {
                strong.add(node.getId());
            }
        }
        if (strong.size() < COMPLEX_MIN_NODES) {
            return null;
        }
        return new HyperEdge(
            "hyper_complex_evidence",
            strong,
            HyperEdgeType.COMPLEX_RELATIONSHIP,
            "High-confidence evidence cluster",
            COMPLEX_CONFIDENCE);
    }

    private static String slug(String tag) {
        return tag.toLowerCase(Locale.ROOT).trim().replaceAll("[^a-z0-9]+", "_").replaceAll("^_|_$", "");
    }
}
