package br.edu.ifba.asrgot.stage;

import br.edu.ifba.asrgot.core.GraphNode;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a handler reports back to the engine.
 *
 * @param content         Markdown summary of the stage
 * @param touchedNodes    nodes the stage created or updated; their aggregate confidence
 *                        becomes the stage confidence score
 * @param figures         stage-specific numbers
 */
public record StageOutcome(
    String content,
    List<GraphNode> touchedNodes,
    Map<String, Number> figures
) {

    public StageOutcome {
        content = content != null ? content : "";
        touchedNodes = touchedNodes != null ? List.copyOf(touchedNodes) : List.of();
        figures = figures != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(figures))
            : Map.of();
    }

    @NotNull
    public static StageOutcome of(@NotNull String content, @NotNull List<GraphNode> touchedNodes) {
        return new StageOutcome(content, touchedNodes, Map.of());
    }
}
