package br.edu.ifba.asrgot.stage;

import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.ResearchContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Values that stages hand to later stages outside the graph itself.
 *
 * <p>Owned by one engine. Handlers receive a copy and the engine keeps it only when the
 * stage succeeds.</p>
 */
public final class SessionState {

    private ResearchContext researchContext;
    private GraphDocument extractedSubgraph;
    private String composition;
    private String audit;
    private String finalReport;
    private boolean knowledgeSeeded;

    public SessionState() {
        this.researchContext = ResearchContext.empty();
    }

    @NotNull
    public ResearchContext getResearchContext() {
        return researchContext;
    }

    public void setResearchContext(@NotNull ResearchContext researchContext) {
        this.researchContext = Objects.requireNonNull(researchContext, "researchContext must not be null");
    }

    /**
     * Subgraph selected by stage 6, consumed by stage 7.
     */
    @NotNull
    public Optional<GraphDocument> getExtractedSubgraph() {
        return Optional.ofNullable(extractedSubgraph);
    }

    public void setExtractedSubgraph(@Nullable GraphDocument extractedSubgraph) {
        this.extractedSubgraph = extractedSubgraph;
    }

    /**
     * Model text of the stage 7 composition.
     */
    @NotNull
    public Optional<String> getComposition() {
        return Optional.ofNullable(composition);
    }

    public void setComposition(@Nullable String composition) {
        this.composition = composition;
    }

    /**
     * Model text of the stage 8 audit.
     */
    @NotNull
    public Optional<String> getAudit() {
        return Optional.ofNullable(audit);
    }

    public void setAudit(@Nullable String audit) {
        this.audit = audit;
    }

    @NotNull
    public Optional<String> getFinalReport() {
        return Optional.ofNullable(finalReport);
    }

    public void setFinalReport(@Nullable String finalReport) {
        this.finalReport = finalReport;
    }

    public boolean isKnowledgeSeeded() {
        return knowledgeSeeded;
    }

    public void markKnowledgeSeeded() {
        this.knowledgeSeeded = true;
    }

    @NotNull
    public SessionState copy() {
        SessionState copy = new SessionState();
        copy.researchContext = researchContext;
        copy.extractedSubgraph = extractedSubgraph != null ? extractedSubgraph.copy() : null;
        copy.composition = composition;
        copy.audit = audit;
        copy.finalReport = finalReport;
        copy.knowledgeSeeded = knowledgeSeeded;
        return copy;
    }
}
