package br.edu.ifba.asrgot.report;

import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.StageContext;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Renders the final research report from the session graph.
 */
public interface ReportExporter {

    /**
     * @param graph     committed graph at the start of stage 9
     * @param context   research context of the session
     * @param history   stage contexts recorded so far
     * @param narrative report text written by the model
     * @return the rendered report
     */
    @NotNull
    String export(@NotNull GraphDocument graph,
                  @NotNull ResearchContext context,
                  @NotNull List<StageContext> history,
                  @NotNull String narrative);

    /**
     * Media type of the rendered report.
     */
    @NotNull
    String getMediaType();
}
