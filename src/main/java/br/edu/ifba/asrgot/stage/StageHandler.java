package br.edu.ifba.asrgot.stage;

import br.edu.ifba.asrgot.core.ResearchStage;
import org.jetbrains.annotations.NotNull;

/**
 * Logic of a single pipeline stage.
 *
 * <p>A handler reads and writes only through the {@link StageExecution} it is given. The
 * execution holds copies of the session graph and state; the engine commits them when
 * {@link #execute(StageExecution)} returns and discards them when it throws.</p>
 *
 * <p>Handlers keep no per-session state and may be shared between engines.</p>
 */
public interface StageHandler {

    /**
     * The stage this handler implements.
     */
    @NotNull
    ResearchStage getStage();

    /**
     * Runs the stage against the execution's working copies.
     *
     * @param execution working graph, session state and model access for this run
     * @return summary content, the nodes created or updated, and stage-specific figures
     */
    @NotNull
    StageOutcome execute(@NotNull StageExecution execution);

    /**
     * Returns the name of this stage for logging.
     */
    default String getName() {
        return getStage().getDisplayName();
    }
}
