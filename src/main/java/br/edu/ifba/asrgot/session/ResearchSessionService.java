package br.edu.ifba.asrgot.session;

import br.edu.ifba.asrgot.core.ApiCredentials;
import br.edu.ifba.asrgot.exception.SessionNotFoundException;
import br.edu.ifba.asrgot.scheduler.TaskScheduler;
import br.edu.ifba.asrgot.stage.StageEngine;
import br.edu.ifba.asrgot.stage.StageSettings;
import br.edu.ifba.asrgot.stage.StageToolkit;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of research sessions, one {@link StageEngine} each.
 *
 * <p>Sessions live until deleted or until the application stops.</p>
 */
@ApplicationScoped
public class ResearchSessionService {

    private static final Logger LOG = Logger.getLogger(ResearchSessionService.class);

    @Inject
    TaskScheduler scheduler;

    @Inject
    StageSettings settings;

    @Inject
    StageToolkit toolkit;

    private final Map<String, StageEngine> sessions = new ConcurrentHashMap<>();

    /**
     * Opens a session.
     *
     * @param credentials       credentials used for every model call of the session
     * @param enforceStageOrder overrides the configured ordering rule when not null
     * @return the new engine
     */
    @NotNull
    public StageEngine create(@NotNull ApiCredentials credentials, @Nullable Boolean enforceStageOrder) {
        String sessionId = UUID.randomUUID().toString();
        StageSettings effective = enforceStageOrder != null
            ? settings.withEnforceStageOrder(enforceStageOrder)
            : settings;

        StageEngine engine = StageEngine.builder()
            .sessionId(sessionId)
            .scheduler(scheduler)
            .credentials(credentials)
            .settings(effective)
            .toolkit(toolkit)
            .build();
        sessions.put(sessionId, engine);
        LOG.infof("Created research session %s (enforceStageOrder=%s)", sessionId, effective.enforceStageOrder());
        return engine;
    }

    /**
     * @throws SessionNotFoundException unknown id
     */
    @NotNull
    public StageEngine get(@NotNull String sessionId) {
        StageEngine engine = sessions.get(sessionId);
        if (engine == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return engine;
    }

    /**
     * @throws SessionNotFoundException unknown id
     */
    public void delete(@NotNull String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new SessionNotFoundException(sessionId);
        }
        LOG.infof("Deleted research session %s", sessionId);
    }

    public int count() {
        return sessions.size();
    }
}
