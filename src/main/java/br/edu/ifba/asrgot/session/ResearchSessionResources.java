package br.edu.ifba.asrgot.session;

import java.net.URI;
import java.util.List;

import br.edu.ifba.asrgot.core.ApiCredentials;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.StageContext;
import br.edu.ifba.asrgot.core.StageResult;
import br.edu.ifba.asrgot.stage.StageEngine;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

@Path("/sessions")
public class ResearchSessionResources {

    private static final Logger LOG = Logger.getLogger(ResearchSessionResources.class);

    private static final String MARKDOWN = "text/markdown";

    @Inject
    ResearchSessionService sessionService;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response create(@Valid final SessionCreateRequest request) {
        final ApiCredentials credentials = request == null
                ? ApiCredentials.NONE
                : new ApiCredentials(request.geminiApiKey(), request.perplexityApiKey(), request.openaiApiKey());
        final StageEngine engine = sessionService.create(credentials,
                request != null ? request.enforceStageOrder() : null);

        return Response.created(URI.create("/sessions/" + engine.getSessionId()))
                .entity(new SessionCreatedResponse(engine.getSessionId()))
                .build();
    }

    @POST
    @Path("/{id}/stages/{stage}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public StageResult executeStage(@PathParam("id") final String id,
                                    @PathParam("stage") final int stage,
                                    @Valid final StageExecuteRequest request) {
        final StageEngine engine = sessionService.get(id);
        LOG.debugf("Executing stage %d of session %s", stage, id);
        return engine.executeStage(stage, request != null ? request.query() : null);
    }

    @GET
    @Path("/{id}/graph")
    @Produces(MediaType.APPLICATION_JSON)
    public GraphDocument getGraph(@PathParam("id") final String id) {
        return sessionService.get(id).getGraphData();
    }

    @GET
    @Path("/{id}/stages")
    @Produces(MediaType.APPLICATION_JSON)
    public List<StageResult> getStageResults(@PathParam("id") final String id) {
        return sessionService.get(id).getStageResults();
    }

    @GET
    @Path("/{id}/contexts")
    @Produces(MediaType.APPLICATION_JSON)
    public List<StageContext> getStageContexts(@PathParam("id") final String id) {
        return sessionService.get(id).getStageContexts();
    }

    @GET
    @Path("/{id}/report")
    @Produces(MARKDOWN)
    public String getReport(@PathParam("id") final String id) {
        return sessionService.get(id).getFinalReport()
                .orElseThrow(() -> new NotFoundException("Final report not available for session " + id));
    }

    @DELETE
    @Path("/{id}")
    public Response delete(@PathParam("id") final String id) {
        sessionService.delete(id);
        return Response.noContent().build();
    }
}
