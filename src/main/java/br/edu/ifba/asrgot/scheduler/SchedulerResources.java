package br.edu.ifba.asrgot.scheduler;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/scheduler")
public class SchedulerResources {

    @Inject
    TaskScheduler scheduler;

    @GET
    @Path("/stats")
    @Produces(MediaType.APPLICATION_JSON)
    public SchedulerStats getStats() {
        return scheduler.getStats();
    }
}
