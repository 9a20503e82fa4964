package org.neuralchilli.flotilla.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.RestResponse;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;
import org.neuralchilli.flotilla.domain.WorkflowStatus;
import org.neuralchilli.flotilla.quota.PoolUsage;
import org.neuralchilli.flotilla.service.HistoryQuery;
import org.neuralchilli.flotilla.service.SubmissionException;
import org.neuralchilli.flotilla.service.TaskView;
import org.neuralchilli.flotilla.service.WorkflowNotFoundException;
import org.neuralchilli.flotilla.service.WorkflowService;
import org.neuralchilli.flotilla.service.WorkflowSummary;
import org.neuralchilli.flotilla.service.WorkflowView;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Path("/api/v1")
@Produces(MediaType.APPLICATION_JSON)
public class WorkflowResource {

    static final String ANONYMOUS = "anonymous";

    @Inject
    WorkflowService workflows;

    /**
     * Submit a workflow definition in YAML
     */
    @POST
    @Path("/workflows")
    @Consumes({"application/yaml", "application/x-yaml", MediaType.TEXT_PLAIN})
    public Response submit(String yaml, @QueryParam("user") @DefaultValue(ANONYMOUS) String user) {
        UUID id = workflows.submitYaml(yaml, user);
        return Response.status(Response.Status.CREATED)
                .entity(Map.of("id", id))
                .build();
    }

    @GET
    @Path("/workflows/{id}")
    public WorkflowView status(@PathParam("id") UUID id) {
        return workflows.getStatus(id);
    }

    @GET
    @Path("/workflows/{id}/attempts")
    public List<TaskView> attempts(@PathParam("id") UUID id) {
        return workflows.getAttempts(id);
    }

    @POST
    @Path("/workflows/{id}/cancel")
    public Map<String, Object> cancel(@PathParam("id") UUID id, @QueryParam("user") @DefaultValue(ANONYMOUS) String user) {
        boolean canceled = workflows.cancel(id, user);
        return Map.of("id", id, "canceled", canceled);
    }

    @DELETE
    @Path("/workflows/{id}")
    public Map<String, Object> delete(@PathParam("id") UUID id, @QueryParam("user") @DefaultValue(ANONYMOUS) String user) {
        return cancel(id, user);
    }

    @GET
    @Path("/workflows")
    public List<WorkflowSummary> history(
            @QueryParam("user") String user,
            @QueryParam("pool") String pool,
            @QueryParam("status") List<String> statuses,
            @QueryParam("since") String since,
            @QueryParam("limit") @DefaultValue("100") int limit
    ) {
        Set<WorkflowStatus> statusFilter = statuses == null ? Set.of() : statuses.stream()
                .map(status -> WorkflowStatus.valueOf(status.trim().toUpperCase()))
                .collect(Collectors.toSet());
        Instant submittedAfter = since == null || since.isBlank() ? null : Instant.parse(since);
        return workflows.getHistory(new HistoryQuery(user, pool, statusFilter, submittedAfter, limit));
    }

    @GET
    @Path("/pools")
    public List<PoolUsage> pools() {
        return workflows.getPoolUsage();
    }

    @GET
    @Path("/pools/{name}")
    public Response pool(@PathParam("name") String name) {
        return workflows.getPoolUsage(name)
                .map(usage -> Response.ok(usage).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(Map.of("error", "Pool not found: " + name))
                        .build());
    }

    @ServerExceptionMapper
    public RestResponse<Map<String, Object>> mapSubmission(SubmissionException e) {
        return RestResponse.status(Response.Status.BAD_REQUEST,
                Map.of("id", e.workflowId(), "status", WorkflowStatus.FAILED_SUBMISSION, "error", e.getMessage()));
    }

    @ServerExceptionMapper
    public RestResponse<Map<String, Object>> mapNotFound(WorkflowNotFoundException e) {
        return RestResponse.status(Response.Status.NOT_FOUND, Map.of("error", e.getMessage()));
    }

    @ServerExceptionMapper
    public RestResponse<Map<String, Object>> mapBadRequest(IllegalArgumentException e) {
        String message = e.getMessage() != null ? e.getMessage() : "Bad request";
        return RestResponse.status(Response.Status.BAD_REQUEST, Map.of("error", message));
    }
}
