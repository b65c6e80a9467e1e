package com.listing.reconciliation.rest;

import com.listing.reconciliation.api.ChangeFilter;
import com.listing.reconciliation.api.Page;
import com.listing.reconciliation.api.PageRequest;
import com.listing.reconciliation.api.ReconciliationService;
import com.listing.reconciliation.apply.ApplyResult;
import com.listing.reconciliation.core.model.Change;
import com.listing.reconciliation.core.model.ChangeStatus;
import com.listing.reconciliation.core.model.ChangeType;
import com.listing.reconciliation.core.model.ComparisonSession;
import com.listing.reconciliation.core.model.ExtractionMetadata;
import com.listing.reconciliation.core.model.ExtractionType;
import com.listing.reconciliation.rest.dto.ApplyRequest;
import com.listing.reconciliation.rest.dto.BuildSessionRequest;
import com.listing.reconciliation.rest.dto.ChangeResponse;
import com.listing.reconciliation.rest.dto.ChangeStatusRequest;
import com.listing.reconciliation.rest.dto.ErrorResponse;
import com.listing.reconciliation.rest.dto.ListingResponse;
import com.listing.reconciliation.rest.dto.MarkForDeletionRequest;
import com.listing.reconciliation.rest.dto.ResolveMissingReferenceRequest;
import com.listing.reconciliation.rest.dto.SessionResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * REST resource for the price-list review workflow.
 *
 * <p>Provides endpoints for:</p>
 * <ul>
 *   <li>Building comparison sessions and reading their changes</li>
 *   <li>Reviewing and applying changes</li>
 *   <li>Resolving missing taxonomy references</li>
 *   <li>Finding and staging unmapped listings</li>
 * </ul>
 */
@Path("/api/v1/reconciliation")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Listing Reconciliation", description = "Compare price lists with listings and review the resulting changes")
public class ReconciliationResource {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationResource.class);
    private static final String BASE = "/api/v1/reconciliation";
    private static final int MAX_PAGE_SIZE = 500;

    private final ReconciliationService service;

    @Inject
    public ReconciliationResource(ReconciliationService service) {
        this.service = service;
    }

    /**
     * POST /api/v1/reconciliation/sessions
     */
    @POST
    @Path("/sessions")
    @Operation(summary = "Build a comparison session",
            description = "Classifies the extracted candidates against the seller's listings and stores the changes for review.")
    @APIResponse(responseCode = "201", description = "Session built")
    @APIResponse(responseCode = "400", description = "Invalid request")
    @APIResponse(responseCode = "500", description = "Session could not be persisted; retry the extraction")
    public Response buildSession(BuildSessionRequest request) {
        String path = BASE + "/sessions";
        try {
            ExtractionType extractionType = request.extractionType() != null && !request.extractionType().isBlank()
                    ? ExtractionType.valueOf(request.extractionType().trim().toUpperCase(Locale.ROOT))
                    : ExtractionType.UPDATE;
            ExtractionMetadata metadata = request.extractionMetadata() != null
                    ? request.extractionMetadata() : ExtractionMetadata.none();
            ComparisonSession session = service.buildSession(request.candidates(), request.sellerId(),
                    request.sessionName(), extractionType, metadata);
            return Response.status(Response.Status.CREATED).entity(SessionResponse.from(session)).build();
        } catch (Exception e) {
            return error(e, path);
        }
    }

    /**
     * GET /api/v1/reconciliation/sessions?sellerId=...
     */
    @GET
    @Path("/sessions")
    @Operation(summary = "List sessions", description = "Returns the seller's sessions, newest first.")
    public Response listSessions(@QueryParam("sellerId") String sellerId) {
        try {
            List<SessionResponse> sessions = service.listSessions(sellerId).stream()
                    .map(SessionResponse::from)
                    .toList();
            return Response.ok(sessions).build();
        } catch (Exception e) {
            return error(e, BASE + "/sessions");
        }
    }

    /**
     * GET /api/v1/reconciliation/sessions/{id}
     */
    @GET
    @Path("/sessions/{id}")
    @Operation(summary = "Get session", description = "Retrieves a session with its summary counts.")
    @APIResponse(responseCode = "200", description = "Session found")
    @APIResponse(responseCode = "404", description = "Session not found")
    public Response getSession(@Parameter(description = "Session ID") @PathParam("id") String sessionId) {
        try {
            return Response.ok(SessionResponse.from(service.getSession(sessionId))).build();
        } catch (Exception e) {
            return error(e, BASE + "/sessions/" + sessionId);
        }
    }

    /**
     * GET /api/v1/reconciliation/sessions/{id}/changes?type=update&amp;status=pending&amp;page=0&amp;size=50
     */
    @GET
    @Path("/sessions/{id}/changes")
    @Operation(summary = "List changes",
            description = "Returns the session's changes ordered by type and extraction order, optionally filtered.")
    @APIResponse(responseCode = "200", description = "Changes returned")
    @APIResponse(responseCode = "404", description = "Session not found")
    @APIResponse(responseCode = "409", description = "Session did not complete")
    public Response listChanges(@Parameter(description = "Session ID") @PathParam("id") String sessionId,
                                @QueryParam("type") List<String> types,
                                @QueryParam("status") List<String> statuses,
                                @QueryParam("page") @DefaultValue("0") int page,
                                @QueryParam("size") @DefaultValue("50") int size) {
        String path = BASE + "/sessions/" + sessionId + "/changes";
        try {
            ChangeFilter filter = new ChangeFilter(parseTypes(types), parseStatuses(statuses));
            Page<Change> changes = service.listChanges(sessionId, filter,
                    PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE)));
            Page<ChangeResponse> body = new Page<>(
                    changes.content().stream().map(ChangeResponse::from).toList(),
                    changes.totalElements(), changes.pageNumber(), changes.pageSize());
            return Response.ok(body).build();
        } catch (Exception e) {
            return error(e, path);
        }
    }

    /**
     * GET /api/v1/reconciliation/sessions/{id}/progress
     */
    @GET
    @Path("/sessions/{id}/progress")
    @Operation(summary = "Review progress", description = "Counts the session's changes per review status.")
    public Response progress(@Parameter(description = "Session ID") @PathParam("id") String sessionId) {
        try {
            Map<String, Long> counts = new LinkedHashMap<>();
            service.countByStatus(sessionId).forEach((status, count) -> counts.put(status.wireName(), count));
            return Response.ok(counts).build();
        } catch (Exception e) {
            return error(e, BASE + "/sessions/" + sessionId + "/progress");
        }
    }

    /**
     * POST /api/v1/reconciliation/changes/{id}/status
     */
    @POST
    @Path("/changes/{id}/status")
    @Operation(summary = "Set change status",
            description = "Approves, rejects or discards a change. Changes are applied through the apply endpoint.")
    @APIResponse(responseCode = "200", description = "Status changed")
    @APIResponse(responseCode = "400", description = "Unknown status")
    @APIResponse(responseCode = "404", description = "Change not found")
    @APIResponse(responseCode = "409", description = "Transition not allowed")
    public Response setChangeStatus(@Parameter(description = "Change ID") @PathParam("id") String changeId,
                                    ChangeStatusRequest request) {
        String path = BASE + "/changes/" + changeId + "/status";
        try {
            ChangeStatus status = ChangeStatus.fromWireName(request.status());
            Change change = service.setChangeStatus(changeId, status, request.notes(), request.reviewerId());
            return Response.ok(ChangeResponse.from(change)).build();
        } catch (Exception e) {
            return error(e, path);
        }
    }

    /**
     * POST /api/v1/reconciliation/sessions/{id}/apply
     */
    @POST
    @Path("/sessions/{id}/apply")
    @Operation(summary = "Apply selected changes",
            description = "Applies the selected creates, updates and deletes and discards every other open change. "
                    + "Per-change failures are reported in the result and do not abort the batch.")
    @APIResponse(responseCode = "200", description = "Apply attempted; see failures")
    @APIResponse(responseCode = "404", description = "Session not found")
    @APIResponse(responseCode = "409", description = "Session did not complete")
    public Response applySelected(@Parameter(description = "Session ID") @PathParam("id") String sessionId,
                                  ApplyRequest request) {
        try {
            ApplyResult result = service.applySelected(sessionId, request.changeIds(), request.appliedBy());
            return Response.ok(result).build();
        } catch (Exception e) {
            return error(e, BASE + "/sessions/" + sessionId + "/apply");
        }
    }

    /**
     * POST /api/v1/reconciliation/missing-references/resolve?sessionId=...
     */
    @POST
    @Path("/missing-references/resolve")
    @Operation(summary = "Resolve missing references",
            description = "Re-classifies pending missing-reference changes as creates once the model exists. "
                    + "Optionally registers the model first.")
    @APIResponse(responseCode = "200", description = "Ids of the re-classified changes")
    @APIResponse(responseCode = "400", description = "Invalid make or model")
    public Response resolveMissingReference(@QueryParam("sessionId") String sessionId,
                                            ResolveMissingReferenceRequest request) {
        String path = BASE + "/missing-references/resolve";
        try {
            String scope = sessionId != null && !sessionId.isBlank() ? sessionId : null;
            List<String> changeIds = request.register()
                    ? service.registerMissingModel(scope, request.makeId(), request.modelName())
                    : service.resolveMissingReference(scope, request.makeId(), request.modelName());
            return Response.ok(Map.of("resolvedChangeIds", changeIds)).build();
        } catch (Exception e) {
            return error(e, path);
        }
    }

    /**
     * GET /api/v1/reconciliation/sessions/{id}/unmapped?sellerId=...
     */
    @GET
    @Path("/sessions/{id}/unmapped")
    @Operation(summary = "Find unmapped listings",
            description = "Returns the seller's listings no update, delete or unchanged change of the session refers to.")
    public Response findUnmapped(@Parameter(description = "Session ID") @PathParam("id") String sessionId,
                                 @QueryParam("sellerId") String sellerId) {
        String path = BASE + "/sessions/" + sessionId + "/unmapped";
        try {
            String seller = sellerId != null && !sellerId.isBlank()
                    ? sellerId : service.getSession(sessionId).getSellerId();
            List<ListingResponse> listings = service.findUnmapped(sessionId, seller).stream()
                    .map(ListingResponse::from)
                    .toList();
            return Response.ok(listings).build();
        } catch (Exception e) {
            return error(e, path);
        }
    }

    /**
     * POST /api/v1/reconciliation/sessions/{id}/unmapped/mark-for-deletion
     */
    @POST
    @Path("/sessions/{id}/unmapped/mark-for-deletion")
    @Operation(summary = "Mark unmapped listings for deletion",
            description = "Adds pending delete changes for the given unmapped listings to the session.")
    @APIResponse(responseCode = "200", description = "Delete changes created")
    @APIResponse(responseCode = "400", description = "Listing unknown or already referenced")
    public Response markForDeletion(@Parameter(description = "Session ID") @PathParam("id") String sessionId,
                                    MarkForDeletionRequest request) {
        String path = BASE + "/sessions/" + sessionId + "/unmapped/mark-for-deletion";
        try {
            List<ChangeResponse> created = service.markForDeletion(sessionId, request.listingIds(), request.reason())
                    .stream()
                    .map(ChangeResponse::from)
                    .toList();
            return Response.ok(created).build();
        } catch (Exception e) {
            return error(e, path);
        }
    }

    private Response error(Exception e, String path) {
        ErrorResponse body = ErrorResponse.from(e, path);
        if (body.isServerError()) {
            log.error("request.failed path={} code={} error={}", path, body.code(), e.getMessage(), e);
        }
        return Response.status(body.status()).entity(body).build();
    }

    private static Set<ChangeType> parseTypes(List<String> values) {
        Set<ChangeType> types = EnumSet.noneOf(ChangeType.class);
        if (values != null) {
            values.stream().filter(v -> v != null && !v.isBlank()).map(ChangeType::fromWireName).forEach(types::add);
        }
        return types;
    }

    private static Set<ChangeStatus> parseStatuses(List<String> values) {
        Set<ChangeStatus> statuses = EnumSet.noneOf(ChangeStatus.class);
        if (values != null) {
            values.stream().filter(v -> v != null && !v.isBlank()).map(ChangeStatus::fromWireName).forEach(statuses::add);
        }
        return statuses;
    }
}
