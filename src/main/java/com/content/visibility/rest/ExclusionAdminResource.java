package com.content.visibility.rest;

import com.content.visibility.core.model.RuleSet;
import com.content.visibility.error.VisibilityException;
import com.content.visibility.exclusion.ExclusionResult;
import com.content.visibility.recompute.RecomputeAllResult;
import com.content.visibility.recompute.RecomputeCoordinator;
import com.content.visibility.rest.dto.RestrictionsRequest;
import com.content.visibility.rest.dto.RestrictionsResponse;
import com.content.visibility.rest.security.RequiresRole;
import com.content.visibility.rest.security.SecurityRole;
import com.content.visibility.rules.RestrictionService;
import com.content.visibility.stats.StatsAggregator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Administrative REST resource: restriction rules, recomputes and exclusion statistics.
 *
 * <p>Security: every endpoint requires {@link SecurityRole#ADMIN}. Rule writes do not
 * recompute; call {@code POST /recompute/{userId}} afterwards.</p>
 */
@Path("/api/v1/admin")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@RequiresRole(SecurityRole.ADMIN)
@Tag(name = "Exclusion Administration", description = "Restriction rules, recomputes and exclusion statistics")
@SecurityRequirement(name = "apiKey")
public class ExclusionAdminResource {
    private static final Logger log = LoggerFactory.getLogger(ExclusionAdminResource.class);

    private static final String BASE = "/api/v1/admin";

    private final RestrictionService restrictionService;
    private final RecomputeCoordinator coordinator;
    private final StatsAggregator statsAggregator;

    @Inject
    public ExclusionAdminResource(RestrictionService restrictionService, RecomputeCoordinator coordinator,
                                  StatsAggregator statsAggregator) {
        this.restrictionService = restrictionService;
        this.coordinator = coordinator;
        this.statsAggregator = statsAggregator;
    }

    /**
     * GET /api/v1/admin/restrictions/{userId}
     */
    @GET
    @Path("/restrictions/{userId}")
    @Operation(summary = "Get restriction rules", description = "Returns every restriction rule of a user.")
    @APIResponse(responseCode = "200", description = "Rules returned")
    @APIResponse(responseCode = "404", description = "User not found")
    public Response getRestrictions(@Parameter(description = "User ID") @PathParam("userId") String userId) {
        String path = BASE + "/restrictions/" + userId;
        try {
            RuleSet ruleSet = restrictionService.getRules(ErrorResponses.parseUserId(userId));
            return Response.ok(RestrictionsResponse.from(ruleSet)).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, path);
        } catch (Exception e) {
            log.error("getRestrictions.failed userId={} error={}", userId, e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }

    /**
     * PUT /api/v1/admin/restrictions/{userId}
     */
    @PUT
    @Path("/restrictions/{userId}")
    @Operation(summary = "Replace restriction rules",
            description = "Validates and replaces all restriction rules of a user. Does not recompute.")
    @APIResponse(responseCode = "200", description = "Rules replaced")
    @APIResponse(responseCode = "400", description = "Invalid entity type, mode or shape")
    @APIResponse(responseCode = "404", description = "User not found")
    public Response setRestrictions(@Parameter(description = "User ID") @PathParam("userId") String userId,
                                    RestrictionsRequest request) {
        String path = BASE + "/restrictions/" + userId;
        try {
            long id = ErrorResponses.parseUserId(userId);
            RuleSet stored = restrictionService.setRules(id, request != null ? request.restrictions() : null);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("message", "Content restrictions updated successfully");
            response.put("restrictions", RestrictionsResponse.from(stored).restrictions());
            response.put("version", stored.version());
            return Response.ok(response).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, path);
        } catch (Exception e) {
            log.error("setRestrictions.failed userId={} error={}", userId, e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }

    /**
     * DELETE /api/v1/admin/restrictions/{userId}
     */
    @DELETE
    @Path("/restrictions/{userId}")
    @Operation(summary = "Delete restriction rules", description = "Removes every restriction rule of a user.")
    @APIResponse(responseCode = "200", description = "Rules removed")
    @APIResponse(responseCode = "404", description = "User not found")
    public Response deleteRestrictions(@Parameter(description = "User ID") @PathParam("userId") String userId) {
        String path = BASE + "/restrictions/" + userId;
        try {
            int removed = restrictionService.deleteRules(ErrorResponses.parseUserId(userId));
            return Response.ok(Map.of(
                    "success", true,
                    "message", "All content restrictions removed successfully",
                    "removed", removed
            )).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, path);
        } catch (Exception e) {
            log.error("deleteRestrictions.failed userId={} error={}", userId, e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }

    /**
     * POST /api/v1/admin/recompute/{userId}
     */
    @POST
    @Path("/recompute/{userId}")
    @Operation(summary = "Recompute one user", description = "Rebuilds the exclusion set of one user synchronously.")
    @APIResponse(responseCode = "200", description = "Recompute committed")
    @APIResponse(responseCode = "400", description = "User ID is not numeric")
    @APIResponse(responseCode = "404", description = "User not found")
    @APIResponse(responseCode = "409", description = "Another recompute of the user held the lock too long")
    @APIResponse(responseCode = "503", description = "Catalog unavailable or pass deadline exceeded")
    public Response recomputeUser(@Parameter(description = "User ID") @PathParam("userId") String userId) {
        String path = BASE + "/recompute/" + userId;
        try {
            ExclusionResult result = coordinator.recomputeUser(ErrorResponses.parseUserId(userId));
            Map<String, Integer> byType = new LinkedHashMap<>();
            result.excluded().forEach((type, count) -> byType.put(type.getWireName(), count));

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("userId", result.userId());
            response.put("excluded", result.totalExcluded());
            response.put("cascaded", result.cascaded());
            response.put("excludedByType", byType);
            response.put("ruleVersion", result.ruleVersion());
            response.put("elapsedMs", result.elapsed().toMillis());
            return Response.ok(response).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, path);
        } catch (Exception e) {
            log.error("recomputeUser.failed userId={} error={}", userId, e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }

    /**
     * POST /api/v1/admin/recompute-all
     */
    @POST
    @Path("/recompute-all")
    @Operation(summary = "Recompute all users",
            description = "Rebuilds the exclusion sets of all users. Per-user failures are reported, not raised.")
    @APIResponse(responseCode = "200", description = "Recompute finished, possibly with failed users")
    public Response recomputeAll() {
        String path = BASE + "/recompute-all";
        try {
            RecomputeAllResult result = coordinator.recomputeAll();
            return Response.ok(result).build();
        } catch (Exception e) {
            log.error("recomputeAll.failed error={}", e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }

    /**
     * GET /api/v1/admin/stats
     */
    @GET
    @Path("/stats")
    @Operation(summary = "Exclusion statistics",
            description = "Counts of excluded entities grouped by user, entity type and reason.")
    public Response getStats() {
        try {
            return Response.ok(statsAggregator.getStats()).build();
        } catch (Exception e) {
            log.error("getStats.failed error={}", e.getMessage(), e);
            return ErrorResponses.internalError(e, BASE + "/stats");
        }
    }

    /**
     * GET /api/v1/admin/stats/{userId}/visible
     */
    @GET
    @Path("/stats/{userId}/visible")
    @Operation(summary = "Visible counts", description = "Visible entity counts per type for one user.")
    @APIResponse(responseCode = "404", description = "User not found")
    public Response getVisibleCounts(@Parameter(description = "User ID") @PathParam("userId") String userId) {
        String path = BASE + "/stats/" + userId + "/visible";
        try {
            long id = ErrorResponses.parseUserId(userId);
            Map<String, Long> counts = new LinkedHashMap<>();
            statsAggregator.visibleCounts(id)
                    .forEach(s -> counts.put(s.entityType().getWireName(), s.visibleCount()));
            return Response.ok(Map.of("userId", id, "visibleCounts", counts)).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, path);
        } catch (Exception e) {
            log.error("getVisibleCounts.failed userId={} error={}", userId, e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }
}
