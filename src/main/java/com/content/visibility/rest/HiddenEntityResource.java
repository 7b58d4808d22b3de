package com.content.visibility.rest;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.error.ValidationException;
import com.content.visibility.error.VisibilityException;
import com.content.visibility.hidden.BulkHideResult;
import com.content.visibility.hidden.HiddenEntityService;
import com.content.visibility.rest.dto.BulkHideRequest;
import com.content.visibility.rest.dto.HiddenEntityResponse;
import com.content.visibility.rest.dto.HideEntityRequest;
import com.content.visibility.rest.security.RequiresRole;
import com.content.visibility.rest.security.SecurityRole;
import com.content.visibility.rest.security.UserPrincipal;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * User-facing REST resource for hiding and unhiding entities.
 *
 * <p>Every operation acts on the user the API key belongs to. Hidden entities
 * take effect in the exclusion set immediately where possible and completely after
 * the next recompute.</p>
 */
@Path("/api/v1/hidden-entities")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@RequiresRole(SecurityRole.USER)
@Tag(name = "Hidden Entities", description = "Per-user opt-out of individual entities")
@SecurityRequirement(name = "apiKey")
public class HiddenEntityResource {
    private static final Logger log = LoggerFactory.getLogger(HiddenEntityResource.class);

    private static final String BASE = "/api/v1/hidden-entities";

    private final HiddenEntityService hiddenEntityService;

    @Inject
    public HiddenEntityResource(HiddenEntityService hiddenEntityService) {
        this.hiddenEntityService = hiddenEntityService;
    }

    /**
     * POST /api/v1/hidden-entities
     */
    @POST
    @Operation(summary = "Hide entity", description = "Hides one entity for the calling user. Idempotent.")
    @APIResponse(responseCode = "200", description = "Entity hidden")
    @APIResponse(responseCode = "400", description = "Missing or invalid entity type or id")
    public Response hide(@Context SecurityContext securityContext, HideEntityRequest request) {
        UserPrincipal user = principal(securityContext);
        if (user == null) {
            return ErrorResponses.unauthorized(BASE);
        }
        try {
            if (request == null) {
                throw new ValidationException("entityType and entityId are required");
            }
            boolean created = hiddenEntityService.hide(user.userId(), request.toItem());
            return Response.ok(Map.of(
                    "success", true,
                    "created", created,
                    "message", "Entity hidden successfully"
            )).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, BASE);
        } catch (Exception e) {
            log.error("hide.failed userId={} error={}", user.userId(), e.getMessage(), e);
            return ErrorResponses.internalError(e, BASE);
        }
    }

    /**
     * POST /api/v1/hidden-entities/bulk
     */
    @POST
    @Path("/bulk")
    @Operation(summary = "Hide entities in bulk",
            description = "Validates the whole batch, then hides each entity independently.")
    @APIResponse(responseCode = "200", description = "Batch processed, see successCount and failCount")
    @APIResponse(responseCode = "400", description = "Empty batch or malformed item")
    public Response bulkHide(@Context SecurityContext securityContext, BulkHideRequest request) {
        String path = BASE + "/bulk";
        UserPrincipal user = principal(securityContext);
        if (user == null) {
            return ErrorResponses.unauthorized(path);
        }
        try {
            BulkHideResult result = hiddenEntityService.bulkHide(user.userId(),
                    request != null ? request.entities() : null);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("message", result.successCount() + " entities hidden successfully");
            response.put("successCount", result.successCount());
            response.put("failCount", result.failCount());
            return Response.ok(response).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, path);
        } catch (Exception e) {
            log.error("bulkHide.failed userId={} error={}", user.userId(), e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }

    /**
     * GET /api/v1/hidden-entities?entityType=performer
     */
    @GET
    @Operation(summary = "List hidden entities", description = "Hidden entities of the calling user, newest first.")
    @APIResponse(responseCode = "400", description = "Invalid entity type")
    public Response list(@Context SecurityContext securityContext,
                         @Parameter(description = "Restrict to one entity type")
                         @QueryParam("entityType") String entityType) {
        UserPrincipal user = principal(securityContext);
        if (user == null) {
            return ErrorResponses.unauthorized(BASE);
        }
        try {
            EntityType type = optionalType(entityType);
            List<HiddenEntityResponse> hidden = hiddenEntityService.listHidden(user.userId(), type).stream()
                    .map(HiddenEntityResponse::from)
                    .toList();
            return Response.ok(Map.of("hiddenEntities", hidden)).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, BASE);
        } catch (Exception e) {
            log.error("listHidden.failed userId={} error={}", user.userId(), e.getMessage(), e);
            return ErrorResponses.internalError(e, BASE);
        }
    }

    /**
     * GET /api/v1/hidden-entities/ids
     */
    @GET
    @Path("/ids")
    @Operation(summary = "Hidden entity ids", description = "Hidden ids of the calling user grouped by plural type name.")
    public Response ids(@Context SecurityContext securityContext) {
        String path = BASE + "/ids";
        UserPrincipal user = principal(securityContext);
        if (user == null) {
            return ErrorResponses.unauthorized(path);
        }
        try {
            Map<EntityType, Set<EntityKey>> byType = hiddenEntityService.idsByType(user.userId());
            Map<String, List<String>> ids = new LinkedHashMap<>();
            for (EntityType type : EntityType.values()) {
                List<String> keys = new ArrayList<>();
                byType.getOrDefault(type, Set.of()).forEach(key -> keys.add(key.toString()));
                ids.put(type.getPluralName(), keys);
            }
            return Response.ok(Map.of("hiddenIds", ids)).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, path);
        } catch (Exception e) {
            log.error("hiddenIds.failed userId={} error={}", user.userId(), e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }

    /**
     * DELETE /api/v1/hidden-entities/all?entityType=tag
     */
    @DELETE
    @Path("/all")
    @Operation(summary = "Unhide all", description = "Unhides every entity of the calling user, or of one type.")
    @APIResponse(responseCode = "400", description = "Invalid entity type")
    public Response unhideAll(@Context SecurityContext securityContext,
                              @Parameter(description = "Restrict to one entity type")
                              @QueryParam("entityType") String entityType) {
        String path = BASE + "/all";
        UserPrincipal user = principal(securityContext);
        if (user == null) {
            return ErrorResponses.unauthorized(path);
        }
        try {
            int removed = hiddenEntityService.unhideAll(user.userId(), optionalType(entityType));
            return Response.ok(Map.of(
                    "success", true,
                    "count", removed,
                    "message", removed + " entities unhidden successfully"
            )).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, path);
        } catch (Exception e) {
            log.error("unhideAll.failed userId={} error={}", user.userId(), e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }

    /**
     * DELETE /api/v1/hidden-entities/{entityType}/{entityId}?instanceId=
     */
    @DELETE
    @Path("/{entityType}/{entityId}")
    @Operation(summary = "Unhide entity", description = "Unhides one entity of the calling user.")
    @APIResponse(responseCode = "200", description = "Entity unhidden, or was not hidden")
    @APIResponse(responseCode = "400", description = "Invalid entity type")
    public Response unhide(@Context SecurityContext securityContext,
                           @Parameter(description = "Entity type") @PathParam("entityType") String entityType,
                           @Parameter(description = "Entity ID") @PathParam("entityId") String entityId,
                           @Parameter(description = "Upstream instance, empty for a global hide")
                           @QueryParam("instanceId") String instanceId) {
        String path = BASE + "/" + entityType + "/" + entityId;
        UserPrincipal user = principal(securityContext);
        if (user == null) {
            return ErrorResponses.unauthorized(path);
        }
        try {
            EntityType type = EntityType.fromWire(entityType)
                    .orElseThrow(() -> new ValidationException("Invalid entity type: " + entityType));
            boolean removed = hiddenEntityService.unhide(user.userId(), type, EntityKey.of(instanceId, entityId));
            return Response.ok(Map.of(
                    "success", true,
                    "removed", removed,
                    "message", removed ? "Entity unhidden successfully" : "Entity was not hidden"
            )).build();
        } catch (VisibilityException e) {
            return ErrorResponses.of(e, path);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.of(new ValidationException(e.getMessage()), path);
        } catch (Exception e) {
            log.error("unhide.failed userId={} error={}", user.userId(), e.getMessage(), e);
            return ErrorResponses.internalError(e, path);
        }
    }

    private static EntityType optionalType(String entityType) {
        if (entityType == null || entityType.isBlank()) {
            return null;
        }
        return EntityType.fromWire(entityType)
                .orElseThrow(() -> new ValidationException("Invalid entity type: " + entityType));
    }

    private static UserPrincipal principal(SecurityContext securityContext) {
        if (securityContext != null && securityContext.getUserPrincipal() instanceof UserPrincipal user) {
            return user;
        }
        return null;
    }
}
