package tech.manajer.platform.activitylog;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.manajer.platform.authentication.AuthenticatedUser;
import tech.manajer.platform.authentication.TokenVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Admin API for reading the activity log.
 *
 * Restricted to callers whose token carries the {@code super_admin} role.
 */
@Path("/api/v1/activity-logs")
@Tag(name = "Activity Log", description = "Audit trail of administrative actions")
@Produces(MediaType.APPLICATION_JSON)
public class ActivityLogResource {

    private static final Logger LOG = Logger.getLogger(ActivityLogResource.class);

    @Inject
    ActivityLogService activityLogService;

    @Inject
    TokenVerifier tokenVerifier;

    @GET
    @Operation(summary = "List activity log entries", description = "Returns entries newest first")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Page of activity log entries",
            content = @Content(schema = @Schema(implementation = ActivityLogListResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid paging parameters"),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "403", description = "Insufficient permissions")
    })
    public Response listActivityLogs(
            @QueryParam("page") @DefaultValue("0") @Parameter(description = "Zero-based page index") int page,
            @QueryParam("size") @DefaultValue("50") @Parameter(description = "Page size (max 200)") int size,
            @HeaderParam("Authorization") String authHeader) {

        Optional<AuthenticatedUser> caller = tokenVerifier.verifyBearer(authHeader);
        if (caller.isEmpty()) {
            return Response.status(Response.Status.UNAUTHORIZED)
                .entity(new ErrorResponse("Not authenticated"))
                .build();
        }
        if (!caller.get().isSuperAdmin()) {
            LOG.warnf("User [%s] denied access to activity logs", caller.get().userId());
            return Response.status(Response.Status.FORBIDDEN)
                .entity(new ErrorResponse("Super admin role required"))
                .build();
        }
        if (page < 0 || size < 1) {
            return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse("page must be >= 0 and size must be >= 1"))
                .build();
        }

        int pageSize = Math.min(size, ActivityLogService.MAX_PAGE_SIZE);
        // page * pageSize must fit the int offset used by the store
        if (page > Integer.MAX_VALUE / pageSize) {
            return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse("page is out of range"))
                .build();
        }
        List<ActivityLogResponse> items = activityLogService.findPaged(page, pageSize).stream()
            .map(ActivityLogResponse::from)
            .toList();

        return Response.ok(new ActivityLogListResponse(items, page, pageSize, activityLogService.count())).build();
    }

    // ==================== DTOs ====================

    public record ActivityLogResponse(
        String id,
        String userId,
        String action,
        String method,
        String endpoint,
        int statusCode,
        String ipAddress,
        Instant createdAt
    ) {
        public static ActivityLogResponse from(ActivityLog log) {
            return new ActivityLogResponse(
                log.id != null ? log.id.toHexString() : null,
                log.userId != null ? log.userId.toHexString() : null,
                log.action,
                log.method,
                log.endpoint,
                log.statusCode,
                log.ipAddress,
                log.createdAt
            );
        }
    }

    public record ActivityLogListResponse(
        List<ActivityLogResponse> items,
        int page,
        int size,
        long total
    ) {}

    public record ErrorResponse(
        String error
    ) {}
}
