package ai.pipestream.history.http;

import ai.pipestream.history.exception.InvalidInputException;
import ai.pipestream.history.model.FileVersion;
import ai.pipestream.history.model.VersionStatistics;
import ai.pipestream.history.service.HistoryQueryService;
import ai.pipestream.history.service.VersionControlService;
import ai.pipestream.history.store.VersionPage;
import io.smallrye.common.annotation.Blocking;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

/**
 * HTTP surface for document history.
 *
 * The caller's identity arrives in the {@code x-user-id} header, hydrated by the gateway in front
 * of this service. Version references accept a version id or "current".
 */
@Path("/documents/{documentId}")
@Produces(MediaType.APPLICATION_JSON)
public class DocumentHistoryResource {

    private static final Logger LOG = Logger.getLogger(DocumentHistoryResource.class);

    static final String USER_HEADER = "x-user-id";

    @Inject
    VersionControlService versionControl;

    @POST
    @Path("/versions")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    public Uni<Response> createVersion(
            @PathParam("documentId") String documentId,
            @HeaderParam(USER_HEADER) String author,
            CreateVersionRequest request
    ) {
        if (request == null) {
            throw InvalidInputException.missingField("createVersion", "body");
        }
        LOG.debugf("POST versions: documentId=%s, author=%s", documentId, author);
        return versionControl.createVersion(documentId, request.content(), author, request.message())
                .map(version -> Response.status(Response.Status.CREATED).entity(version).build());
    }

    @GET
    @Path("/versions")
    @Blocking
    public Uni<VersionPage> listVersions(
            @PathParam("documentId") String documentId,
            @QueryParam("cursor") String cursor,
            @QueryParam("limit") Integer limit
    ) {
        return versionControl.listVersions(documentId, cursor, limit);
    }

    @GET
    @Path("/versions/current")
    @Blocking
    public Uni<FileVersion> getCurrentVersion(@PathParam("documentId") String documentId) {
        return versionControl.getCurrentVersion(documentId);
    }

    @GET
    @Path("/versions/{versionId}")
    @Blocking
    public Uni<FileVersion> getVersion(
            @PathParam("documentId") String documentId,
            @PathParam("versionId") String versionId
    ) {
        return versionControl.getVersion(documentId, versionId);
    }

    @GET
    @Path("/compare")
    @Blocking
    public Uni<ComparisonView> compare(
            @PathParam("documentId") String documentId,
            @QueryParam("from") String from,
            @QueryParam("to") String to
    ) {
        return versionControl.compareVersions(documentId, from, defaultRef(to))
                .map(ComparisonView::of);
    }

    @GET
    @Path("/compare/side-by-side")
    @Blocking
    public Uni<SideBySideResponse> compareSideBySide(
            @PathParam("documentId") String documentId,
            @QueryParam("from") String from,
            @QueryParam("to") String to
    ) {
        return versionControl.compareSideBySide(documentId, from, defaultRef(to))
                .map(SideBySideResponse::of);
    }

    @POST
    @Path("/compare/draft")
    @Consumes(MediaType.APPLICATION_JSON)
    @Blocking
    public Uni<ComparisonView> compareWithDraft(
            @PathParam("documentId") String documentId,
            DraftCompareRequest request
    ) {
        if (request == null) {
            throw InvalidInputException.missingField("compareWithDraft", "body");
        }
        return versionControl.compareWithDraft(documentId, defaultRef(request.base()), request.lines())
                .map(ComparisonView::of);
    }

    @POST
    @Path("/versions/{versionId}/rollback")
    @Blocking
    public Uni<FileVersion> rollback(
            @PathParam("documentId") String documentId,
            @PathParam("versionId") String versionId,
            @HeaderParam(USER_HEADER) String author
    ) {
        return versionControl.rollbackToVersion(documentId, versionId, author);
    }

    @GET
    @Path("/statistics")
    @Blocking
    public Uni<VersionStatistics> getStatistics(@PathParam("documentId") String documentId) {
        return versionControl.getStatistics(documentId);
    }

    private static String defaultRef(String ref) {
        return (ref == null || ref.isBlank()) ? HistoryQueryService.CURRENT : ref;
    }
}
