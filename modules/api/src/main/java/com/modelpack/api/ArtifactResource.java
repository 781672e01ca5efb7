package com.modelpack.api;

import com.modelpack.core.artifact.ArtifactService;
import com.modelpack.core.artifact.InspectedModelArtifact;
import com.modelpack.core.artifact.ModelArtifact;
import com.modelpack.core.gc.GcReport;
import com.modelpack.util.Digest;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the local content store, plus on-demand garbage collection.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class ArtifactResource {

    private static final Logger log = Logger.getLogger(ArtifactResource.class);

    @Inject
    ArtifactService artifacts;

    public record GcResponse(int prunedCount, Map<String, List<String>> pruned, Map<String, String> failures) {
        static GcResponse of(GcReport report) {
            Map<String, List<String>> pruned = new LinkedHashMap<>();
            report.pruned().forEach((repo, digests) ->
                    pruned.put(repo, digests.stream().map(Digest::toString).toList()));
            return new GcResponse(report.prunedCount(), pruned, report.failures());
        }
    }

    @GET
    @Path("/artifacts")
    public List<ModelArtifact> list() {
        return artifacts.list();
    }

    /** The repository may span several path segments, e.g. {@code localhost:5000/team/llama}. */
    @GET
    @Path("/artifacts/{repository: .+}/{tag}")
    public InspectedModelArtifact inspect(@PathParam("repository") String repository, @PathParam("tag") String tag) {
        return artifacts.inspect(repository + ":" + tag);
    }

    @POST
    @Path("/gc")
    public GcResponse gc() {
        log.info("Garbage collection requested");
        return GcResponse.of(artifacts.prune());
    }
}
