package com.modelpack.core.gc;

import com.modelpack.core.storage.ContentStore;
import com.modelpack.core.storage.ManifestContent;
import com.modelpack.types.Descriptor;
import com.modelpack.types.Index;
import com.modelpack.types.Manifest;
import com.modelpack.util.Digest;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mark-and-sweep over every repository of a {@link ContentStore}.
 *
 * <p>Reachable blobs are the manifests listed in a repository's index plus their config and
 * layers. Everything else in the repository's blob directory is deleted. A repository that
 * fails to parse is skipped and reported; its blobs are left untouched. Repositories are
 * never removed, even when every blob was pruned.
 */
public class GarbageCollector {

    private static final Logger log = Logger.getLogger(GarbageCollector.class);

    private final ContentStore store;

    public GarbageCollector(ContentStore store) {
        this.store = store;
    }

    public GcReport collect() {
        Map<String, List<Digest>> pruned = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();

        List<String> repositories = store.listRepositories().collect().asList().await().indefinitely();
        for (String repository : repositories) {
            try {
                List<Digest> removed = collect(repository);
                if (!removed.isEmpty()) {
                    pruned.put(repository, removed);
                }
            } catch (RuntimeException e) {
                log.errorf(e, "Garbage collection failed for %s", repository);
                failures.put(repository, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            }
        }

        GcReport report = new GcReport(pruned, failures);
        log.infof("Garbage collection done: %d blobs pruned in %d repositories, %d failures",
                report.prunedCount(), pruned.size(), failures.size());
        return report;
    }

    /** Prunes one repository and returns the deleted digests. */
    public List<Digest> collect(String repository) {
        Set<Digest> reachable = markReachable(repository);
        List<Digest> all = store.listBlobs(repository).collect().asList().await().indefinitely();

        List<Digest> prune = new ArrayList<>();
        for (Digest digest : all) {
            if (!reachable.contains(digest)) {
                prune.add(digest);
            }
        }
        if (!prune.isEmpty()) {
            store.cleanupRepo(repository, prune, false).await().indefinitely();
            log.debugf("Pruned %d of %d blobs in %s", prune.size(), all.size(), repository);
        }
        return prune;
    }

    private Set<Digest> markReachable(String repository) {
        Index index = store.getIndex(repository).await().indefinitely();
        Set<Digest> reachable = new HashSet<>();
        for (Descriptor entry : index.manifests()) {
            reachable.add(entry.parsedDigest());
            ManifestContent content = store.pullManifest(repository, entry.digest()).await().indefinitely();
            Manifest manifest = content.parse();
            if (manifest.config() != null) {
                reachable.add(manifest.config().parsedDigest());
            }
            for (Descriptor layer : manifest.layers()) {
                reachable.add(layer.parsedDigest());
            }
        }
        return reachable;
    }
}
