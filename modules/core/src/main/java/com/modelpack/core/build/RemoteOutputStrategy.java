package com.modelpack.core.build;

import com.modelpack.core.remote.RemoteRegistry;
import com.modelpack.core.storage.DigestMismatchException;
import com.modelpack.types.Annotations;
import com.modelpack.types.Descriptor;
import com.modelpack.util.Digest;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Pushes blobs straight to a remote repository, skipping any the registry already has.
 */
public class RemoteOutputStrategy implements OutputStrategy {

    private static final Logger log = Logger.getLogger(RemoteOutputStrategy.class);

    private final RemoteRegistry remote;
    private final String tag;

    public RemoteOutputStrategy(RemoteRegistry remote, String tag) {
        this.remote = remote;
        this.tag = tag;
    }

    @Override
    public Descriptor outputLayer(String mediaType, String layerPath, Digest digest, long size,
                                  InputStream content, BuildHooks hooks) {
        Descriptor descriptor = Descriptor.of(mediaType, digest, size, Map.of(Annotations.FILEPATH, layerPath));
        return pushBlob(layerPath, descriptor, content, hooks);
    }

    @Override
    public Descriptor outputConfig(String mediaType, Digest digest, long size, InputStream content, BuildHooks hooks) {
        return pushBlob(digest.toString(), new Descriptor(mediaType, digest, size), content, hooks);
    }

    @Override
    public Descriptor outputManifest(String mediaType, Digest digest, long size, InputStream content, BuildHooks hooks) {
        String name = digest.toString();
        Descriptor descriptor = new Descriptor(mediaType, digest, size);
        try {
            InputStream observed = hooks.onStart(name, size, content);
            byte[] manifest = observed.readAllBytes();
            if (remote.manifestExists(name)) {
                log.debugf("Manifest %s already in %s", name, remote.reference().repository());
            } else {
                Digest pushed = remote.pushManifest(manifest, name);
                if (!pushed.equals(digest)) {
                    throw new DigestMismatchException("manifest pushed to " + remote.reference().repository(), digest, pushed);
                }
            }
            remote.pushManifest(manifest, tag);
            hooks.onComplete(name, descriptor);
            return descriptor;
        } catch (IOException e) {
            hooks.onError(name, e);
            throw new UncheckedIOException("Failed to read manifest " + name, e);
        } catch (RuntimeException e) {
            hooks.onError(name, e);
            throw e;
        }
    }

    private Descriptor pushBlob(String name, Descriptor descriptor, InputStream content, BuildHooks hooks) {
        try {
            InputStream observed = hooks.onStart(name, descriptor.size(), content);
            if (remote.blobExists(descriptor.parsedDigest())) {
                log.debugf("Blob %s already in %s, skipping upload", descriptor.digest(), remote.reference().repository());
                hooks.onComplete(name, descriptor);
                return descriptor;
            }
            remote.pushBlob(descriptor, observed);
            hooks.onComplete(name, descriptor);
            return descriptor;
        } catch (RuntimeException e) {
            hooks.onError(name, e);
            throw e;
        }
    }
}
