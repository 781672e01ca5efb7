package com.modelpack.core.remote;

import com.google.cloud.tools.jib.api.DescriptorDigest;
import com.google.cloud.tools.jib.api.RegistryException;
import com.google.cloud.tools.jib.blob.Blob;
import com.google.cloud.tools.jib.blob.Blobs;
import com.google.cloud.tools.jib.http.ResponseException;
import com.google.cloud.tools.jib.registry.ManifestAndDigest;
import com.google.cloud.tools.jib.registry.RegistryClient;
import com.modelpack.types.Descriptor;
import com.modelpack.util.Digest;
import com.modelpack.util.Hashing;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.DigestException;
import java.util.Optional;

/**
 * {@link RemoteRegistry} over Jib's distribution API client.
 */
public class JibRemoteRegistry implements RemoteRegistry {

    private static final Logger log = Logger.getLogger(JibRemoteRegistry.class);

    private final Reference reference;
    private final RegistryClient client;

    public JibRemoteRegistry(Reference reference, RegistryClient client) {
        this.reference = reference;
        this.client = client;
    }

    @Override
    public Reference reference() {
        return reference;
    }

    @Override
    public boolean blobExists(Digest digest) {
        try {
            return client.checkBlob(toJib(digest)).isPresent();
        } catch (IOException | RegistryException e) {
            throw new RemoteRegistryException("Failed to check blob " + digest + " in " + reference.repository(), e);
        }
    }

    @Override
    public void pushBlob(Descriptor descriptor, InputStream content) {
        try {
            Blob blob = Blobs.from(content);
            client.pushBlob(toJib(descriptor.parsedDigest()), blob, null, written -> { });
            log.debugf("Pushed blob %s (%d bytes) to %s", descriptor.digest(), descriptor.size(), reference.repository());
        } catch (IOException | RegistryException e) {
            throw new RemoteRegistryException("Failed to push blob " + descriptor.digest() + " to " + reference.repository(), e);
        }
    }

    @Override
    public void pullBlob(Descriptor descriptor, OutputStream out) {
        try {
            Blob blob = client.pullBlob(toJib(descriptor.parsedDigest()), size -> { }, written -> { });
            blob.writeTo(out);
        } catch (IOException e) {
            throw new RemoteRegistryException("Failed to pull blob " + descriptor.digest() + " from " + reference.repository(), e);
        }
    }

    @Override
    public Optional<RemoteManifest> pullManifest(String ref) {
        try {
            ManifestAndDigest<ArtifactManifestTemplate> pulled =
                    client.pullManifest(ref, ArtifactManifestTemplate.class);
            ArtifactManifestTemplate template = pulled.getManifest();
            byte[] bytes = template.toBytes();
            Digest served = Digest.parse(pulled.getDigest().toString());
            Digest local = Hashing.sha256(bytes);
            if (!served.equals(local)) {
                log.warnf("Manifest %s@%s is not in compact form; stored as %s", reference.repository(), served, local);
            }
            return Optional.of(new RemoteManifest(local, template.getManifestMediaType(), bytes));
        } catch (IOException | RegistryException e) {
            if (isNotFound(e)) {
                return Optional.empty();
            }
            throw new RemoteRegistryException("Failed to pull manifest " + reference.repository() + ":" + ref, e);
        }
    }

    @Override
    public Digest pushManifest(byte[] manifest, String ref) {
        try {
            DescriptorDigest pushed = client.pushManifest(ArtifactManifestTemplate.of(manifest), ref);
            log.debugf("Pushed manifest %s to %s as %s", pushed, reference.repository(), ref);
            return Digest.parse(pushed.toString());
        } catch (IOException | RegistryException e) {
            throw new RemoteRegistryException("Failed to push manifest to " + reference.repository() + ":" + ref, e);
        }
    }

    private static DescriptorDigest toJib(Digest digest) {
        try {
            return DescriptorDigest.fromDigest(digest.toString());
        } catch (DigestException e) {
            throw new IllegalArgumentException("Invalid digest " + digest, e);
        }
    }

    static boolean isNotFound(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof ResponseException response && response.getStatusCode() == 404) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
