package com.modelpack.core.remote;

import com.google.cloud.tools.jib.api.Credential;
import com.google.cloud.tools.jib.api.RegistryException;
import com.google.cloud.tools.jib.event.EventHandlers;
import com.google.cloud.tools.jib.frontend.CredentialRetrieverFactory;
import com.google.cloud.tools.jib.http.FailoverHttpClient;
import com.google.cloud.tools.jib.registry.RegistryClient;
import com.google.cloud.tools.jib.registry.credentials.CredentialRetrievalException;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.Optional;

/**
 * Builds Jib registry clients, authenticating with configured credentials or, when none are
 * configured, the docker config file.
 */
@ApplicationScoped
public class JibRemoteRegistryFactory implements RemoteRegistryFactory {

    private static final Logger log = Logger.getLogger(JibRemoteRegistryFactory.class);

    @ConfigProperty(name = "modelpack.remote.plain-http", defaultValue = "false")
    boolean plainHttp;

    @ConfigProperty(name = "modelpack.remote.insecure", defaultValue = "false")
    boolean insecure;

    @ConfigProperty(name = "modelpack.remote.username")
    Optional<String> username;

    @ConfigProperty(name = "modelpack.remote.password")
    Optional<String> password;

    @Override
    public RemoteRegistry open(Reference reference, Access access) {
        RegistryClient.Factory factory = RegistryClient.factory(new EventHandlers.Builder().build(),
                reference.registry(), reference.path(),
                new FailoverHttpClient(plainHttp || insecure, plainHttp, s -> log.debug(s.getMessage())));

        Optional<Credential> credential = credential(reference);
        if (credential.isPresent()) {
            factory.setCredential(credential.get());
        } else {
            log.debugf("No credential found for %s, proceeding without any", reference.registry());
        }

        RegistryClient client = factory.newRegistryClient();
        try {
            boolean bearer = access == Access.PUSH ? client.doPushBearerAuth() : client.doPullBearerAuth();
            if (!bearer && credential.isPresent()) {
                client.configureBasicAuth();
            }
        } catch (IOException | RegistryException e) {
            throw new RemoteRegistryException("Failed to authenticate to " + reference.registry(), e);
        }
        return new JibRemoteRegistry(reference, client);
    }

    private Optional<Credential> credential(Reference reference) {
        if (username.isPresent() && password.isPresent()) {
            return Optional.of(Credential.from(username.get(), password.get()));
        }
        CredentialRetrieverFactory retrievers = CredentialRetrieverFactory.forImage(reference.imageReference(),
                s -> log.debug(s.getMessage()));
        try {
            return retrievers.dockerConfig().retrieve();
        } catch (CredentialRetrievalException e) {
            throw new RemoteRegistryException("Failed to read registry credentials for " + reference.registry(), e);
        }
    }
}
