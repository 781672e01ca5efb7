package com.modelpack.core.process;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

@ApplicationScoped
public class RetryPolicyProducer {

    @ConfigProperty(name = "modelpack.build.retry.attempts", defaultValue = "4")
    int attempts;

    @ConfigProperty(name = "modelpack.build.retry.initial-backoff", defaultValue = "PT10S")
    Duration initialBackoff;

    @ConfigProperty(name = "modelpack.build.retry.max-backoff", defaultValue = "PT20S")
    Duration maxBackoff;

    @Produces
    @Singleton
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(attempts, initialBackoff, maxBackoff);
    }
}
