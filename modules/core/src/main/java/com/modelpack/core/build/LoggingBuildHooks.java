package com.modelpack.core.build;

import com.modelpack.types.Descriptor;
import org.jboss.logging.Logger;

import java.io.InputStream;

/**
 * Progress observer that writes one log line per transfer event.
 */
public class LoggingBuildHooks implements BuildHooks {

    private static final Logger log = Logger.getLogger(LoggingBuildHooks.class);

    @Override
    public InputStream onStart(String name, long size, InputStream stream) {
        log.infof("Transferring %s (%d bytes)", name, size);
        return stream;
    }

    @Override
    public void onError(String name, Throwable error) {
        log.errorf(error, "Transfer of %s failed", name);
    }

    @Override
    public void onComplete(String name, Descriptor descriptor) {
        log.infof("Done %s -> %s", name, descriptor.digest());
    }
}
