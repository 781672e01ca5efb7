package com.modelpack.core.remote;

/**
 * Opens authenticated connections to remote repositories.
 */
public interface RemoteRegistryFactory {

    enum Access { PULL, PUSH }

    RemoteRegistry open(Reference reference, Access access);
}
