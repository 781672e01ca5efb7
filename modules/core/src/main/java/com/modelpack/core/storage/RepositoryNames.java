package com.modelpack.core.storage;

import java.util.regex.Pattern;

/**
 * Validation of repository names used as relative directories under the store root.
 */
public final class RepositoryNames {

    private static final Pattern SEGMENT = Pattern.compile("[a-z0-9]+(?:(?:[._]|__|-+)[a-z0-9]+)*(?::[0-9]+)?");

    private RepositoryNames() {}

    /**
     * @throws IllegalArgumentException if {@code name} is not a slash-separated list of
     *                                  lowercase OCI path components (a registry port is allowed)
     */
    public static String validate(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Repository name cannot be empty");
        }
        for (String segment : name.split("/", -1)) {
            if (!SEGMENT.matcher(segment).matches()) {
                throw new IllegalArgumentException("Invalid repository name: " + name);
            }
        }
        return name;
    }
}
