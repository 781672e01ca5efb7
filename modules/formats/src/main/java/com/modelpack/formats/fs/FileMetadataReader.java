package com.modelpack.formats.fs;

import com.modelpack.types.EntryType;
import com.modelpack.types.FileMetadata;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributeView;

/**
 * Reads the attributes recorded for each packaged file. Ownership and permissions fall back
 * to {@code 0:0} and {@code 0644} on file systems without POSIX attributes.
 */
public final class FileMetadataReader {

    static final int DEFAULT_MODE = 0644;

    private FileMetadataReader() {}

    public static FileMetadata read(Path path) throws IOException {
        BasicFileAttributes basic = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);

        EntryType type;
        if (basic.isRegularFile()) {
            type = EntryType.FILE;
        } else if (basic.isDirectory()) {
            type = EntryType.DIRECTORY;
        } else if (basic.isSymbolicLink()) {
            type = EntryType.SYMLINK;
        } else {
            throw new IOException("Unknown file type: " + path);
        }

        int mode = DEFAULT_MODE;
        PosixFileAttributeView posix = Files.getFileAttributeView(path, PosixFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
        if (posix != null) {
            mode = PosixModes.toMode(posix.readAttributes().permissions());
        }

        return new FileMetadata(
                path.getFileName().toString(),
                mode,
                unixId(path, "unix:uid"),
                unixId(path, "unix:gid"),
                basic.size(),
                basic.lastModifiedTime().toInstant(),
                type.typeflag());
    }

    /** Restores permissions and mtime, where the file system supports them. */
    public static void apply(Path path, FileMetadata metadata) throws IOException {
        PosixFileAttributeView posix = Files.getFileAttributeView(path, PosixFileAttributeView.class);
        if (posix != null) {
            posix.setPermissions(PosixModes.toPermissions(metadata.mode()));
        }
        if (metadata.modTime() != null) {
            Files.setLastModifiedTime(path, FileTime.from(metadata.modTime()));
        }
    }

    private static int unixId(Path path, String attribute) throws IOException {
        try {
            Object value = Files.getAttribute(path, attribute, LinkOption.NOFOLLOW_LINKS);
            return value instanceof Integer id ? id : 0;
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            // no "unix" attribute view on this file system
            return 0;
        }
    }
}
