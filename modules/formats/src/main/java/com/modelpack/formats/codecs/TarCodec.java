package com.modelpack.formats.codecs;

import com.modelpack.formats.api.Codec;
import com.modelpack.formats.api.CodecType;
import com.modelpack.formats.fs.FileMetadataReader;
import com.modelpack.formats.fs.PosixModes;
import com.modelpack.types.Descriptor;
import com.modelpack.types.FileMetadata;
import com.modelpack.util.stream.BoundedPipe;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributeView;

/**
 * Wraps a file in a single-entry tar so extraction reproduces its relative path and mode.
 *
 * <p>The archive is produced on a background thread into a {@link BoundedPipe}; nothing is
 * buffered beyond the pipe's capacity. Owner names are left empty so the bytes depend only
 * on path, mode, ids, mtime and content.
 */
@ApplicationScoped
public class TarCodec implements Codec {

    private static final Logger log = Logger.getLogger(TarCodec.class);

    @Override
    public CodecType type() {
        return CodecType.TAR;
    }

    @Override
    public InputStream encode(Path file, String layerPath) throws IOException {
        FileMetadata metadata = FileMetadataReader.read(file);

        TarArchiveEntry entry = new TarArchiveEntry(layerPath);
        entry.setSize(metadata.size());
        entry.setMode(metadata.mode());
        entry.setUserId((long) metadata.uid());
        entry.setGroupId((long) metadata.gid());
        entry.setUserName("");
        entry.setGroupName("");
        entry.setModTime(FileTime.from(metadata.modTime()));

        BoundedPipe pipe = new BoundedPipe();
        Thread producer = new Thread(() -> writeArchive(file, entry, pipe), "tar-encode-" + layerPath);
        producer.setDaemon(true);
        producer.start();
        return pipe.source();
    }

    private static void writeArchive(Path file, TarArchiveEntry entry, BoundedPipe pipe) {
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(pipe.sink());
             InputStream in = Files.newInputStream(file)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
            tar.putArchiveEntry(entry);
            in.transferTo(tar);
            tar.closeArchiveEntry();
            tar.finish();
        } catch (BoundedPipe.PipeClosedException e) {
            log.debugf("Reader of %s left before the archive was complete", entry.getName());
        } catch (IOException | RuntimeException e) {
            log.debugf(e, "Failed to archive %s", file);
            pipe.fail(e);
        }
    }

    /**
     * Extracts every entry; the archive header names the target, {@code relativePath} is
     * ignored.
     */
    @Override
    public void decode(InputStream input, Path outputDir, String relativePath, Descriptor descriptor) throws IOException {
        TarArchiveInputStream tar = new TarArchiveInputStream(input);
        TarArchiveEntry entry;
        while ((entry = tar.getNextEntry()) != null) {
            Path target = SafePaths.resolveInside(outputDir, entry.getName());
            if (entry.isDirectory()) {
                Files.createDirectories(target);
                continue;
            }
            if (!entry.isFile()) {
                log.warnf("Skipping unsupported tar entry %s", entry.getName());
                continue;
            }
            Files.createDirectories(target.getParent());
            Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
            restoreAttributes(target, entry);
            log.debugf("Decoded tar entry %s to %s", entry.getName(), target);
        }
    }

    private static void restoreAttributes(Path target, TarArchiveEntry entry) throws IOException {
        PosixFileAttributeView posix = Files.getFileAttributeView(target, PosixFileAttributeView.class);
        if (posix != null) {
            posix.setPermissions(PosixModes.toPermissions(entry.getMode()));
        }
        Files.setLastModifiedTime(target, entry.getLastModifiedTime());
    }
}
