package com.di.organizer.codec;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Write path shared by the file codecs: encode into a temp file next to the target, then rename
 * it over the target. The rename is atomic where the file system supports it.
 */
@Slf4j
public abstract class AbstractFileTabularCodec implements TabularCodec {

    @Override
    public final void write(Path file, List<String> columns, List<? extends Map<String, ?>> rows) throws IOException {
        Path target = file.toAbsolutePath();
        Path dir = target.getParent();
        // plain create so the umask applies; createTempFile would force rw-------
        Path tmp = dir.resolve("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                encode(out, columns, rows);
            }
            keepPermissions(target, tmp);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}; replacing {} non-atomically", dir, target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.trace("Atomic rename: {} -> {}", tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /** Carries the POSIX permissions of an existing table over to its replacement. */
    private static void keepPermissions(Path target, Path replacement) throws IOException {
        if (Files.exists(target) && target.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(replacement, Files.getPosixFilePermissions(target));
        }
    }

    /**
     * Encodes the header and rows to {@code out}. Library failures must surface as {@link IOException}.
     */
    protected abstract void encode(OutputStream out, List<String> columns, List<? extends Map<String, ?>> rows)
            throws IOException;
}
