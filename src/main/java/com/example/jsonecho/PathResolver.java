package com.example.jsonecho;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Locates the project root and reads or writes files relative to it. Absolute paths are used as
 * they are.
 */
public final class PathResolver {
    private static final Logger log = LoggerFactory.getLogger(PathResolver.class);

    public static final List<String> MARKER_FILES = List.of("db.json", ".db.json", "json-echo.json");

    static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final Path root;

    public PathResolver(Path root) {
        this.root = normalize(Objects.requireNonNull(root, "root"));
    }

    public static PathResolver discover(Path start) {
        return new PathResolver(resolveRoot(Optional.of(start)));
    }

    /**
     * Walks from {@code start} (or the working directory) towards the filesystem root and returns the
     * first directory containing a marker file. Falls back to the starting directory.
     */
    public static Path resolveRoot(Optional<Path> start) {
        Path origin = normalize(start.orElseGet(() -> Paths.get("").toAbsolutePath()));
        Path current = origin;
        while (current != null) {
            for (String marker : MARKER_FILES) {
                if (Files.isRegularFile(current.resolve(marker))) {
                    log.debug("Found marker {} in {}", marker, current);
                    return current;
                }
            }
            current = current.getParent();
        }
        log.debug("No marker file above {}, using it as root", origin);
        return origin;
    }

    public Path root() {
        return root;
    }

    /**
     * @throws FileAccessException with {@link JsonEchoErrorCode#IO_ERROR} when {@code path} is not a
     *                             valid path on this platform
     */
    public Path resolve(String path) {
        Path candidate;
        try {
            candidate = Paths.get(path);
        } catch (InvalidPathException ex) {
            throw FileAccessException.invalidPath(path, ex);
        }
        return candidate.isAbsolute() ? candidate : root.resolve(candidate);
    }

    /** First marker file present directly in the root, if any. */
    public Optional<Path> findConfigFile() {
        return MARKER_FILES.stream()
                .map(root::resolve)
                .filter(Files::isRegularFile)
                .findFirst();
    }

    public byte[] loadFile(String relativePath) {
        Path file = resolve(relativePath);
        if (Files.isDirectory(file)) {
            throw FileAccessException.isADirectory(file);
        }
        if (!Files.exists(file)) {
            throw FileAccessException.notFound(file);
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw FileAccessException.fromIo(file, ex);
        }
    }

    /**
     * Writes {@code content} to a temporary sibling of the target and renames it into place. An
     * overwritten file keeps its permissions; a new one gets {@code rw-r--r--}.
     */
    public void saveFile(String relativePath, byte[] content) {
        Path file = resolve(relativePath).toAbsolutePath();
        if (Files.isDirectory(file)) {
            throw FileAccessException.isADirectory(file);
        }
        Path directory = file.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + file.getFileName(), ".tmp");
            Files.write(temp, content);
            copyPermissions(file, temp);
            moveIntoPlace(temp, file);
            log.debug("Wrote {} bytes to {}", content.length, file);
        } catch (IOException ex) {
            deleteQuietly(temp, ex);
            throw FileAccessException.fromIo(file, ex);
        }
    }

    private static void copyPermissions(Path target, Path temp) throws IOException {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
                ? Files.getPosixFilePermissions(target)
                : NEW_FILE_PERMISSIONS;
        Files.setPosixFilePermissions(temp, permissions);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }

    private static Path normalize(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            return path.toAbsolutePath().normalize();
        }
    }
}
