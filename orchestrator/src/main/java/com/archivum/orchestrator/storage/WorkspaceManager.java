package com.archivum.orchestrator.storage;

import com.archivum.orchestrator.config.ArchivumProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Per-transfer working directories under {@code archivum.storage.processing-directory}.
 *
 * <pre>
 * &lt;root&gt;/&lt;transferId&gt;/
 *     objects/   copy of the submitted content
 *     logs/
 *     tmp/&lt;jobId&gt;/&lt;fileId&gt;/   one output directory per task
 * </pre>
 */
@Component
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    public static final String OBJECTS_DIR = "objects";
    public static final String LOGS_DIR    = "logs";
    private static final String TMP_DIR    = "tmp";

    // Directory name used for package-level task output.
    private static final String PACKAGE_OUTPUT = "package";

    private final Path root;

    public WorkspaceManager(ArchivumProperties properties) {
        this.root = properties.storage().processingDirectory().toAbsolutePath().normalize();
    }

    /**
     * Turn a submitted location into a local path. Accepts {@code file:} URLs
     * and plain filesystem paths.
     *
     * @throws IllegalArgumentException for any other scheme or a malformed URL
     */
    public static Path toLocalPath(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location is empty");
        }
        if (location.startsWith("file:")) {
            try {
                return Paths.get(URI.create(location));
            } catch (IllegalArgumentException | FileSystemNotFoundException e) {
                throw new IllegalArgumentException("Malformed file URL: " + location, e);
            }
        }
        if (location.matches("^[a-zA-Z][a-zA-Z0-9+.-]*://.*")) {
            throw new IllegalArgumentException("Unsupported location scheme: " + location);
        }
        return Paths.get(location);
    }

    /**
     * Create the working directory of a transfer and copy its content in.
     *
     * @return the workspace reference stored on the Transfer
     */
    public String create(UUID transferId, String sourceLocation) {
        Path source = toLocalPath(sourceLocation);
        Path workspace = workspace(transferId);
        Path objects = workspace.resolve(OBJECTS_DIR);
        try {
            Files.createDirectories(objects);
            Files.createDirectories(workspace.resolve(LOGS_DIR));
            Files.createDirectories(workspace.resolve(TMP_DIR));
            if (Files.isDirectory(source)) {
                copyTree(source, objects);
            } else {
                Files.copy(source, objects.resolve(source.getFileName().toString()),
                        StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot create workspace for transfer " + transferId, e);
        }
        log.info("Workspace for transfer {} created at {} from {}", transferId, workspace, source);
        return transferId.toString();
    }

    public Path workspace(UUID transferId) {
        return root.resolve(transferId.toString());
    }

    public boolean exists(UUID transferId) {
        return Files.isDirectory(workspace(transferId));
    }

    /**
     * Regular files a per-file link runs against, relative to the workspace
     * and sorted by path.
     *
     * @param subdir workspace-relative directory; null or blank means {@code objects}
     */
    public List<String> listFiles(UUID transferId, String subdir) {
        Path workspace = workspace(transferId);
        if (!Files.isDirectory(workspace)) {
            throw new StorageUnavailableException("Workspace of transfer " + transferId + " is missing", null);
        }
        Path start = workspace.resolve(subdir == null || subdir.isBlank() ? OBJECTS_DIR : subdir).normalize();
        if (!start.startsWith(workspace)) {
            throw new IllegalArgumentException("Subdirectory escapes the workspace: " + subdir);
        }
        if (!Files.isDirectory(start)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(start)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> workspace.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot list files of transfer " + transferId, e);
        }
    }

    /** A fresh directory for the output of one task. */
    public Path taskOutputDirectory(UUID transferId, UUID jobId, String fileId) {
        String leaf = fileId == null || fileId.isEmpty() ? PACKAGE_OUTPUT : fileId;
        Path dir = workspace(transferId).resolve(TMP_DIR).resolve(jobId.toString()).resolve(leaf);
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot create task output directory " + dir, e);
        }
    }

    /**
     * Remove a transfer's working directory.
     *
     * @return false if there was nothing to delete
     */
    public boolean delete(UUID transferId) {
        Path workspace = workspace(transferId);
        if (!Files.exists(workspace)) {
            return false;
        }
        try (Stream<Path> paths = Files.walk(workspace)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot delete workspace of transfer " + transferId, e);
        }
        log.info("Workspace of transfer {} deleted", transferId);
        return true;
    }

    private static void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                        StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
