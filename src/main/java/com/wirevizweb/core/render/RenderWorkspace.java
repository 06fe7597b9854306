package com.wirevizweb.core.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * A private temporary directory for one render.
 *
 * <p>Acquire with {@link #create(Path)} inside try-with-resources; {@link #close()}
 * removes the directory and everything in it, whatever happened in between.
 */
public final class RenderWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RenderWorkspace.class);

    private static final String PREFIX = "wireviz-web-";

    private final Path root;

    private RenderWorkspace(Path root) {
        this.root = root;
    }

    /**
     * Creates a uniquely named directory under {@code workRoot}, or under the
     * system temp dir when {@code workRoot} is null.
     */
    public static RenderWorkspace create(Path workRoot) {
        try {
            Path dir = workRoot == null
                    ? Files.createTempDirectory(PREFIX)
                    : Files.createTempDirectory(Files.createDirectories(workRoot), PREFIX);
            log.debug("Created render workspace {}", dir);
            return new RenderWorkspace(dir.toAbsolutePath());
        } catch (IOException e) {
            throw new StagingException("Could not create render workspace under "
                    + (workRoot == null ? "system temp dir" : workRoot), e);
        }
    }

    public Path root() {
        return root;
    }

    /**
     * Writes a file directly in the workspace root.
     */
    public Path write(String fileName, byte[] content) {
        Path target = root.resolve(fileName);
        try {
            Files.write(target, content);
            return target;
        } catch (IOException e) {
            throw new StagingException("Could not write " + fileName, e);
        }
    }

    /**
     * Writes an asset into {@code subdir}, keeping its base name. An existing
     * file with the same name is overwritten: the last upload wins.
     *
     * @throws RenderRequestException if the asset name has no usable base name
     */
    public Path writeAsset(String subdir, Asset asset) {
        String name = safeFileName(asset.filename());
        Path dir = root.resolve(subdir);
        Path target = dir.resolve(name);
        try {
            Files.createDirectories(dir);
            if (Files.exists(target)) {
                log.warn("Asset '{}' was supplied more than once; keeping the last copy", name);
            }
            Files.write(target, asset.content());
            return target;
        } catch (IOException e) {
            throw new StagingException("Could not write asset " + name, e);
        }
    }

    public byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StagingException("Could not read " + root.relativize(file), e);
        }
    }

    /**
     * Deletes the workspace recursively. Failures are logged, never thrown.
     */
    @Override
    public void close() {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(RenderWorkspace::deleteQuietly);
        } catch (IOException e) {
            log.warn("Could not walk render workspace {} for cleanup: {}", root, e.getMessage());
        }
        log.debug("Removed render workspace {}", root);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }

    /**
     * Reduces a client-supplied name to its last path segment.
     */
    static String safeFileName(String original) {
        if (original == null) {
            throw new RenderRequestException("Asset has no filename");
        }
        String normalized = original.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1).trim();
        if (name.isEmpty() || name.equals(".") || name.equals("..") || name.indexOf('\0') >= 0) {
            throw new RenderRequestException("Invalid asset filename: '" + original + "'");
        }
        return name;
    }
}
