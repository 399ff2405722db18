package com.codeguard.cli.catalog;

import com.codeguard.core.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Builds the in-memory file catalog from a directory on disk.
 *
 * <p>The engine never reads the file system itself, so the CLI materializes every
 * eligible file up front. Paths in the catalog are relative to the root and use forward
 * slashes. Version-control and build output directories are never descended into; files
 * larger than {@link #DEFAULT_MAX_FILE_BYTES} or not valid UTF-8 are left out.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * List<SourceFile> catalog = new DirectoryCatalogLoader().load(Path.of("."));
 * }</pre>
 *
 * @since 1.0.0
 */
public class DirectoryCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(DirectoryCatalogLoader.class);

    public static final long DEFAULT_MAX_FILE_BYTES = 1024L * 1024L;

    private static final Set<String> IGNORED_DIRECTORIES = Set.of(
        ".git", ".hg", ".svn", ".idea", ".vscode", "node_modules", "__pycache__",
        ".venv", "venv", "target", "build", "dist", ".gradle", ".mvn"
    );

    private final long maxFileBytes;

    public DirectoryCatalogLoader() {
        this(DEFAULT_MAX_FILE_BYTES);
    }

    public DirectoryCatalogLoader(long maxFileBytes) {
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be positive");
        }
        this.maxFileBytes = maxFileBytes;
    }

    /**
     * Loads every readable text file below a directory, sorted by relative path.
     *
     * @param root directory to walk
     * @return catalog entries
     * @throws IOException if the directory cannot be traversed
     */
    public List<SourceFile> load(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }

        List<Path> candidates;
        try (Stream<Path> paths = Files.walk(root)) {
            candidates = paths
                .filter(Files::isRegularFile)
                .filter(path -> !isInIgnoredDirectory(root.relativize(path)))
                .sorted(Comparator.comparing(path -> toCatalogPath(root, path)))
                .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        List<SourceFile> catalog = new ArrayList<>(candidates.size());
        for (Path path : candidates) {
            String relative = toCatalogPath(root, path);
            if (Files.size(path) > maxFileBytes) {
                log.debug("Skipping {}: larger than {} bytes", relative, maxFileBytes);
                continue;
            }
            String content = readText(path);
            if (content == null) {
                log.debug("Skipping {}: not UTF-8 text", relative);
                continue;
            }
            catalog.add(new SourceFile(relative, content, LanguageDetector.detect(relative)));
        }

        log.info("Loaded {} files from {}", catalog.size(), root.toAbsolutePath().normalize());
        return catalog;
    }

    private static String toCatalogPath(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private static boolean isInIgnoredDirectory(Path relative) {
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (IGNORED_DIRECTORIES.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }

    private static String readText(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        for (byte b : bytes) {
            if (b == 0) {
                return null;
            }
        }
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
