package com.codeguard.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One entry of the file catalog handed to the engine.
 *
 * <p>The catalog is materialized in memory by whoever acquires the sources; the engine never
 * touches the file system for analysis.</p>
 *
 * @param path repository-relative path using forward slashes
 * @param content file content as text
 * @param language detected language identifier such as {@code "python"} or {@code "java"}
 * @since 1.0.0
 */
public record SourceFile(
    String path,
    String content,
    String language
) {
    /**
     * Compact constructor with validation.
     */
    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        path = path.replace('\\', '/');
        if (content == null) {
            content = "";
        }
        language = language == null ? "unknown" : language.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the number of lines in the content.
     *
     * @return line count, 0 for empty content
     */
    public int lineCount() {
        if (content.isEmpty()) {
            return 0;
        }
        return (int) content.lines().count();
    }

    /**
     * Returns the last path segment.
     *
     * @return file name
     */
    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Returns the lowercase extension without the dot.
     *
     * @return extension, or empty string when the file name has none
     */
    public String extension() {
        String name = fileName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
