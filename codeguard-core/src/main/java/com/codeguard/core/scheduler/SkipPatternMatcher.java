package com.codeguard.core.scheduler;

import com.codeguard.core.config.ConfigurationException;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Matches catalog paths against skip globs.
 *
 * <ul>
 *   <li>{@code *.min.js}: no slash, matched against the file name</li>
 *   <li>{@code node_modules/*}: a directory exclusion, matching that directory at any depth</li>
 *   <li>{@code src/gen/**}: any other pattern is matched against the path at any depth</li>
 * </ul>
 *
 * <p>An invalid glob is a configuration error.
 *
 * @since 1.0.0
 */
public class SkipPatternMatcher {

    private final List<PathMatcher> nameMatchers = new ArrayList<>();
    private final List<PathMatcher> pathMatchers = new ArrayList<>();

    public SkipPatternMatcher(List<String> patterns) {
        if (patterns == null) {
            return;
        }
        for (String raw : patterns) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String pattern = raw.strip().replace('\\', '/');
            if (pattern.startsWith("./")) {
                pattern = pattern.substring(2);
            }
            if (!pattern.contains("/")) {
                nameMatchers.add(compile(raw, pattern));
            } else if (pattern.endsWith("/*") || pattern.endsWith("/**")) {
                String directory = pattern.substring(0, pattern.lastIndexOf('/'));
                // {**/,} because ** does not match zero directories
                pathMatchers.add(compile(raw, "{**/,}" + directory + "/**"));
            } else {
                pathMatchers.add(compile(raw, "{**/,}" + pattern));
            }
        }
    }

    /**
     * @param filePath catalog path, forward slashes
     * @return true if the path must not be analyzed
     */
    public boolean matches(String filePath) {
        String normalized = filePath.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            return false;
        }
        Path path = Path.of(normalized);
        Path fileName = path.getFileName();
        for (PathMatcher matcher : nameMatchers) {
            if (fileName != null && matcher.matches(fileName)) {
                return true;
            }
        }
        for (PathMatcher matcher : pathMatchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    private static PathMatcher compile(String raw, String glob) {
        try {
            return FileSystems.getDefault().getPathMatcher("glob:" + glob);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid skip pattern '" + raw + "': " + e.getDescription(), e);
        }
    }
}
