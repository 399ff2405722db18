package com.codeguard.core.analyzer.base;

import com.codeguard.core.model.SourceFile;

import java.util.List;

/**
 * Regex-based extraction used when JavaParser cannot parse a file.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * FallbackParsingStrategy<Finding> fallback = (file, lines) -> scanFunctionsWithRegex(file, lines);
 * }</pre>
 *
 * @param <T> extracted type
 * @since 1.0.0
 */
@FunctionalInterface
public interface FallbackParsingStrategy<T> {

    /**
     * Extracts data from raw lines.
     *
     * @param file file that failed to parse
     * @param lines its lines
     * @return extracted data, empty if nothing found
     */
    List<T> parse(SourceFile file, List<String> lines);

    /**
     * Strategy that extracts nothing.
     *
     * @param <T> extracted type
     * @return no-op strategy
     */
    static <T> FallbackParsingStrategy<T> noFallback() {
        return (file, lines) -> List.of();
    }
}
