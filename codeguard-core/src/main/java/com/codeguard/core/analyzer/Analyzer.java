package com.codeguard.core.analyzer;

import com.codeguard.core.model.AnalyzerResult;
import com.codeguard.core.model.SourceFile;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Set;

/**
 * Interface for analyzers that report findings about one source file.
 *
 * <p>Analyzers are discovered via Java Service Provider Interface (SPI). Each analyzer
 * inspects one aspect of the code (security, dependencies, code quality, etc.) and produces
 * an {@link AnalyzerResult} for every file the scheduler hands to it.
 *
 * <p>Analysis runs in two tiers. Tier 1 is deterministic, bounded pattern matching that never
 * calls out of process. Tier 2 is an optional deep inspection that only runs when the
 * {@link EscalationPolicy} in the {@link AnalysisContext} agrees. Implementations normally
 * extend {@link com.codeguard.core.analyzer.base.AbstractAnalyzer}, which implements the
 * escalation and merge contract once for all analyzers.
 *
 * <p>Implementations must be stateless or thread-safe: the scheduler calls
 * {@link #analyze(SourceFile, AnalysisContext)} concurrently for different files.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codeguard.core.analyzer.Analyzer}
 *
 * @see AnalysisContext
 * @see AnalyzerRegistry
 * @since 1.0.0
 */
public interface Analyzer {

    /**
     * Wildcard language accepted by analyzers that apply to every file.
     */
    String ANY_LANGUAGE = "*";

    /**
     * Returns unique identifier for this analyzer.
     *
     * <p>Used in configuration ({@code enabled_agents}) and in the report. Should be
     * snake_case (e.g., "security", "code_quality").
     *
     * @return unique analyzer identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this analyzer.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns a one-line description of what this analyzer looks for.
     *
     * @return description
     */
    String getDescription();

    /**
     * Returns the category assigned to findings of this analyzer.
     *
     * @return finding category
     */
    String getCategory();

    /**
     * Returns set of languages this analyzer supports.
     *
     * <p>Common values: "java", "python", "javascript", "typescript", "go". The value
     * {@link #ANY_LANGUAGE} matches every file.
     *
     * @return supported language identifiers
     */
    Set<String> getSupportedLanguages();

    /**
     * Returns glob patterns of files this analyzer handles regardless of language.
     *
     * <p>Examples: {@code "package.json"}, {@code "requirements*.txt"}, {@code "Dockerfile"}.
     * Patterns without a directory part are matched against the file name.
     *
     * @return glob patterns, empty if only languages are used
     */
    Set<String> getSupportedFilePatterns();

    /**
     * Checks whether this analyzer can process the given file.
     *
     * <p>The scheduler never creates a task for a file this method rejects.
     *
     * @param file catalog entry
     * @return true if the file's language or path matches the declared capabilities
     */
    default boolean supports(SourceFile file) {
        Set<String> languages = getSupportedLanguages();
        if (languages.contains(ANY_LANGUAGE) || languages.contains(file.language())) {
            return true;
        }
        for (String pattern : getSupportedFilePatterns()) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            String target = pattern.contains("/") ? file.path() : file.fileName();
            if (matcher.matches(Path.of(target))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Analyzes one file.
     *
     * <p>This method should:
     * <ol>
     *   <li>Run the Tier-1 checks over {@link SourceFile#content()}</li>
     *   <li>Call {@link AnalysisContext#checkpoint()} between expensive steps</li>
     *   <li>Consult the escalation policy and run Tier 2 when it agrees</li>
     *   <li>Return the merged findings with metrics</li>
     * </ol>
     *
     * <p>A file that cannot be analyzed must surface as {@link AnalyzerExecutionException}
     * rather than a partial result.
     *
     * @param file file to analyze
     * @param context per-task context with configuration, deadline and deep inspector
     * @return findings and metrics
     * @throws AnalyzerExecutionException if the analyzer cannot complete
     */
    AnalyzerResult analyze(SourceFile file, AnalysisContext context) throws AnalyzerExecutionException;
}
