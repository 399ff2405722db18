package com.codeguard.core.analyzer.base;

import com.codeguard.core.analyzer.AnalysisAbortedException;
import com.codeguard.core.analyzer.AnalysisContext;
import com.codeguard.core.analyzer.Analyzer;
import com.codeguard.core.analyzer.AnalyzerExecutionException;
import com.codeguard.core.analyzer.DeepInspection;
import com.codeguard.core.analyzer.DeepInspectionException;
import com.codeguard.core.analyzer.DeepInspectionRequest;
import com.codeguard.core.analyzer.DeepInspector;
import com.codeguard.core.analyzer.EscalationDecision;
import com.codeguard.core.model.AnalyzerResult;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Abstract base class for analyzers implementing the two-tier analysis contract.
 *
 * <p>Subclasses only implement {@link #analyzeTier1(SourceFile, AnalysisContext)}. This class
 * then:
 * <ol>
 *   <li>wraps unexpected runtime errors of Tier 1 into {@link AnalyzerExecutionException}</li>
 *   <li>asks the context's escalation policy whether Tier 2 should run, when the deep tier is
 *       enabled and a {@link DeepInspector} is available</li>
 *   <li>merges the deep inspection into the Tier-1 findings via {@link DeepInspectionMerger}</li>
 *   <li>falls back to the Tier-1 findings if the deep inspector fails</li>
 * </ol>
 *
 * <p>It also offers helpers for building findings with file path, line and snippet filled in.
 *
 * <p><b>Metrics</b></p>
 * <ul>
 *   <li>{@code tier1_findings}: Tier-1 finding count</li>
 *   <li>{@code tier2_used}: 1 if the deep inspection result was merged</li>
 *   <li>{@code tier2_confirmed}, {@code tier2_false_positives}, {@code tier2_findings}</li>
 *   <li>{@code tier2_failed}: 1 if the deep inspector raised an error</li>
 * </ul>
 *
 * @see Analyzer
 * @see DeepInspectionMerger
 * @since 1.0.0
 */
public abstract class AbstractAnalyzer implements Analyzer {

    private static final int MAX_SNIPPET_LENGTH = 200;

    /**
     * Logger instance for this analyzer.
     * Automatically initialized with the concrete analyzer class name.
     */
    protected final Logger log;

    protected AbstractAnalyzer() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Runs the deterministic checks of this analyzer.
     *
     * @param file file to analyze
     * @param context task context, used for {@link AnalysisContext#checkpoint()}
     * @return Tier-1 findings
     * @throws AnalyzerExecutionException if the file cannot be analyzed
     */
    protected abstract List<Finding> analyzeTier1(SourceFile file, AnalysisContext context)
        throws AnalyzerExecutionException;

    /**
     * Describes what the deep inspection should concentrate on for this analyzer.
     *
     * @return focus text passed to the deep inspector
     */
    protected String getDeepInspectionFocus() {
        return getDescription();
    }

    @Override
    public final AnalyzerResult analyze(SourceFile file, AnalysisContext context) throws AnalyzerExecutionException {
        List<Finding> tier1;
        try {
            tier1 = analyzeTier1(file, context);
        } catch (AnalyzerExecutionException | AnalysisAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalyzerExecutionException(getId(), file.path(),
                e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        if (tier1 == null) {
            tier1 = List.of();
        }

        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("tier1_findings", tier1.size());
        metrics.put("tier2_used", 0);

        Optional<DeepInspector> inspector = context.deepInspector();
        if (!context.config().useDeepTier() || inspector.isEmpty()) {
            return new AnalyzerResult(tier1, metrics, false);
        }

        context.checkpoint();
        EscalationDecision decision = context.escalationPolicy()
            .decide(file, tier1, context.config(), context.random());
        log.debug("Escalation for {} by {}: {} ({})", file.path(), getId(), decision.escalate(), decision.reason());
        if (!decision.escalate()) {
            return new AnalyzerResult(tier1, metrics, false);
        }

        try {
            DeepInspection inspection = inspector.get().inspect(
                new DeepInspectionRequest(file, getId(), getCategory(), getDeepInspectionFocus(), tier1));
            context.checkpoint();

            DeepInspectionMerger.Merge merge = DeepInspectionMerger.merge(tier1, inspection, file.path(), getCategory());
            metrics.put("tier2_used", 1);
            metrics.put("tier2_confirmed", merge.confirmed());
            metrics.put("tier2_false_positives", merge.falsePositives());
            metrics.put("tier2_findings", merge.added());
            return new AnalyzerResult(merge.findings(), metrics, true);
        } catch (DeepInspectionException e) {
            log.warn("Deep inspection failed for {} ({}), keeping Tier-1 findings: {}",
                file.path(), getId(), e.getMessage());
            metrics.put("tier2_failed", 1);
            return new AnalyzerResult(tier1, metrics, false);
        } catch (AnalysisAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Deep inspector crashed for {} ({}), keeping Tier-1 findings", file.path(), getId(), e);
            metrics.put("tier2_failed", 1);
            return new AnalyzerResult(tier1, metrics, false);
        }
    }

    // ==================== Finding Helpers ====================

    /**
     * Starts a finding for this analyzer's category at the given line.
     *
     * @param file analyzed file
     * @param lines file lines, used for the snippet
     * @param line 1-based line number
     * @return builder with category, path, line and snippet set
     */
    protected Finding.Builder newFinding(SourceFile file, List<String> lines, int line) {
        Finding.Builder builder = Finding.builder()
            .category(getCategory())
            .filePath(file.path())
            .line(line);
        if (line >= 1 && line <= lines.size()) {
            builder.codeSnippet(snippet(lines.get(line - 1)));
        }
        return builder;
    }

    /**
     * Starts a finding that applies to the whole file.
     *
     * @param file analyzed file
     * @return builder with category and path set
     */
    protected Finding.Builder newFileFinding(SourceFile file) {
        return Finding.builder()
            .category(getCategory())
            .filePath(file.path());
    }

    /**
     * Splits content into lines.
     *
     * @param file file
     * @return lines without terminators
     */
    protected List<String> lines(SourceFile file) {
        return file.content().lines().toList();
    }

    /**
     * Trims a source line for display.
     *
     * @param line raw line
     * @return stripped line, truncated to 200 characters
     */
    protected static String snippet(String line) {
        String stripped = line.strip();
        return stripped.length() > MAX_SNIPPET_LENGTH
            ? stripped.substring(0, MAX_SNIPPET_LENGTH) + "..."
            : stripped;
    }
}
