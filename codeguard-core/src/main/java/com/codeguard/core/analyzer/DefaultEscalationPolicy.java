package com.codeguard.core.analyzer;

import com.codeguard.core.config.AnalysisConfig;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.codeguard.core.model.SourceFile;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Standard escalation rules, evaluated in order with the first match winning:
 * <ol>
 *   <li>any Tier-1 finding is {@link Severity#CRITICAL}: escalate to verify it</li>
 *   <li>the file is shorter than {@link #DEFAULT_MIN_LINES} lines: skip</li>
 *   <li>the file is a configuration file (json, yaml, xml, toml, ini, ...): skip</li>
 *   <li>the control-flow keyword count exceeds {@link #DEFAULT_COMPLEXITY_THRESHOLD}: escalate</li>
 *   <li>otherwise escalate with probability {@link AnalysisConfig#deepTierSampleRate()}</li>
 * </ol>
 *
 * <p>The random source is only consulted in the last step, so a file decided by an earlier
 * rule never advances it.
 *
 * @since 1.0.0
 */
public class DefaultEscalationPolicy implements EscalationPolicy {

    public static final int DEFAULT_MIN_LINES = 20;
    public static final int DEFAULT_COMPLEXITY_THRESHOLD = 15;

    static final Set<String> CONFIG_EXTENSIONS = Set.of(
        "json", "yaml", "yml", "xml", "toml", "ini", "properties", "cfg", "conf"
    );

    private static final Pattern CONTROL_FLOW_KEYWORD = Pattern.compile(
        "\\b(if|else|elif|for|while|try|except|catch|switch|case)\\b"
    );

    private final int minLines;
    private final int complexityThreshold;

    public DefaultEscalationPolicy() {
        this(DEFAULT_MIN_LINES, DEFAULT_COMPLEXITY_THRESHOLD);
    }

    public DefaultEscalationPolicy(int minLines, int complexityThreshold) {
        this.minLines = minLines;
        this.complexityThreshold = complexityThreshold;
    }

    @Override
    public EscalationDecision decide(SourceFile file, List<Finding> tier1Findings, AnalysisConfig config, Random random) {
        boolean hasCritical = tier1Findings.stream().anyMatch(f -> f.severity() == Severity.CRITICAL);
        if (hasCritical) {
            return EscalationDecision.escalate(EscalationDecision.Reason.CRITICAL_FINDING);
        }
        if (file.lineCount() < minLines) {
            return EscalationDecision.skip(EscalationDecision.Reason.BELOW_MINIMUM_SIZE);
        }
        if (isConfigurationFile(file)) {
            return EscalationDecision.skip(EscalationDecision.Reason.CONFIGURATION_FILE);
        }
        if (estimateComplexity(file.content()) > complexityThreshold) {
            return EscalationDecision.escalate(EscalationDecision.Reason.HIGH_COMPLEXITY);
        }
        return random.nextDouble() < config.deepTierSampleRate()
            ? EscalationDecision.escalate(EscalationDecision.Reason.SAMPLED)
            : EscalationDecision.skip(EscalationDecision.Reason.NOT_SAMPLED);
    }

    /**
     * Classifies files that hold configuration rather than logic.
     *
     * @param file catalog entry
     * @return true for configuration extensions and {@code .env} files
     */
    public static boolean isConfigurationFile(SourceFile file) {
        String name = file.fileName();
        return CONFIG_EXTENSIONS.contains(file.extension())
            || name.equals(".env")
            || name.startsWith(".env.");
    }

    /**
     * Counts control-flow keywords as whole words.
     *
     * @param content source text
     * @return keyword count
     */
    public static int estimateComplexity(String content) {
        Matcher matcher = CONTROL_FLOW_KEYWORD.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
