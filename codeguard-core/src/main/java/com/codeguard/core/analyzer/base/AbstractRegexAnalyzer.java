package com.codeguard.core.analyzer.base;

import com.codeguard.core.analyzer.AnalysisContext;
import com.codeguard.core.analyzer.AnalyzerExecutionException;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;

/**
 * Abstract base class for analyzers whose Tier 1 is line-oriented regular expression matching.
 *
 * <p>Subclasses declare their catalog in {@link #getRules()} and may add checks that need
 * more than one line in {@link #additionalChecks(SourceFile, List, AnalysisContext)}. The
 * rule loop calls {@link AnalysisContext#checkpoint()} before every rule, so a slow catalog
 * still honors the task deadline.
 *
 * <p>This base class is used by the security, performance and best-practices analyzers.
 *
 * <h3>When to Use This Base Class</h3>
 * <p>Use AbstractRegexAnalyzer when:</p>
 * <ul>
 *   <li>the check is expressible per line</li>
 *   <li>the analyzer must cover languages without a Java AST parser</li>
 * </ul>
 *
 * @see AbstractAnalyzer
 * @see RegexRule
 * @since 1.0.0
 */
public abstract class AbstractRegexAnalyzer extends AbstractAnalyzer {

    private static final Set<String> HASH_COMMENT_LANGUAGES = Set.of(
        "python", "ruby", "shell", "yaml", "dockerfile", "toml", "perl", "r"
    );

    private static final Set<String> DASH_COMMENT_LANGUAGES = Set.of("sql", "lua");

    protected AbstractRegexAnalyzer() {
        super();
    }

    /**
     * Returns the line rules of this analyzer.
     *
     * @return rules in evaluation order
     */
    protected abstract List<RegexRule> getRules();

    /**
     * Hook for checks that span several lines or need state.
     *
     * @param file analyzed file
     * @param lines file lines
     * @param context task context
     * @return additional findings
     * @throws AnalyzerExecutionException if the file cannot be analyzed
     */
    protected List<Finding> additionalChecks(SourceFile file, List<String> lines, AnalysisContext context)
        throws AnalyzerExecutionException {
        return List.of();
    }

    /**
     * Lets subclasses veto a single match, e.g. placeholder secrets.
     *
     * @param rule matching rule
     * @param match the match
     * @param line the matched line
     * @return true to report the match
     */
    protected boolean acceptMatch(RegexRule rule, MatchResult match, String line) {
        return true;
    }

    @Override
    protected List<Finding> analyzeTier1(SourceFile file, AnalysisContext context) throws AnalyzerExecutionException {
        List<String> lines = lines(file);
        List<Finding> findings = new ArrayList<>(applyRules(file, lines, getRules(), context));
        context.checkpoint();
        findings.addAll(additionalChecks(file, lines, context));
        return findings;
    }

    /**
     * Applies rules line by line. A rule reports at most one finding per line.
     *
     * @param file analyzed file
     * @param lines file lines
     * @param rules rules to apply
     * @param context task context
     * @return findings in rule order, then line order
     */
    protected List<Finding> applyRules(SourceFile file, List<String> lines, List<RegexRule> rules, AnalysisContext context) {
        List<Finding> findings = new ArrayList<>();
        for (RegexRule rule : rules) {
            context.checkpoint();
            if (!rule.appliesTo(file.language())) {
                continue;
            }
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (rule.skipComments() && isComment(line, file.language())) {
                    continue;
                }
                Matcher matcher = rule.pattern().matcher(line);
                if (matcher.find() && acceptMatch(rule, matcher.toMatchResult(), line)) {
                    findings.add(toFinding(file, lines, i + 1, rule));
                }
            }
        }
        return findings;
    }

    /**
     * Converts a rule match into a finding.
     *
     * @param file analyzed file
     * @param lines file lines
     * @param line 1-based line number
     * @param rule matching rule
     * @return finding
     */
    protected Finding toFinding(SourceFile file, List<String> lines, int line, RegexRule rule) {
        return newFinding(file, lines, line)
            .title(rule.title())
            .description(rule.description())
            .severity(rule.severity())
            .suggestion(rule.suggestion())
            .ruleId(rule.ruleId())
            .references(rule.references())
            .confidence(rule.confidence())
            .build();
    }

    /**
     * Checks whether a line is a comment line in the given language.
     *
     * @param line source line
     * @param language file language
     * @return true for whole-line comments
     */
    protected static boolean isComment(String line, String language) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return false;
        }
        if (HASH_COMMENT_LANGUAGES.contains(language)) {
            return trimmed.startsWith("#");
        }
        if (DASH_COMMENT_LANGUAGES.contains(language)) {
            return trimmed.startsWith("--");
        }
        return trimmed.startsWith("//") || trimmed.startsWith("/*") || trimmed.startsWith("* ") || trimmed.equals("*");
    }
}
