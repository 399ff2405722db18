package com.codeguard.core.analyzer.impl;

import com.codeguard.core.analyzer.AnalysisContext;
import com.codeguard.core.analyzer.base.AbstractRegexAnalyzer;
import com.codeguard.core.analyzer.base.RegexRule;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.codeguard.core.model.SourceFile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flags code patterns with poor runtime characteristics.
 *
 * <p>Line rules cover {@code SELECT *}, blocking sleeps, whole-file reads and regular
 * expressions prone to catastrophic backtracking. Loop-sensitive checks track enclosing
 * loops with an indentation stack, which works for both indentation-based and
 * conventionally formatted brace languages:
 * <ul>
 *   <li>a loop inside one loop is HIGH (O(n²)), inside two or more is CRITICAL</li>
 *   <li>database queries inside a loop (N+1) are CRITICAL</li>
 *   <li>string concatenation and file opening inside a loop are HIGH</li>
 *   <li>regex compilation inside a loop is MEDIUM</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PerformanceAnalyzer extends AbstractRegexAnalyzer {

    private static final String ANALYZER_ID = "performance";
    private static final String CATEGORY = "performance";

    private static final Set<String> LANGUAGES = Set.of(
        "python", "javascript", "typescript", "java", "kotlin", "go", "ruby", "php",
        "csharp", "cpp", "c", "rust", "scala", "swift", "sql"
    );

    private static final Pattern LOOP_HEADER = Pattern.compile(
        "^\\s*(?:for|while|foreach)\\b|\\.forEach\\s*\\(|\\.each\\s+do\\b"
    );

    private static final Pattern STRING_CONCAT = Pattern.compile(
        "\\w+\\s*\\+=\\s*(?:f?[\"']|str\\(|String\\.valueOf)|\\b(\\w+)\\s*=\\s*\\1\\s*\\+\\s*[\"']"
    );

    private static final Pattern QUERY_CALL = Pattern.compile(
        "\\b(?:cursor\\.execute|executeQuery|executeUpdate)\\s*\\(|\\.objects\\.(?:get|filter)\\s*\\(|\\.query\\s*\\(|\\.execute\\s*\\(\\s*[\"'`]"
    );

    private static final Pattern FILE_OPEN = Pattern.compile(
        "\\bopen\\s*\\(|new\\s+File(?:InputStream|Reader)\\s*\\(|readFileSync\\s*\\(|Files\\.read\\w*\\s*\\("
    );

    private static final Pattern REGEX_COMPILE = Pattern.compile(
        "\\bre\\.compile\\s*\\(|Pattern\\.compile\\s*\\(|new\\s+RegExp\\s*\\(|regexp\\.MustCompile\\s*\\("
    );

    private static final List<RegexRule> RULES = List.of(
        RegexRule.of("PERF-SELECT-STAR", "SELECT * query", "(?i)\\bSELECT\\s+\\*\\s+FROM\\b", Severity.MEDIUM)
            .withDescription("Selecting all columns transfers unused data and breaks when the schema changes")
            .withSuggestion("List only the columns the code needs")
            .withConfidence(0.8),
        RegexRule.of("PERF-BLOCKING-SLEEP", "Blocking sleep call", "\\btime\\.sleep\\s*\\(|\\bThread\\.sleep\\s*\\(", Severity.LOW)
            .withDescription("Sleeping blocks the thread and often hides a missing synchronization or retry policy")
            .withSuggestion("Use scheduled execution, back-off utilities or async waiting")
            .withConfidence(0.6),
        RegexRule.of("PERF-READ-ALL", "Whole file read into memory", "\\.read(?:lines)?\\(\\s*\\)|\\bFiles\\.readAllBytes\\s*\\(", Severity.MEDIUM)
            .withDescription("Reading an entire file at once scales memory with the file size")
            .withSuggestion("Stream the file line by line or in chunks")
            .withConfidence(0.5),
        RegexRule.of("PERF-REGEX-BACKTRACKING", "Regex with nested quantifiers", "\\([^()]*[+*]\\)[+*{]", Severity.MEDIUM)
            .withDescription("Nested quantifiers can cause catastrophic backtracking on crafted input")
            .withSuggestion("Rewrite the expression without nested repetition or use possessive quantifiers")
            .withConfidence(0.6)
    );

    @Override
    public String getId() {
        return ANALYZER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Performance Analyzer";
    }

    @Override
    public String getDescription() {
        return "Nested loops, N+1 queries, string building in loops and other performance anti-patterns";
    }

    @Override
    public String getCategory() {
        return CATEGORY;
    }

    @Override
    public Set<String> getSupportedLanguages() {
        return LANGUAGES;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of();
    }

    @Override
    protected List<RegexRule> getRules() {
        return RULES;
    }

    @Override
    protected List<Finding> additionalChecks(SourceFile file, List<String> lines, AnalysisContext context) {
        List<Finding> findings = new ArrayList<>();
        Deque<Integer> loopIndents = new ArrayDeque<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || isComment(line, file.language())) {
                continue;
            }
            int indent = indentOf(line);
            while (!loopIndents.isEmpty() && indent <= loopIndents.peek()) {
                loopIndents.pop();
            }
            int depth = loopIndents.size();
            int lineNumber = i + 1;

            if (LOOP_HEADER.matcher(line).find()) {
                if (depth >= 1) {
                    findings.add(nestedLoop(file, lines, lineNumber, depth));
                }
                loopIndents.push(indent);
                continue;
            }
            if (depth == 0) {
                continue;
            }
            if (QUERY_CALL.matcher(line).find()) {
                findings.add(newFinding(file, lines, lineNumber)
                    .title("Database query inside loop")
                    .description("A query runs once per iteration (N+1 query pattern)")
                    .severity(Severity.CRITICAL)
                    .ruleId("PERF-QUERY-IN-LOOP")
                    .suggestion("Fetch the data in one batched query before the loop")
                    .confidence(0.75)
                    .build());
            }
            if (STRING_CONCAT.matcher(line).find()) {
                findings.add(newFinding(file, lines, lineNumber)
                    .title("String concatenation in loop")
                    .description("Repeated concatenation copies the string on every iteration")
                    .severity(Severity.HIGH)
                    .ruleId("PERF-STRING-CONCAT-LOOP")
                    .suggestion("Collect parts in a list and join them, or use a StringBuilder")
                    .confidence(0.7)
                    .build());
            }
            if (FILE_OPEN.matcher(line).find()) {
                findings.add(newFinding(file, lines, lineNumber)
                    .title("File opened inside loop")
                    .description("Opening files per iteration multiplies I/O cost")
                    .severity(Severity.HIGH)
                    .ruleId("PERF-FILE-IN-LOOP")
                    .suggestion("Open the file once outside the loop or batch the reads")
                    .confidence(0.7)
                    .build());
            }
            if (REGEX_COMPILE.matcher(line).find()) {
                findings.add(newFinding(file, lines, lineNumber)
                    .title("Regex compiled inside loop")
                    .description("The pattern is compiled again on every iteration")
                    .severity(Severity.MEDIUM)
                    .ruleId("PERF-REGEX-IN-LOOP")
                    .suggestion("Compile the pattern once, outside the loop")
                    .confidence(0.8)
                    .build());
            }
        }
        return findings;
    }

    private Finding nestedLoop(SourceFile file, List<String> lines, int lineNumber, int enclosing) {
        boolean cubic = enclosing >= 2;
        return newFinding(file, lines, lineNumber)
            .title(cubic ? "Triple nested loop detected" : "Nested loop detected")
            .description(cubic
                ? "Loop nested " + (enclosing + 1) + " levels deep, O(n³) or worse"
                : "Loop inside another loop, O(n²) complexity")
            .severity(cubic ? Severity.CRITICAL : Severity.HIGH)
            .ruleId("PERF-NESTED-LOOP")
            .suggestion("Use a set or map lookup, or restructure the algorithm")
            .confidence(0.7)
            .build();
    }

    private static int indentOf(String line) {
        int indent = 0;
        for (char ch : line.toCharArray()) {
            if (ch == ' ') {
                indent++;
            } else if (ch == '\t') {
                indent += 4;
            } else {
                break;
            }
        }
        return indent;
    }
}
