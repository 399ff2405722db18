package com.codeguard.core.analyzer.impl;

import com.codeguard.core.analyzer.AnalysisContext;
import com.codeguard.core.analyzer.base.AbstractRegexAnalyzer;
import com.codeguard.core.analyzer.base.RegexRule;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.codeguard.core.model.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks language idioms and error-handling hygiene.
 *
 * <p><b>Python:</b> bare and broad {@code except}, mutable default arguments, {@code global},
 * wildcard imports, {@code open()} outside a {@code with} block, comparisons to {@code None},
 * missing docstrings on public functions.
 *
 * <p><b>JavaScript/TypeScript:</b> {@code var} declarations, loose equality, {@code console.log}.
 *
 * <p><b>Java:</b> catching {@code Exception}/{@code Throwable}, wildcard imports,
 * {@code System.out} and {@code printStackTrace()}.
 *
 * <p>Empty exception handlers are detected for every supported language.
 *
 * @since 1.0.0
 */
public class BestPracticesAnalyzer extends AbstractRegexAnalyzer {

    private static final String ANALYZER_ID = "best_practices";
    private static final String CATEGORY = "best_practices";

    private static final Set<String> PYTHON = Set.of("python");
    private static final Set<String> JS = Set.of("javascript", "typescript");
    private static final Set<String> JVM = Set.of("java", "kotlin", "scala");

    private static final Set<String> LANGUAGES = Set.of(
        "python", "javascript", "typescript", "java", "kotlin", "scala", "csharp", "php", "go", "ruby"
    );

    private static final Pattern PYTHON_EXCEPT = Pattern.compile("^(\\s*)except\\b.*:\\s*$");
    private static final Pattern EMPTY_CATCH_INLINE = Pattern.compile("\\bcatch\\s*(?:\\([^)]*\\))?\\s*\\{\\s*}");
    private static final Pattern CATCH_OPEN = Pattern.compile("\\bcatch\\s*(?:\\([^)]*\\))?\\s*\\{\\s*$");
    private static final Pattern PUBLIC_PYTHON_DEF = Pattern.compile("^(\\s*)def\\s+([a-zA-Z]\\w*)\\s*\\(.*:\\s*$");

    private static final List<RegexRule> RULES = List.of(
        RegexRule.of("BP-BARE-EXCEPT", "Bare except clause", "^\\s*except\\s*:", Severity.HIGH)
            .withDescription("A bare except also catches SystemExit and KeyboardInterrupt and hides real errors")
            .withSuggestion("Catch the specific exceptions the block can handle")
            .withLanguages(PYTHON)
            .withConfidence(0.95),
        RegexRule.of("BP-BROAD-EXCEPT", "Overly broad exception handler",
                "^\\s*except\\s+\\(?\\s*(?:Exception|BaseException)\\b[^:]*:", Severity.MEDIUM)
            .withDescription("Catching Exception handles every error the same way")
            .withSuggestion("Catch specific exception types")
            .withLanguages(PYTHON)
            .withConfidence(0.8),
        RegexRule.of("BP-BROAD-CATCH", "Overly broad exception handler",
                "\\bcatch\\s*\\(\\s*(?:final\\s+)?(?:Exception|Throwable)\\s+\\w+\\s*\\)", Severity.MEDIUM)
            .withDescription("Catching Exception or Throwable handles every error the same way")
            .withSuggestion("Catch specific exception types")
            .withLanguages(JVM)
            .withConfidence(0.7),
        RegexRule.of("BP-WILDCARD-IMPORT", "Wildcard import", "^\\s*from\\s+\\S+\\s+import\\s+\\*", Severity.MEDIUM)
            .withDescription("Wildcard imports pollute the namespace and hide where names come from")
            .withSuggestion("Import the names explicitly")
            .withLanguages(PYTHON)
            .withConfidence(0.95),
        RegexRule.of("BP-WILDCARD-IMPORT", "Wildcard import", "^\\s*import\\s+(?:static\\s+)?[\\w.]+\\.\\*\\s*;", Severity.LOW)
            .withDescription("Wildcard imports hide where types come from")
            .withSuggestion("Import the types explicitly")
            .withLanguages(JVM)
            .withConfidence(0.9),
        RegexRule.of("BP-MUTABLE-DEFAULT", "Mutable default argument",
                "\\bdef\\s+\\w+\\s*\\([^)]*=\\s*(?:\\[\\s*]|\\{\\s*}|list\\(\\)|dict\\(\\)|set\\(\\))", Severity.HIGH)
            .withDescription("The default object is created once and shared between calls")
            .withSuggestion("Default to None and create the object inside the function")
            .withLanguages(PYTHON)
            .withConfidence(0.95),
        RegexRule.of("BP-GLOBAL", "Use of global statement", "^\\s*global\\s+\\w+", Severity.MEDIUM)
            .withDescription("Global mutable state makes code hard to test and reason about")
            .withSuggestion("Pass state explicitly or encapsulate it in a class")
            .withLanguages(PYTHON)
            .withConfidence(0.9),
        RegexRule.of("BP-OPEN-WITHOUT-WITH", "File opened without context manager", "^\\s*\\w+\\s*=\\s*open\\s*\\(", Severity.MEDIUM)
            .withDescription("The file is not closed if an exception occurs before close()")
            .withSuggestion("Use 'with open(...) as f:'")
            .withLanguages(PYTHON)
            .withConfidence(0.8),
        RegexRule.of("BP-NONE-COMPARISON", "Comparison to None with equality operator", "[=!]=\\s*None\\b", Severity.LOW)
            .withDescription("Equality operators can be overridden; identity comparison is reliable")
            .withSuggestion("Use 'is None' or 'is not None'")
            .withLanguages(PYTHON)
            .withConfidence(0.9),
        RegexRule.of("BP-DEBUG-PRINT", "Debug print statement", "^\\s*print\\s*\\(", Severity.LOW)
            .withDescription("print() output bypasses the logging configuration")
            .withSuggestion("Use the logging module")
            .withLanguages(PYTHON)
            .withConfidence(0.5),
        RegexRule.of("BP-DEBUG-PRINT", "Debug console statement", "\\bconsole\\.(?:log|debug)\\s*\\(", Severity.LOW)
            .withDescription("Console output left in production code")
            .withSuggestion("Remove the statement or use a logger")
            .withLanguages(JS)
            .withConfidence(0.7),
        RegexRule.of("BP-DEBUG-PRINT", "Direct console output", "\\bSystem\\.(?:out|err)\\.print|\\.printStackTrace\\s*\\(\\s*\\)", Severity.LOW)
            .withDescription("Output to the standard streams bypasses the logging configuration")
            .withSuggestion("Use a logger such as SLF4J")
            .withLanguages(JVM)
            .withConfidence(0.7),
        RegexRule.of("BP-VAR-DECLARATION", "Use of var declaration", "^\\s*var\\s+\\w+", Severity.LOW)
            .withDescription("var is function-scoped and hoisted, which causes subtle bugs")
            .withSuggestion("Use const or let")
            .withLanguages(JS)
            .withConfidence(0.9),
        RegexRule.of("BP-LOOSE-EQUALITY", "Loose equality operator", "[^=!<>]\\s(?:==|!=)\\s[^=]", Severity.LOW)
            .withDescription("== and != apply type coercion")
            .withSuggestion("Use === and !==")
            .withLanguages(JS)
            .withConfidence(0.7)
    );

    @Override
    public String getId() {
        return ANALYZER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Best Practices Analyzer";
    }

    @Override
    public String getDescription() {
        return "Exception handling, imports, global state and language idioms";
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
        if ("python".equals(file.language())) {
            findings.addAll(checkPythonEmptyHandlers(file, lines));
            findings.addAll(checkDocstrings(file, lines));
        } else {
            findings.addAll(checkEmptyCatchBlocks(file, lines));
        }
        return findings;
    }

    private List<Finding> checkPythonEmptyHandlers(SourceFile file, List<String> lines) {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < lines.size() - 1; i++) {
            if (!PYTHON_EXCEPT.matcher(lines.get(i)).matches()) {
                continue;
            }
            String next = nextCodeLine(lines, i + 1);
            if (next != null && (next.equals("pass") || next.equals("..."))) {
                findings.add(emptyHandler(file, lines, i + 1));
            }
        }
        return findings;
    }

    private List<Finding> checkEmptyCatchBlocks(SourceFile file, List<String> lines) {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (EMPTY_CATCH_INLINE.matcher(line).find()) {
                findings.add(emptyHandler(file, lines, i + 1));
            } else if (CATCH_OPEN.matcher(line).find()) {
                String next = nextCodeLine(lines, i + 1);
                if (next != null && next.startsWith("}")) {
                    findings.add(emptyHandler(file, lines, i + 1));
                }
            }
        }
        return findings;
    }

    private List<Finding> checkDocstrings(SourceFile file, List<String> lines) {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = PUBLIC_PYTHON_DEF.matcher(lines.get(i));
            if (!matcher.matches()) {
                continue;
            }
            String next = nextCodeLine(lines, i + 1);
            if (next != null && !next.startsWith("\"\"\"") && !next.startsWith("'''")) {
                findings.add(newFinding(file, lines, i + 1)
                    .title("Missing docstring for '" + matcher.group(2) + "'")
                    .description("Public function '" + matcher.group(2) + "' has no docstring")
                    .severity(Severity.LOW)
                    .ruleId("BP-MISSING-DOCSTRING")
                    .suggestion("Describe what the function does, its arguments and return value")
                    .confidence(0.6)
                    .build());
            }
        }
        return findings;
    }

    private Finding emptyHandler(SourceFile file, List<String> lines, int line) {
        return newFinding(file, lines, line)
            .title("Empty exception handler")
            .description("The exception is silently swallowed")
            .severity(Severity.MEDIUM)
            .ruleId("BP-EMPTY-CATCH")
            .suggestion("Log the exception, handle it, or let it propagate")
            .confidence(0.9)
            .build();
    }

    private static String nextCodeLine(List<String> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            String stripped = lines.get(i).strip();
            if (!stripped.isEmpty() && !stripped.startsWith("#") && !stripped.startsWith("//")) {
                return stripped;
            }
        }
        return null;
    }
}
