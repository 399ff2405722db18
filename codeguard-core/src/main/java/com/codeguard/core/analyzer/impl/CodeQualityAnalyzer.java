package com.codeguard.core.analyzer.impl;

import com.codeguard.core.analyzer.AnalysisContext;
import com.codeguard.core.analyzer.base.AbstractJavaParserAnalyzer;
import com.codeguard.core.analyzer.base.FallbackParsingStrategy;
import com.codeguard.core.analyzer.base.RegexRule;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.codeguard.core.model.SourceFile;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Measures maintainability of source files.
 *
 * <p><b>Parsing Strategy:</b>
 * <ol>
 *   <li>Java files are parsed with JavaParser; methods and constructors are measured on the AST</li>
 *   <li>Other languages, and Java files that fail to parse, use indentation and brace heuristics</li>
 * </ol>
 *
 * <p><b>Checks:</b>
 * <ul>
 *   <li>Function length: over {@value #MAX_FUNCTION_LINES} lines is MEDIUM, over twice that is HIGH</li>
 *   <li>Cyclomatic complexity: over {@value #COMPLEXITY_HIGH} is HIGH, over {@value #COMPLEXITY_CRITICAL} is CRITICAL</li>
 *   <li>Nesting depth over {@value #MAX_NESTING_DEPTH}, parameter count over {@value #MAX_PARAMETERS}</li>
 *   <li>Classes with more than {@value #MAX_CLASS_METHODS} methods (Java only)</li>
 *   <li>Long files, long lines, TODO/FIXME markers and unreachable {@code if False} blocks</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class CodeQualityAnalyzer extends AbstractJavaParserAnalyzer {

    private static final String ANALYZER_ID = "code_quality";
    private static final String CATEGORY = "code_quality";

    static final int MAX_FUNCTION_LINES = 50;
    static final int COMPLEXITY_HIGH = 10;
    static final int COMPLEXITY_CRITICAL = 20;
    static final int MAX_NESTING_DEPTH = 4;
    static final int MAX_PARAMETERS = 5;
    static final int MAX_CLASS_METHODS = 20;
    static final int MAX_FILE_LINES = 500;
    static final int MAX_LINE_LENGTH = 120;

    private static final Set<String> LANGUAGES = Set.of(
        "python", "javascript", "typescript", "java", "kotlin", "go", "ruby", "php",
        "csharp", "cpp", "c", "rust", "scala", "swift"
    );

    private static final Pattern PYTHON_DEF = Pattern.compile("^(\\s*)(?:async\\s+)?def\\s+(\\w+)\\s*\\(([^)]*)\\)?");

    private static final Pattern BRACE_FUNCTION = Pattern.compile(
        "^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?"
            + "(?:function\\s*\\*?\\s*(\\w+)\\s*\\(([^)]*)\\)"
            + "|func\\s+(?:\\([^)]*\\)\\s*)?(\\w+)\\s*\\(([^)]*)\\)"
            + "|fn\\s+(\\w+)\\s*(?:<[^>]*>)?\\s*\\(([^)]*)\\)"
            + "|(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s+)?\\(([^)]*)\\)\\s*=>"
            + "|(?:(?:public|private|protected|static|final|override|internal|virtual)\\s+)+[\\w<>\\[\\],\\s]*?(\\w+)\\s*\\(([^)]*)\\)\\s*(?:throws\\s+[\\w.,\\s]+)?\\{?\\s*$)"
    );

    private static final Pattern DECISION_KEYWORDS = Pattern.compile(
        "\\b(if|elif|for|while|case|catch|except)\\b|&&|\\|\\||\\band\\b|\\bor\\b|\\?\\s"
    );

    private static final List<RegexRule> RULES = List.of(
        RegexRule.of("CQ-TODO", "TODO/FIXME marker", "\\b(TODO|FIXME|HACK|XXX)\\b", Severity.INFO)
            .withDescription("Unfinished work is marked in the code")
            .withSuggestion("Resolve the marker or track it in the issue tracker")
            .withConfidence(0.9)
            .includingComments(),
        RegexRule.of("CQ-DEAD-CODE", "Unreachable code block", "^\\s*(if\\s+(False|0)\\s*:|if\\s*\\(\\s*(false|0)\\s*\\))", Severity.MEDIUM)
            .withDescription("The condition is constant, so the block never executes")
            .withSuggestion("Remove the dead block or put it behind a real feature flag")
            .withConfidence(0.85)
    );

    /**
     * Measurements of one function, method or constructor.
     *
     * @param name function name
     * @param line first line
     * @param length number of lines
     * @param parameters number of parameters
     * @param complexity cyclomatic complexity
     * @param nesting maximum nesting depth of control structures
     */
    record FunctionMetrics(String name, int line, int length, int parameters, int complexity, int nesting) {}

    @Override
    public String getId() {
        return ANALYZER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Code Quality Analyzer";
    }

    @Override
    public String getDescription() {
        return "Function length, complexity, nesting, parameter counts and other maintainability issues";
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
        findings.addAll(checkFileLength(file, lines));
        findings.addAll(checkLineLength(file, lines));
        context.checkpoint();

        FileParseResult<FunctionMetrics> functions = parseWithFallback(file, lines,
            this::measureAst, fallbackFor(file));
        log.debug("Measured {} functions in {} ({})", functions.data().size(), file.path(), functions.mode());
        for (FunctionMetrics function : functions.data()) {
            findings.addAll(checkFunction(file, lines, function));
        }

        if (functions.mode() == ParseMode.AST) {
            parseJava(file).ifPresent(cu -> findings.addAll(checkGodClasses(file, lines, cu)));
        }
        return findings;
    }

    // ==================== File Checks ====================

    private List<Finding> checkFileLength(SourceFile file, List<String> lines) {
        if (lines.size() <= MAX_FILE_LINES) {
            return List.of();
        }
        return List.of(newFileFinding(file)
            .title("File too long")
            .description("File has " + lines.size() + " lines, more than " + MAX_FILE_LINES)
            .severity(lines.size() > MAX_FILE_LINES * 2 ? Severity.MEDIUM : Severity.LOW)
            .ruleId("CQ-LONG-FILE")
            .suggestion("Split the file into smaller modules with one responsibility each")
            .confidence(0.9)
            .build());
    }

    private List<Finding> checkLineLength(SourceFile file, List<String> lines) {
        int first = -1;
        int count = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).length() > MAX_LINE_LENGTH) {
                if (first < 0) {
                    first = i + 1;
                }
                count++;
            }
        }
        if (count == 0) {
            return List.of();
        }
        return List.of(newFinding(file, lines, first)
            .title("Lines exceed " + MAX_LINE_LENGTH + " characters")
            .description(count + " line(s) are longer than " + MAX_LINE_LENGTH + " characters")
            .severity(Severity.LOW)
            .ruleId("CQ-LONG-LINE")
            .suggestion("Wrap long expressions or extract variables")
            .confidence(0.9)
            .build());
    }

    // ==================== Function Checks ====================

    private List<Finding> checkFunction(SourceFile file, List<String> lines, FunctionMetrics function) {
        List<Finding> findings = new ArrayList<>();
        String name = function.name();

        if (function.length() > MAX_FUNCTION_LINES) {
            findings.add(newFinding(file, lines, function.line())
                .title("Function '" + name + "' is too long")
                .description("Function '" + name + "' has " + function.length() + " lines, the limit is " + MAX_FUNCTION_LINES)
                .severity(function.length() > MAX_FUNCTION_LINES * 2 ? Severity.HIGH : Severity.MEDIUM)
                .ruleId("CQ-LONG-FUNCTION")
                .suggestion("Extract cohesive parts into smaller functions")
                .confidence(0.9)
                .build());
        }
        if (function.complexity() > COMPLEXITY_HIGH) {
            findings.add(newFinding(file, lines, function.line())
                .title("High cyclomatic complexity in '" + name + "'")
                .description("Function '" + name + "' has cyclomatic complexity " + function.complexity())
                .severity(function.complexity() > COMPLEXITY_CRITICAL ? Severity.CRITICAL : Severity.HIGH)
                .ruleId("CQ-COMPLEXITY")
                .suggestion("Replace branching with polymorphism or lookup tables, or split the function")
                .confidence(0.85)
                .build());
        }
        if (function.nesting() > MAX_NESTING_DEPTH) {
            findings.add(newFinding(file, lines, function.line())
                .title("Deep nesting in '" + name + "'")
                .description("Control structures in '" + name + "' are nested " + function.nesting() + " levels deep")
                .severity(Severity.MEDIUM)
                .ruleId("CQ-DEEP-NESTING")
                .suggestion("Use guard clauses and early returns to flatten the code")
                .confidence(0.8)
                .build());
        }
        if (function.parameters() > MAX_PARAMETERS) {
            findings.add(newFinding(file, lines, function.line())
                .title("Too many parameters in '" + name + "'")
                .description("Function '" + name + "' takes " + function.parameters() + " parameters")
                .severity(Severity.MEDIUM)
                .ruleId("CQ-TOO-MANY-PARAMS")
                .suggestion("Group related parameters into an object")
                .confidence(0.9)
                .build());
        }
        return findings;
    }

    private List<Finding> checkGodClasses(SourceFile file, List<String> lines, CompilationUnit cu) {
        List<Finding> findings = new ArrayList<>();
        for (ClassOrInterfaceDeclaration type : cu.findAll(ClassOrInterfaceDeclaration.class)) {
            int methods = type.getMethods().size();
            if (!type.isInterface() && methods > MAX_CLASS_METHODS) {
                findings.add(newFinding(file, lines, beginLine(type))
                    .title("Class '" + type.getNameAsString() + "' has too many methods")
                    .description("Class '" + type.getNameAsString() + "' declares " + methods + " methods")
                    .severity(Severity.HIGH)
                    .ruleId("CQ-GOD-CLASS")
                    .suggestion("Split the class along its responsibilities")
                    .confidence(0.75)
                    .build());
            }
        }
        return findings;
    }

    // ==================== AST Measurement ====================

    private List<FunctionMetrics> measureAst(CompilationUnit cu) {
        List<FunctionMetrics> metrics = new ArrayList<>();
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            if (method.getBody().isPresent()) {
                metrics.add(measure(method));
            }
        }
        for (ConstructorDeclaration constructor : cu.findAll(ConstructorDeclaration.class)) {
            metrics.add(measure(constructor));
        }
        return metrics;
    }

    private static FunctionMetrics measure(CallableDeclaration<?> callable) {
        return new FunctionMetrics(
            callable.getNameAsString(),
            beginLine(callable),
            lineSpan(callable),
            callable.getParameters().size(),
            cyclomaticComplexity(callable),
            nestingDepth(callable, 0));
    }

    private static int nestingDepth(Node node, int depth) {
        int max = depth;
        for (Node child : node.getChildNodes()) {
            int childDepth = isNestingStatement(child) ? depth + 1 : depth;
            max = Math.max(max, nestingDepth(child, childDepth));
        }
        return max;
    }

    private static boolean isNestingStatement(Node node) {
        // else-if chains are IfStmt children of IfStmt and do not add depth
        if (node instanceof IfStmt && node.getParentNode().filter(IfStmt.class::isInstance).isPresent()) {
            return false;
        }
        return node instanceof IfStmt || node instanceof ForStmt || node instanceof ForEachStmt
            || node instanceof WhileStmt || node instanceof DoStmt || node instanceof TryStmt
            || node instanceof SwitchStmt;
    }

    // ==================== Fallback Measurement ====================

    private FallbackParsingStrategy<FunctionMetrics> fallbackFor(SourceFile file) {
        if ("python".equals(file.language())) {
            return (f, lines) -> measurePython(lines);
        }
        if ("ruby".equals(file.language())) {
            return FallbackParsingStrategy.noFallback();
        }
        return (f, lines) -> measureBraced(lines);
    }

    static List<FunctionMetrics> measurePython(List<String> lines) {
        List<FunctionMetrics> functions = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = PYTHON_DEF.matcher(lines.get(i));
            if (!matcher.find()) {
                continue;
            }
            int baseIndent = indentOf(lines.get(i));
            int end = i;
            for (int j = i + 1; j < lines.size(); j++) {
                String line = lines.get(j);
                if (line.isBlank()) {
                    continue;
                }
                if (indentOf(line) <= baseIndent) {
                    break;
                }
                end = j;
            }
            List<String> body = lines.subList(i, end + 1);
            functions.add(new FunctionMetrics(
                matcher.group(2),
                i + 1,
                end - i + 1,
                countPythonParameters(matcher.group(3)),
                complexityOf(body.subList(1, body.size())),
                pythonNesting(body, baseIndent)));
        }
        return functions;
    }

    static List<FunctionMetrics> measureBraced(List<String> lines) {
        List<FunctionMetrics> functions = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = BRACE_FUNCTION.matcher(lines.get(i));
            if (!matcher.find()) {
                continue;
            }
            String name = null;
            String params = "";
            for (int group = 1; group < matcher.groupCount(); group += 2) {
                if (matcher.group(group) != null) {
                    name = matcher.group(group);
                    params = matcher.group(group + 1);
                    break;
                }
            }
            if (name == null || isControlKeyword(name)) {
                continue;
            }
            int[] bodyEnd = findClosingBrace(lines, i);
            if (bodyEnd == null) {
                continue;
            }
            List<String> body = lines.subList(i, bodyEnd[0] + 1);
            functions.add(new FunctionMetrics(
                name,
                i + 1,
                bodyEnd[0] - i + 1,
                countParameters(params),
                complexityOf(body),
                Math.max(0, bodyEnd[1] - 1)));
        }
        return functions;
    }

    /**
     * Finds the line closing the block opened at or after {@code start}.
     *
     * @return {closing line index, maximum brace depth}, or null if unbalanced
     */
    private static int[] findClosingBrace(List<String> lines, int start) {
        int depth = 0;
        int maxDepth = 0;
        boolean opened = false;
        for (int i = start; i < lines.size(); i++) {
            String line = stripStrings(lines.get(i));
            for (int c = 0; c < line.length(); c++) {
                char ch = line.charAt(c);
                if (ch == '{') {
                    depth++;
                    opened = true;
                    maxDepth = Math.max(maxDepth, depth);
                } else if (ch == '}') {
                    depth--;
                    if (opened && depth == 0) {
                        return new int[] {i, maxDepth};
                    }
                }
            }
            if (!opened && i > start + 2) {
                return null;
            }
        }
        return null;
    }

    private static int pythonNesting(List<String> body, int baseIndent) {
        int unit = 0;
        int deepest = 0;
        for (int i = 1; i < body.size(); i++) {
            String line = body.get(i);
            if (line.isBlank()) {
                continue;
            }
            int relative = indentOf(line) - baseIndent;
            if (unit == 0 && relative > 0) {
                unit = relative;
            }
            deepest = Math.max(deepest, relative);
        }
        // the function body itself sits one level in
        return unit == 0 ? 0 : Math.max(0, deepest / unit - 1);
    }

    private static int complexityOf(List<String> body) {
        int complexity = 1;
        for (String line : body) {
            String code = stripStrings(line).strip();
            if (code.startsWith("#") || code.startsWith("//")) {
                continue;
            }
            Matcher matcher = DECISION_KEYWORDS.matcher(code);
            while (matcher.find()) {
                complexity++;
            }
        }
        return complexity;
    }

    private static int countPythonParameters(String params) {
        if (params == null) {
            return 0;
        }
        int count = 0;
        for (String param : params.split(",")) {
            String name = param.strip().split("[:=]")[0].strip();
            if (!name.isEmpty() && !name.equals("self") && !name.equals("cls") && !name.equals("*") && !name.equals("/")) {
                count++;
            }
        }
        return count;
    }

    private static int countParameters(String params) {
        if (params == null || params.isBlank()) {
            return 0;
        }
        int depth = 0;
        int count = 1;
        for (char ch : params.toCharArray()) {
            if (ch == '<' || ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == '>' || ch == ')' || ch == ']' || ch == '}') {
                depth--;
            } else if (ch == ',' && depth == 0) {
                count++;
            }
        }
        return count;
    }

    private static boolean isControlKeyword(String name) {
        return Set.of("if", "for", "while", "switch", "catch", "return", "new", "else").contains(name);
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

    private static String stripStrings(String line) {
        return line.replaceAll("\"(?:\\\\.|[^\"\\\\])*\"|'(?:\\\\.|[^'\\\\])*'", "\"\"");
    }
}
