package com.codeguard.core.analyzer.base;

import com.codeguard.core.model.SourceFile;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Abstract base class for analyzers that inspect Java sources through the JavaParser AST and
 * fall back to regular expressions for other languages or unparseable files.
 *
 * <p>Provides:
 * <ul>
 *   <li>per-thread JavaParser instances (JavaParser itself is not thread-safe)</li>
 *   <li>{@link #parseWithFallback} implementing AST first, regex second</li>
 *   <li>AST metrics helpers such as {@link #cyclomaticComplexity(CallableDeclaration)}</li>
 * </ul>
 *
 * @see AbstractRegexAnalyzer
 * @since 1.0.0
 */
public abstract class AbstractJavaParserAnalyzer extends AbstractRegexAnalyzer {

    private static final ThreadLocal<JavaParser> PARSER = ThreadLocal.withInitial(() ->
        new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)));

    protected AbstractJavaParserAnalyzer() {
        super();
    }

    /**
     * How a file was read.
     */
    public enum ParseMode {
        /** Parsed into a JavaParser AST. */
        AST,
        /** AST parsing failed or not applicable, regex fallback used. */
        FALLBACK
    }

    /**
     * Result of {@link #parseWithFallback}.
     *
     * @param data extracted items
     * @param mode how the items were extracted
     * @param <T> extracted type
     */
    public record FileParseResult<T>(List<T> data, ParseMode mode) {
        public FileParseResult {
            data = data == null ? List.of() : List.copyOf(data);
        }
    }

    // ==================== Java File Parsing ====================

    /**
     * Parses Java source into a compilation unit.
     *
     * @param file Java source file
     * @return compilation unit, empty if parsing failed
     */
    protected Optional<CompilationUnit> parseJava(SourceFile file) {
        ParseResult<CompilationUnit> result = PARSER.get().parse(file.content());
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult();
        }
        log.debug("Failed to parse Java file: {}", file.path());
        result.getProblems().forEach(problem -> log.debug("  - {}", problem.getMessage()));
        return Optional.empty();
    }

    /**
     * Extracts data via the AST for Java files and via the fallback otherwise.
     *
     * @param file analyzed file
     * @param lines its lines
     * @param astExtractor AST extraction for Java files
     * @param fallbackStrategy regex extraction
     * @param <T> extracted type
     * @return extracted data and the mode used
     */
    protected <T> FileParseResult<T> parseWithFallback(
            SourceFile file,
            List<String> lines,
            Function<CompilationUnit, List<T>> astExtractor,
            FallbackParsingStrategy<T> fallbackStrategy) {
        if ("java".equals(file.language())) {
            Optional<CompilationUnit> cu = parseJava(file);
            if (cu.isPresent()) {
                return new FileParseResult<>(astExtractor.apply(cu.get()), ParseMode.AST);
            }
            log.debug("AST parsing failed for {}, attempting fallback", file.path());
        }
        return new FileParseResult<>(fallbackStrategy.parse(file, lines), ParseMode.FALLBACK);
    }

    // ==================== AST Metrics ====================

    /**
     * Computes McCabe cyclomatic complexity of a method or constructor.
     *
     * @param callable method or constructor
     * @return 1 plus the number of decision points
     */
    protected static int cyclomaticComplexity(CallableDeclaration<?> callable) {
        int complexity = 1;
        complexity += callable.findAll(IfStmt.class).size();
        complexity += callable.findAll(ForStmt.class).size();
        complexity += callable.findAll(ForEachStmt.class).size();
        complexity += callable.findAll(WhileStmt.class).size();
        complexity += callable.findAll(DoStmt.class).size();
        complexity += callable.findAll(CatchClause.class).size();
        complexity += callable.findAll(ConditionalExpr.class).size();
        complexity += (int) callable.findAll(SwitchEntry.class).stream()
            .filter(entry -> !entry.getLabels().isEmpty())
            .count();
        complexity += (int) callable.findAll(BinaryExpr.class).stream()
            .filter(expr -> expr.getOperator() == BinaryExpr.Operator.AND
                || expr.getOperator() == BinaryExpr.Operator.OR)
            .count();
        return complexity;
    }

    /**
     * Returns the number of source lines a node spans.
     *
     * @param node AST node
     * @return line span, 0 without position information
     */
    protected static int lineSpan(Node node) {
        return node.getRange()
            .map(range -> range.end.line - range.begin.line + 1)
            .orElse(0);
    }

    /**
     * Returns the first line of a node.
     *
     * @param node AST node
     * @return 1-based line, or 1 without position information
     */
    protected static int beginLine(Node node) {
        return node.getBegin().map(position -> position.line).orElse(1);
    }
}
