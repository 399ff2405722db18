package com.codeguard.core.analyzer.impl;

import com.codeguard.core.analyzer.AnalyzerExecutionException;
import com.codeguard.core.analyzer.AnalyzerTestBase;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.codeguard.core.model.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link BestPracticesAnalyzer}.
 */
class BestPracticesAnalyzerTest extends AnalyzerTestBase {

    private BestPracticesAnalyzer analyzer;

    @BeforeEach
    void setUpAnalyzer() {
        analyzer = new BestPracticesAnalyzer();
    }

    @Test
    void analyze_withPythonAntiPatterns_reportsEachRuleAtItsLine() throws AnalyzerExecutionException {
        // Given: Python module collecting common anti-patterns
        SourceFile file = file("bucket.py", "python", """
            from os.path import *
            counter = 0
            def add_item(item, bucket=[]):
                global counter
                try:
                    bucket.append(item)
                except:
                    pass
                if item == None:
                    print("none")
                return bucket
            """);

        // When: Analyzer is executed
        List<Finding> findings = analyze(analyzer, file);

        // Then: Every anti-pattern is reported once
        assertThat(withRule(findings, "BP-WILDCARD-IMPORT")).extracting(Finding::line).containsExactly(1);
        assertThat(withRule(findings, "BP-MUTABLE-DEFAULT")).extracting(Finding::line).containsExactly(3);
        assertThat(withRule(findings, "BP-MISSING-DOCSTRING")).extracting(Finding::line).containsExactly(3);
        assertThat(withRule(findings, "BP-GLOBAL")).extracting(Finding::line).containsExactly(4);
        assertThat(withRule(findings, "BP-BARE-EXCEPT")).extracting(Finding::line).containsExactly(7);
        assertThat(withRule(findings, "BP-EMPTY-CATCH")).extracting(Finding::line).containsExactly(7);
        assertThat(withRule(findings, "BP-NONE-COMPARISON")).extracting(Finding::line).containsExactly(9);
        assertThat(withRule(findings, "BP-DEBUG-PRINT")).extracting(Finding::line).containsExactly(10);
        assertThat(withRule(findings, "BP-BARE-EXCEPT").get(0).severity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void analyze_withDocumentedAndPrivateFunctions_reportsNoDocstringIssue() throws AnalyzerExecutionException {
        // Given: A documented public function and an undocumented private one
        SourceFile file = file("util.py", "python", """
            def documented():
                \"\"\"Returns one.\"\"\"
                return 1

            def _helper():
                return 2
            """);

        // When: Analyzer is executed
        List<Finding> findings = analyze(analyzer, file);

        // Then: Neither needs a docstring finding
        assertThat(withRule(findings, "BP-MISSING-DOCSTRING")).isEmpty();
    }

    @Test
    void analyze_withJavaScript_reportsVarLooseEqualityAndEmptyCatch() throws AnalyzerExecutionException {
        // Given: Legacy JavaScript
        SourceFile file = file("web/app.js", "javascript", """
            var count = 0;
            if (count == 1) {
              console.log("one");
            }
            try {
              run();
            } catch (e) {}
            """);

        // When: Analyzer is executed
        List<Finding> findings = analyze(analyzer, file);

        // Then: JavaScript rules apply
        assertThat(withRule(findings, "BP-VAR-DECLARATION")).extracting(Finding::line).containsExactly(1);
        assertThat(withRule(findings, "BP-LOOSE-EQUALITY")).extracting(Finding::line).containsExactly(2);
        assertThat(withRule(findings, "BP-DEBUG-PRINT")).extracting(Finding::line).containsExactly(3);
        assertThat(withRule(findings, "BP-EMPTY-CATCH")).extracting(Finding::line).containsExactly(7);
        assertThat(ruleIds(findings)).doesNotContain("BP-BARE-EXCEPT", "BP-GLOBAL");
    }

    @Test
    void analyze_withJava_reportsBroadEmptyCatchAndConsoleOutput() throws AnalyzerExecutionException {
        // Given: Java class swallowing every exception
        SourceFile file = file("src/Job.java", "java", """
            import java.util.*;
            class Job {
                void run() {
                    try {
                        work();
                    } catch (Exception e) {
                    }
                    System.out.println("done");
                }
            }
            """);

        // When: Analyzer is executed
        List<Finding> findings = analyze(analyzer, file);

        // Then: JVM rules apply
        assertThat(withRule(findings, "BP-WILDCARD-IMPORT"))
            .singleElement()
            .satisfies(f -> assertThat(f.severity()).isEqualTo(Severity.LOW));
        assertThat(withRule(findings, "BP-BROAD-CATCH")).extracting(Finding::line).containsExactly(6);
        assertThat(withRule(findings, "BP-EMPTY-CATCH")).extracting(Finding::line).containsExactly(6);
        assertThat(withRule(findings, "BP-DEBUG-PRINT")).extracting(Finding::line).containsExactly(8);
    }
}
