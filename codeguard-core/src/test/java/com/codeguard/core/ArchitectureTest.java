package com.codeguard.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Analyzers extend the two-tier base class</li>
 *   <li>Domain models and report types are immutable records</li>
 *   <li>Base classes don't depend on implementations</li>
 *   <li>Analysis, scheduling and reporting stay layered</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.codeguard.core");
    }

    /**
     * Every built-in analyzer gets Tier-2 escalation from AbstractAnalyzer.
     */
    @Test
    void analyzers_shouldExtendAbstractAnalyzer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..analyzer.impl..")
            .and().haveSimpleNameEndingWith("Analyzer")
            .should().beAssignableTo("com.codeguard.core.analyzer.base.AbstractAnalyzer");

        rule.check(classes);
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void reportTypes_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..report..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().doNotHaveSimpleName("ReportWriter")
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void baseAnalyzers_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..analyzer.base..")
            .should().dependOnClassesThat().resideInAPackage("..analyzer.impl..");

        rule.check(classes);
    }

    /**
     * Analyzers see one file and one context; they know nothing of runs or reports.
     */
    @Test
    void analyzers_shouldNotDependOnRunOrReportLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..analyzer..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..scheduler..", "..aggregator..", "..report..", "..renderer..", "..engine..");

        rule.check(classes);
    }

    @Test
    void scheduler_shouldNotDependOnReporting() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..scheduler..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..aggregator..", "..report..", "..renderer..", "..engine..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..analyzer..", "..scheduler..", "..aggregator..", "..renderer..", "..engine..");

        rule.check(classes);
    }
}
