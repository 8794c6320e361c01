package com.sourcelint.core;

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
 *   <li>Rules extend the common base class</li>
 *   <li>Rule implementations are grouped by category</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The syntax model stays independent of rules and readers</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.sourcelint.core");
    }

    /**
     * Verifies all rule implementations extend AbstractRule, so they share logging
     * and violation construction.
     */
    @Test
    void rules_shouldExtendAbstractRule() {
        ArchRule rule = classes()
            .that().resideInAPackage("..rule.impl..")
            .and().haveSimpleNameEndingWith("Rule")
            .should().beAssignableTo("com.sourcelint.core.rule.base.AbstractRule");

        rule.check(classes);
    }

    @Test
    void rules_shouldBeInCategoryPackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..rule.impl..")
            .and().haveSimpleNameEndingWith("Rule")
            .should().resideInAnyPackage("..idiomatic..", "..metrics..");

        rule.check(classes);
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
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
    void baseRules_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..rule.base..")
            .should().dependOnClassesThat().resideInAPackage("..rule.impl..");

        rule.check(classes);
    }

    /**
     * Verifies the syntax model does not know how it is produced or consumed.
     */
    @Test
    void syntax_shouldNotDependOnRulesOrReaders() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.syntax..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.rule..", "..core.sourcekit..", "..core.lint..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnRulesOrEngine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.rule..", "..core.lint..", "..core.report..");

        rule.check(classes);
    }
}
