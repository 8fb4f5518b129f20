package com.binauditor.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Checks extend the shared base class and are grouped by concern</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Base classes don't depend on implementations</li>
 *   <li>Models and utilities stay free of engine dependencies</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.binauditor.core");
    }

    /**
     * Verifies all check implementations extend AbstractCheck.
     */
    @Test
    void checks_shouldExtendAbstractCheck() {
        ArchRule rule = classes()
            .that().resideInAPackage("..check.impl..")
            .and().haveSimpleNameEndingWith("Check")
            .should().beAssignableTo("com.binauditor.core.check.base.AbstractCheck");

        rule.check(classes);
    }

    @Test
    void checks_shouldBeInConcernPackages() {
        ArchRule rule = classes()
            .that().resideInAPackage("..check.impl..")
            .and().haveSimpleNameEndingWith("Check")
            .should().resideInAnyPackage("..structure..", "..crypto..", "..security..");

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
    void baseClasses_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..check.base..", "..sbom.base..")
            .should().dependOnClassesThat().resideInAnyPackage("..check.impl..", "..sbom.impl..");

        rule.check(classes);
    }

    /**
     * Verifies parsers never reach into checks: parsing describes the binary, checks judge it.
     */
    @Test
    void formats_shouldNotDependOnChecks() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..format..")
            .should().dependOnClassesThat().resideInAnyPackage("..check..", "..renderer..", "..sbom..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..check..", "..format..", "..crypto..", "..renderer..", "..sbom..", "..inspect..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnChecks() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..check..", "..sbom..", "..renderer..");

        rule.check(classes);
    }
}
