package com.sdlcimport.core;

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
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Pipeline stages do not reach back into the orchestrator</li>
 *   <li>Quality checkers live in the checker package</li>
 *   <li>Utilities stay free of domain dependencies</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.sdlcimport.core");
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

    /**
     * Verifies model layer has no dependencies on the processing stages.
     */
    @Test
    void models_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..scanner..", "..detector..", "..decision..", "..reconcile..",
                "..generator..", "..renderer..", "..validator..", "..pipeline..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..scanner..", "..detector..", "..decision..", "..reconcile..", "..pipeline..");

        rule.check(classes);
    }

    /**
     * Verifies only the pipeline package orchestrates the stages.
     */
    @Test
    void stages_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..pipeline..")
            .should().dependOnClassesThat().resideInAPackage("..pipeline..");

        rule.check(classes);
    }

    @Test
    void analyzerImplementations_shouldNotDependOnValidator() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..analyzer.impl..")
            .should().dependOnClassesThat().resideInAnyPackage("..validator..", "..reconcile..");

        rule.check(classes);
    }

    @Test
    void qualityCheckers_shouldResideInCheckerPackage() {
        ArchRule rule = classes()
            .that().implement("com.sdlcimport.core.validator.QualityChecker")
            .and().areNotInterfaces()
            .should().resideInAPackage("..validator.checker..")
            .andShould().haveSimpleNameEndingWith("Checker");

        rule.check(classes);
    }
}
