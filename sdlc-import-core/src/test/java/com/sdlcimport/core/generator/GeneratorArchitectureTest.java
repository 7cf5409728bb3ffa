package com.sdlcimport.core.generator;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.methods;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_USE_FIELD_INJECTION;

/**
 * ArchUnit tests for the diagram generator layer.
 *
 * <p>Generators only see the technology landscape, so they must stay free of the
 * scanning, reconciliation and rendering stages.
 */
class GeneratorArchitectureTest {

    private static JavaClasses generatorClasses;

    @BeforeAll
    static void setUp() {
        generatorClasses = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_JARS)
            .importPackages("com.sdlcimport.core.generator");
    }

    @Test
    void allGeneratorImplementationsShouldImplementDiagramGenerator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .and().haveSimpleNameEndingWith("Generator")
            .should().implement(DiagramGenerator.class)
            .because("all generator implementations must implement the DiagramGenerator interface");

        rule.check(generatorClasses);
    }

    @Test
    void generatorImplementationsShouldResideInImplPackage() {
        ArchRule rule = classes()
            .that().implement(DiagramGenerator.class)
            .and().areNotInterfaces()
            .should().resideInAPackage("..generator.impl..")
            .andShould().bePublic()
            .because("generator implementations should be public classes in the impl package");

        rule.check(generatorClasses);
    }

    @Test
    void generatorsShouldNotUseFieldInjection() {
        NO_CLASSES_SHOULD_USE_FIELD_INJECTION.check(generatorClasses);
    }

    @Test
    void generatorImplementationsShouldOnlyDependOnAllowedLayers() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .should().onlyDependOnClassesThat()
                .resideInAnyPackage(
                    "..generator.impl..",
                    "com.sdlcimport.core.generator",
                    "com.sdlcimport.core.model..",
                    "com.sdlcimport.core.util..",
                    "java..",
                    "org.slf4j.."
                )
            .because("generator implementations should only depend on generator API, model, util, and standard libraries");

        rule.check(generatorClasses);
    }

    @Test
    void generatorsShouldNotThrowGenericExceptions() {
        ArchRule rule = methods()
            .that().areDeclaredInClassesThat().implement(DiagramGenerator.class)
            .should().notDeclareThrowableOfType(Exception.class)
            .andShould().notDeclareThrowableOfType(Throwable.class)
            .because("generators should throw specific exceptions, not generic Exception");

        rule.check(generatorClasses);
    }
}
