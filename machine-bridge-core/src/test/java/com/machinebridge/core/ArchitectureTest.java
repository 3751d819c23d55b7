package com.machinebridge.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the core module.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Digraph model types are immutable records</li>
 *   <li>The model depends on nothing else in the module</li>
 *   <li>Extraction never reaches into patching or the project layer</li>
 *   <li>Source parsers are reached through the parser SPI only</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.machinebridge.core");
    }

    /**
     * Verifies digraph model types are records, with interfaces only as polymorphic roots.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.ast..", "..core.extraction..", "..core.codechange..",
                "..core.patch..", "..core.project..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void extraction_shouldNotDependOnPatching() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.extraction..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.codechange..", "..core.patch..", "..core.project..");

        rule.check(classes);
    }

    @Test
    void codeChanges_shouldNotDependOnPatchingOrProject() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.codechange..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.patch..", "..core.project..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomainPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.ast..", "..core.extraction..", "..core.patch..", "..core.project..");

        rule.check(classes);
    }

    /**
     * Verifies language-specific parsers are only known to the parser SPI registration.
     */
    @Test
    void parserImplementations_shouldOnlyBeUsedWithinTheirPackage() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..core.ast.javascript..")
            .should().dependOnClassesThat().resideInAPackage("..core.ast.javascript..");

        rule.check(classes);
    }
}
