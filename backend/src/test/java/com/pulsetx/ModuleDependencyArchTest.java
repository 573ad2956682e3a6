package com.pulsetx;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain at the bottom, ledger and heart-rate sources independent of each other,
 * pipeline above both, api on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.pulsetx");
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.pulsetx.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.pulsetx.ingestion..", "com.pulsetx.heartrate..", "com.pulsetx.pipeline..",
                        "com.pulsetx.api..", "com.pulsetx.config..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_heartrate_pipeline_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.pulsetx.ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.pulsetx.heartrate..", "com.pulsetx.pipeline..", "com.pulsetx.api..");
        rule.check(classes);
    }

    @Test
    void heartrate_must_not_depend_on_ingestion_pipeline_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.pulsetx.heartrate..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.pulsetx.ingestion..", "com.pulsetx.pipeline..", "com.pulsetx.api..");
        rule.check(classes);
    }

    @Test
    void pipeline_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.pulsetx.pipeline..")
                .should().dependOnClassesThat().resideInAPackage("com.pulsetx.api..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.pulsetx.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
