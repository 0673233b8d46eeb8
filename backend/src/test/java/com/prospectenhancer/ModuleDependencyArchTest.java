package com.prospectenhancer;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common stay at the bottom, the model gateway knows nothing of the
 * pipeline above it, and runners sit on top of the engine.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.prospectenhancer");
    }

    @Test
    void domain_must_only_depend_on_itself() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..enhancement..", "..cleanup..", "..config..", "..common..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..enhancement..", "..cleanup..", "..config..");
        rule.check(classes);
    }

    @Test
    void gateway_must_not_depend_on_pipeline() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..enhancement.gateway..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..domain..", "..enhancement.parser..", "..enhancement.setaside..", "..enhancement.engine..",
                        "..enhancement.job..", "..enhancement.queue..", "..enhancement.audit..");
        rule.check(classes);
    }

    @Test
    void engine_must_not_depend_on_runners() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..enhancement.engine..", "..enhancement.parser..", "..enhancement.setaside..")
                .should().dependOnClassesThat().resideInAnyPackage("..enhancement.job..", "..enhancement.queue..", "..cleanup..");
        rule.check(classes);
    }

    @Test
    void queue_must_not_depend_on_iterative_runner() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..enhancement.queue..")
                .should().dependOnClassesThat().resideInAPackage("..enhancement.job..");
        rule.check(classes);
    }

    @Test
    void cleanup_must_not_depend_on_enhancement() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..cleanup..")
                .should().dependOnClassesThat().resideInAPackage("..enhancement..");
        rule.check(classes);
    }

    @Test
    void no_cycles_between_top_level_modules() {
        ArchRule rule = slices().matching("com.prospectenhancer.(*)..").should().beFreeOfCycles();
        rule.check(classes);
    }
}
