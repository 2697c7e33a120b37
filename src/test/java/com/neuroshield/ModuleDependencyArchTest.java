package com.neuroshield;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Module boundaries: the ledger knows nothing about its readers, readers never reach into the API or wiring.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.neuroshield");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..governance..", "..mirror..", "..risk..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..governance..", "..mirror..", "..risk..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void governance_must_not_depend_on_readers_api_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..governance..")
                .should().dependOnClassesThat().resideInAnyPackage("..mirror..", "..risk..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void mirror_must_not_depend_on_risk_api_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..mirror..")
                .should().dependOnClassesThat().resideInAnyPackage("..risk..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void risk_must_not_depend_on_api_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..risk..")
                .should().dependOnClassesThat().resideInAnyPackage("..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void risk_fusion_is_pure() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..risk.fusion..")
                .should().dependOnClassesThat().resideInAnyPackage("..governance..", "..mirror..", "..risk.ml..", "org.springframework..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.neuroshield.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
