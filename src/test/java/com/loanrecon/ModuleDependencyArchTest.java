package com.loanrecon;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Stage modules only look upstream: ingestion → versioning → reconciliation → provenance; compliance reads the
 * domain record only; pipeline orchestrates; api talks to pipeline services.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.loanrecon");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.loanrecon.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("com.loanrecon.ingestion..", "com.loanrecon.config..",
                        "com.loanrecon.versioning..", "com.loanrecon.reconciliation..", "com.loanrecon.provenance..",
                        "com.loanrecon.compliance..", "com.loanrecon.pipeline..", "com.loanrecon.api..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.loanrecon.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.loanrecon.domain..", "com.loanrecon.ingestion..",
                        "com.loanrecon.config..", "com.loanrecon.versioning..", "com.loanrecon.reconciliation..",
                        "com.loanrecon.provenance..", "com.loanrecon.compliance..", "com.loanrecon.pipeline..",
                        "com.loanrecon.api..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_later_stages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.loanrecon.ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage("com.loanrecon.versioning..",
                        "com.loanrecon.reconciliation..", "com.loanrecon.provenance..", "com.loanrecon.compliance..",
                        "com.loanrecon.pipeline..", "com.loanrecon.api..");
        rule.check(classes);
    }

    @Test
    void versioning_must_not_depend_on_later_stages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.loanrecon.versioning..")
                .should().dependOnClassesThat().resideInAnyPackage("com.loanrecon.reconciliation..",
                        "com.loanrecon.provenance..", "com.loanrecon.compliance..", "com.loanrecon.pipeline..",
                        "com.loanrecon.api..");
        rule.check(classes);
    }

    @Test
    void reconciliation_and_provenance_must_not_call_the_oracle() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.loanrecon.reconciliation..", "com.loanrecon.provenance..")
                .should().dependOnClassesThat().resideInAnyPackage("com.loanrecon.ingestion..",
                        "com.loanrecon.compliance..", "com.loanrecon.pipeline..", "com.loanrecon.api..");
        rule.check(classes);
    }

    @Test
    void compliance_must_only_read_the_domain_record() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.loanrecon.compliance..")
                .should().dependOnClassesThat().resideInAnyPackage("com.loanrecon.ingestion..",
                        "com.loanrecon.versioning..", "com.loanrecon.reconciliation..", "com.loanrecon.provenance..",
                        "com.loanrecon.pipeline..", "com.loanrecon.api..");
        rule.check(classes);
    }

    @Test
    void pipeline_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.loanrecon.pipeline..")
                .should().dependOnClassesThat().resideInAPackage("com.loanrecon.api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.loanrecon.api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.loanrecon.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
