package io.unistr.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void hashShouldNotDependOnOtherModules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.unistr.hash..")
                .should().dependOnClassesThat()
                .resideInAnyPackage(
                        "io.unistr.core..",
                        "io.unistr.storage..",
                        "io.unistr.index..",
                        "io.unistr.store..");
        rule.check(importedMainClasses());
    }

    @Test
    void coreShouldNotDependOnOtherModules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.unistr.core..")
                .should().dependOnClassesThat()
                .resideInAnyPackage(
                        "io.unistr.hash..",
                        "io.unistr.storage..",
                        "io.unistr.index..",
                        "io.unistr.store..");
        rule.check(importedMainClasses());
    }

    @Test
    void storageShouldNotDependOnIndexOrStore() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.unistr.storage..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.unistr.index..", "io.unistr.store..");
        rule.check(importedMainClasses());
    }

    @Test
    void indexShouldNotDependOnStore() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.unistr.index..")
                .should().dependOnClassesThat().resideInAPackage("io.unistr.store..");
        rule.check(importedMainClasses());
    }

    @Test
    void mainCodeShouldNotDependOnTestSupport() {
        ArchRule rule = noClasses()
                .should().dependOnClassesThat().resideInAnyPackage("..logging..", "org.junit..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.unistr");
    }
}
