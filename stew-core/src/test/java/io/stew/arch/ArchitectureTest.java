package io.stew.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void coreShouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.stew.core..")
                .should().dependOnClassesThat()
                .resideInAnyPackage(
                        "io.stew.lock..",
                        "io.stew.storage..",
                        "io.stew.container..");
        rule.check(importedMainClasses());
    }

    @Test
    void storageShouldNotDependOnLockOrContainer() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.stew.storage..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.stew.lock..", "io.stew.container..");
        rule.check(importedMainClasses());
    }

    @Test
    void lockShouldNotDependOnStorageOrContainer() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.stew.lock..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.stew.storage..", "io.stew.container..");
        rule.check(importedMainClasses());
    }

    @Test
    void mainCodeShouldNotDependOnTestPackages() {
        ArchRule rule = noClasses()
                .should().dependOnClassesThat().resideInAPackage("io.stew.logging..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.stew..");
    }
}
