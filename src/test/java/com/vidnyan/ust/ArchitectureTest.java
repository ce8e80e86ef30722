package com.vidnyan.ust;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.vidnyan.ust");
    }

    @Test
    void domain_ShouldNotDependOnOuterLayers() {
        noClasses().that().resideInAPackage("..ust.domain..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("..ust.application..", "..ust.adapter..", "..ust.config..")
                .check(classes);
    }

    @Test
    void domain_ShouldNotDependOnFrameworks() {
        noClasses().that().resideInAPackage("..ust.domain..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("org.springframework..", "com.fasterxml.jackson..",
                        "com.github.javaparser..", "org.treesitter..")
                .check(classes);
    }

    @Test
    void application_ShouldNotDependOnAdapters() {
        noClasses().that().resideInAPackage("..ust.application..")
                .should().dependOnClassesThat().resideInAPackage("..ust.adapter..")
                .check(classes);
    }

    @Test
    void parserAdapters_ShouldNotDependOnEachOther() {
        noClasses().that().resideInAPackage("..parser.python..")
                .should().dependOnClassesThat().resideInAnyPackage("..parser.java..", "..parser.javascript..")
                .check(classes);
        noClasses().that().resideInAPackage("..parser.javascript..")
                .should().dependOnClassesThat().resideInAnyPackage("..parser.java..", "..parser.python..")
                .check(classes);
    }
}
