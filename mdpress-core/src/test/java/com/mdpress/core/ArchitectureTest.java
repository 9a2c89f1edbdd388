package com.mdpress.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the conversion pipeline.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Parsing packages stay independent of assembly, output and configuration</li>
 *   <li>Renderer implementations are reached only through the SPI lookup</li>
 *   <li>Utilities have no domain dependencies</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter().importPackages("com.mdpress.core");
    }

    /**
     * Front matter, inline and block parsing only produce HTML fragments; they
     * must not know how documents are assembled, written or configured.
     */
    @Test
    void parsing_shouldNotDependOnAssemblyOrOutput() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.frontmatter..", "..core.inline..", "..core.block..", "..core.html..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.document..", "..core.convert..", "..core.renderer..", "..core.config..");

        rule.check(classes);
    }

    /**
     * The style tables sit at the bottom of the pipeline.
     */
    @Test
    void htmlStyles_shouldNotDependOnParsers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.html..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.inline..", "..core.block..", "..core.frontmatter..");

        rule.check(classes);
    }

    /**
     * Renderers only see the finished page.
     */
    @Test
    void renderers_shouldNotDependOnConversion() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.convert..", "..core.document..", "..core.block..");

        rule.check(classes);
    }

    @Test
    void conversion_shouldNotDependOnRendererImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.convert..")
            .should().dependOnClassesThat().resideInAPackage("..core.renderer.impl..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.block..", "..core.document..", "..core.convert..", "..core.renderer..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void exceptions_shouldBeNamedException() {
        ArchRule rule = classes()
            .that().areAssignableTo(Exception.class)
            .should().haveSimpleNameEndingWith("Exception");

        rule.check(classes);
    }
}
