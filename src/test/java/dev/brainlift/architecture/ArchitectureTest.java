package dev.brainlift.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.brainlift", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Engine, pipeline and client packages never reach into the HTTP adapter.
    @ArchTest
    static final ArchRule features_should_not_depend_on_api =
        noClasses().that().resideInAnyPackage(
                "..research..", "..ratelimit..", "..search..", "..generation..",
                "..pipeline..", "..worker..", "..graph..", "..session.."
            )
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // The shared model depends on nothing else in the application.
    @ArchTest
    static final ArchRule research_model_is_a_leaf =
        noClasses().that().resideInAPackage("dev.brainlift.research..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "dev.brainlift.ratelimit..", "dev.brainlift.search..", "dev.brainlift.generation..",
                "dev.brainlift.pipeline..", "dev.brainlift.worker..", "dev.brainlift.graph..",
                "dev.brainlift.session..", "dev.brainlift.api..", "dev.brainlift.config.."
            );

    // Both engines sit behind ResearchEngine; neither knows about the other.
    @ArchTest
    static final ArchRule engines_are_independent =
        noClasses().that().resideInAPackage("..worker..")
            .should().dependOnClassesThat().resideInAPackage("..graph..");

    @ArchTest
    static final ArchRule config_should_not_depend_on_api =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.brainlift.(*)..").should().beFreeOfCycles();
}
