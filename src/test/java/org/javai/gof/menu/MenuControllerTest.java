package org.javai.gof.menu;

import org.javai.gof.Category;
import org.javai.gof.DemoContext;
import org.javai.gof.Failure;
import org.javai.gof.StubDemo;
import org.javai.gof.boundary.DemoBoundary;
import org.javai.gof.catalog.DemoRegistry;
import org.javai.gof.catalog.PatternCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MenuControllerTest {

    private ByteArrayOutputStream output;
    private List<Failure> reportedFailures;
    private DemoBoundary boundary;
    private StubDemo factory;
    private StubDemo singleton;
    private StubDemo broken;

    @BeforeEach
    void setUp() {
        output = new ByteArrayOutputStream();
        reportedFailures = new ArrayList<>();
        boundary = DemoBoundary.withReporter(reportedFailures::add);
        factory = StubDemo.named("Factory Method");
        singleton = StubDemo.named("Singleton");
        broken = StubDemo.failing("Adapter", new IllegalStateException("boom"));
    }

    private PatternCatalog catalog() {
        DemoRegistry registry = DemoRegistry.builder()
                .register("SingletonDemo", Category.CREATIONAL, c -> singleton)
                .register("FactoryMethodDemo", Category.CREATIONAL, c -> factory)
                .register("AdapterDemo", Category.STRUCTURAL, c -> broken)
                .build();
        return PatternCatalog.discover(registry, DemoContext.immediate(System.out), boundary);
    }

    private MenuController controller(String input) {
        Terminal terminal = new StreamTerminal(
                new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8),
                false);
        return new MenuController(catalog(), terminal, boundary);
    }

    private String run(String input) {
        controller(input).run();
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void quit_printsExitingAndStops() {
        String text = run("q\n");

        assertThat(text).startsWith(MenuController.BANNER);
        assertThat(text).contains("Main Menu:", "Q. Quit", MenuController.EXITING);
    }

    @Test
    void quit_isCaseInsensitive() {
        assertThat(run("Q\n")).contains(MenuController.EXITING);
    }

    @Test
    void endOfInput_terminatesWithoutExitMessage() {
        String text = run("");

        assertThat(text).contains("Main Menu:");
        assertThat(text).doesNotContain(MenuController.EXITING);
    }

    @Test
    void blankLine_redisplaysMenuSilently() {
        String text = run("\n   \nq\n");

        assertThat(text.split("Main Menu:", -1)).hasSize(4);
        assertThat(text).doesNotContain(MenuController.INVALID_OPTION);
    }

    @Test
    void unknownOption_isRejected() {
        String text = run("9\nq\n");

        assertThat(text).contains(MenuController.INVALID_OPTION);
        assertThat(text).endsWith(MenuController.EXITING + System.lineSeparator());
    }

    @Test
    void categoryBack_returnsToMainMenu() {
        String text = run("1\n0\nq\n");

        assertThat(text).contains("Creational Patterns:", "1. Factory Method", "2. Singleton", "0. Back to Main Menu");
        assertThat(factory.runs()).isZero();
        assertThat(singleton.runs()).isZero();
    }

    @Test
    void selectingPattern_runsDemoThenPauses() {
        String text = run("1\n2\n\nq\n");

        assertThat(singleton.runs()).isEqualTo(1);
        assertThat(factory.runs()).isZero();
        assertThat(text).contains(
                "Singleton Pattern",
                "-".repeat("Singleton".length() + 8),
                "Description: Singleton description",
                "Press Enter to continue...");
        assertThat(text).contains(MenuController.EXITING);
    }

    @Test
    void failingDemo_isReportedInlineAndMenuContinues() {
        String text = run("2\n1\n\nq\n");

        assertThat(broken.runs()).isEqualTo(1);
        assertThat(text).contains("Error during demonstration: boom");
        assertThat(text).contains(MenuController.EXITING);
        assertThat(reportedFailures).singleElement()
                .satisfies(f -> assertThat(f.operation()).isEqualTo("Adapter"));
    }

    @Test
    void emptyCategory_printsNoPatternsFound() {
        String text = run("3\nq\n");

        assertThat(text).contains("No patterns found for category: Behavioral");
        assertThat(text).doesNotContain("Behavioral Patterns:");
    }

    @Test
    void invalidSelection_isRejectedAfterPause() {
        String text = run("1\n7\n\nq\n");

        assertThat(text).contains(MenuController.INVALID_SELECTION);
        assertThat(factory.runs()).isZero();
        assertThat(singleton.runs()).isZero();
    }

    @Test
    void nonNumericSelection_isRejected() {
        assertThat(run("1\nabc\n\nq\n")).contains(MenuController.INVALID_SELECTION);
    }

    @Test
    void showAll_listsGroupsInOrder() {
        String text = run("4\n\nq\n");

        assertThat(text).contains("All Available Patterns:");
        int creational = text.indexOf("Creational:");
        int factoryLine = text.indexOf("  - Factory Method");
        int singletonLine = text.indexOf("  - Singleton");
        int structural = text.indexOf("Structural:");
        int adapterLine = text.indexOf("  - Adapter");

        assertThat(creational).isPositive();
        assertThat(factoryLine).isGreaterThan(creational);
        assertThat(singletonLine).isGreaterThan(factoryLine);
        assertThat(structural).isGreaterThan(singletonLine);
        assertThat(adapterLine).isGreaterThan(structural);
        assertThat(text).doesNotContain("Behavioral:");
    }

    @Test
    void endOfInputInsideCategory_terminates() {
        String text = run("1\n");

        assertThat(text).contains("Select a pattern: ");
        assertThat(text).doesNotContain(MenuController.EXITING);
    }

    @Test
    void step_mainMenuChoice_returnsCategoryState() {
        MenuController controller = controller("2\n");

        MenuState next = controller.step(MenuState.MAIN_MENU);

        assertThat(next).isEqualTo(new MenuState.CategoryList(Category.STRUCTURAL));
        assertThat(next.isTerminal()).isFalse();
    }

    @Test
    void step_allPatterns_returnsToMainMenu() {
        MenuController controller = controller("\n");

        assertThat(controller.step(MenuState.ALL_PATTERNS)).isEqualTo(MenuState.MAIN_MENU);
    }

    @Test
    void step_terminated_staysTerminated() {
        MenuController controller = controller("");

        assertThat(controller.step(MenuState.TERMINATED).isTerminal()).isTrue();
    }

    @Test
    void clearScreen_enabled_writesAnsiSequence() {
        Terminal terminal = new StreamTerminal(
                new BufferedReader(new StringReader("q\n")),
                new PrintStream(output, true, StandardCharsets.UTF_8),
                true);

        new MenuController(catalog(), terminal, boundary).run();

        assertThat(output.toString(StandardCharsets.UTF_8)).startsWith("\033[H\033[2J");
    }
}
