package com.hsformatter.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.hsformatter.plugins.FileType;

class FormatterCliTest {
    private static final String UNFORMATTED =
            "module Inventory.Stock (addStock, removeStock, transferStock, stockLevel, reorderPoint) where\n";
    private static final String FORMATTED = "module Inventory.Stock\n"
            + "  ( addStock\n"
            + "  , removeStock\n"
            + "  , transferStock\n"
            + "  , stockLevel\n"
            + "  , reorderPoint\n"
            + "  ) where\n";

    @TempDir
    Path tempDir;

    private Path project;
    private String configOption;

    @BeforeEach
    void setUp() throws IOException {
        project = Files.createDirectories(tempDir.resolve("project"));
        configOption = "--config=" + tempDir.resolve("absent.yml");
    }

    @AfterEach
    void tearDown() {
        FileType.clearCache();
    }

    private int run(String... args) {
        return FormatterCli.run(args);
    }

    @Test
    void formatRewritesFilesInPlace() throws IOException {
        Path file = project.resolve("Stock.hs");
        Files.writeString(file, UNFORMATTED);

        int exitCode = run("format", project.toString(), configOption, "--no-color", "--threads=1");

        assertThat(exitCode).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(file)).isEqualTo(FORMATTED);
    }

    @Test
    void formatReportsUnparsableFiles() throws IOException {
        Path broken = project.resolve("Broken.hs");
        Files.writeString(broken, "total = (1 + 2\n");
        Files.writeString(project.resolve("Stock.hs"), UNFORMATTED);

        int exitCode = run("format", project.toString(), configOption, "--no-color", "--threads=2");

        assertThat(exitCode).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(Files.readString(broken)).isEqualTo("total = (1 + 2\n");
        assertThat(Files.readString(project.resolve("Stock.hs"))).isEqualTo(FORMATTED);
    }

    @Test
    void checkFailsOnlyWhenFormattingWouldChangeSomething() throws IOException {
        Path file = project.resolve("Stock.hs");
        Files.writeString(file, UNFORMATTED);

        assertThat(run("check", file.toString(), configOption, "--no-color")).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(Files.readString(file)).isEqualTo(UNFORMATTED);

        Files.writeString(file, FORMATTED);
        assertThat(run("check", file.toString(), configOption, "--no-color", "--ci")).isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void lintFailsOnlyOnErrors() throws IOException {
        Path file = project.resolve("Main.hs");
        Files.writeString(file, "module Main where\n\nmain = pure ()\n");

        assertThat(run("lint", project.toString(), configOption, "--no-color")).isEqualTo(FormatterCli.EXIT_OK);

        Files.writeString(project.resolve("Broken.hs"), "main = [1, 2\n");
        assertThat(run("lint", project.toString(), configOption, "--no-color")).isEqualTo(FormatterCli.EXIT_FAILURE);
    }

    @Test
    void ignoredDirectoriesAreSkipped() throws IOException {
        Path build = Files.createDirectories(project.resolve("dist-newstyle/build"));
        Path generated = build.resolve("Stock.hs");
        Files.writeString(generated, UNFORMATTED);
        Path config = tempDir.resolve("ignore.yml");
        Files.writeString(config, "general:\n  ignoreFiles:\n    - \"dist-newstyle/**\"\n");

        int exitCode = run("format", project.toString(), "--config=" + config, "--no-color");

        assertThat(exitCode).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(generated)).isEqualTo(UNFORMATTED);
    }

    @Test
    void initWritesConfigOnlyOnceUnlessForced() throws IOException {
        Path config = tempDir.resolve("conf/.hsformatter.yml");

        assertThat(run("init", "--config=" + config)).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(config)).contains("indentWidth", "haskell");

        Files.writeString(config, "general: {}\n");
        assertThat(run("init", "--config=" + config)).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(config)).isEqualTo("general: {}\n");

        assertThat(run("init", "--config=" + config, "--force")).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(config)).contains("maxLineLength");
    }

    @Test
    void usageErrorsFail() {
        assertThat(run()).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(run("reformat", "--no-color")).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(run("format", "--no-color")).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(run("format", tempDir.resolve("absent").toString())).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(run("--version")).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(run("-h", "--no-color")).isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void ignorePatterns() {
        Path base = Path.of("repo");
        List<String> patterns = List.of("dist-newstyle/**", "**/Generated.hs", "src/*.hs-boot", "Setup.hs");

        assertThat(FormatterCli._isIgnored(base.resolve("dist-newstyle/build/A.hs"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("src/Api/Generated.hs"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("src/Types.hs-boot"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("Setup.hs"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("src/Main.hs"), base, patterns)).isFalse();
        assertThat(FormatterCli._isIgnored(base.resolve("src/Main.hs"), base, List.of())).isFalse();
    }

    @Test
    void includePatterns() {
        Path file = Path.of("src/Shop/CartOrders.hs");

        assertThat(FormatterCli._matchesIncludePattern(file, null)).isTrue();
        assertThat(FormatterCli._matchesIncludePattern(file, "*.hs")).isTrue();
        assertThat(FormatterCli._matchesIncludePattern(file, "Cart*")).isTrue();
        assertThat(FormatterCli._matchesIncludePattern(file, "Orders")).isTrue();
        assertThat(FormatterCli._matchesIncludePattern(file, "*.hs-boot")).isFalse();
        assertThat(FormatterCli._matchesIncludePattern(file, "Order*")).isFalse();
    }
}
