package com.hsformatter.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.hsformatter.api.FormatterPlugin;
import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.ConfigurationLoader;
import com.hsformatter.config.FormatterConfig;
import com.hsformatter.plugins.FileType;
import com.hsformatter.plugins.haskell.HaskellFormatter;

class CodeFormatterEngineTest {
    private static final String FORMATTED = "module Shop.Cart (total) where\n\ntotal :: Int\ntotal = 1\n";

    @TempDir
    Path tempDir;

    private CodeFormatterEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CodeFormatterEngine(ConfigurationLoader.loadDefaultConfig());
        engine.registerPlugin(FileType.HASKELL, new HaskellFormatter());
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.close();
        FileType.clearCache();
    }

    @Test
    void formatsFilesOfARegisteredType() {
        FormatterResult result = engine.formatFile(tempDir.resolve("Cart.hs"), FORMATTED);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo(FORMATTED);
        assertThat(engine.getProcessedFileCount()).isEqualTo(1);
        assertThat(engine.getSuccessCount()).isEqualTo(1);
    }

    @Test
    void unregisteredTypeFails() {
        FormatterResult result = engine.formatFile(tempDir.resolve("Types.hs-boot"), FORMATTED);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(engine.hasPluginFor(FileType.HASKELL_BOOT)).isFalse();
        assertThat(engine.getProcessedFileCount()).isZero();
    }

    @Test
    void invalidUtf8IsAnEncodingError() throws IOException {
        Path file = tempDir.resolve("Bad.hs");
        Files.write(file, new byte[] {'m', (byte) 0xC3, '\n'});

        FormatterResult result = engine.formatPath(file);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isNull();
        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.ENCODING_ERROR);
        assertThat(engine.lintPath(file)).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.ENCODING_ERROR);
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    void directoryRunIsolatesFailures() throws IOException {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("Cart.hs"), FORMATTED, StandardCharsets.UTF_8);
        Files.writeString(src.resolve("Broken.hs"), "total = (1 + 2\n", StandardCharsets.UTF_8);
        Files.writeString(src.resolve("README.md"), "# shop\n", StandardCharsets.UTF_8);

        Map<Path, FormatterResult> results = engine.formatDirectory(tempDir, 2);

        assertThat(results).containsOnlyKeys(src.resolve("Cart.hs"), src.resolve("Broken.hs"));
        assertThat(results.get(src.resolve("Cart.hs")).isSuccessful()).isTrue();
        assertThat(results.get(src.resolve("Broken.hs")).isSuccessful()).isFalse();
        assertThat(engine.getSuccessCount()).isEqualTo(1);
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    void findsSupportedFilesInPathOrder() throws IOException {
        Files.writeString(tempDir.resolve("B.hs"), FORMATTED);
        Files.writeString(tempDir.resolve("A.hs"), FORMATTED);
        Files.writeString(tempDir.resolve("notes.txt"), "notes");

        assertThat(engine.findSupportedFiles(tempDir))
                .containsExactly(tempDir.resolve("A.hs"), tempDir.resolve("B.hs"));
    }

    @Test
    void missingDirectoryYieldsNoResults() {
        assertThat(engine.formatDirectory(tempDir.resolve("absent"), 1)).isEmpty();
    }

    @Test
    void pluginCrashBecomesAFailedResult() {
        engine.registerPlugin(FileType.HASKELL_BOOT, new FormatterPlugin() {
            @Override
            public void initialize(FormatterConfig config) {
            }

            @Override
            public FormatterResult format(Path filePath, String sourceCode) {
                throw new IllegalStateException("boom");
            }

            @Override
            public List<Diagnostic> lint(Path filePath, String sourceCode) {
                return List.of();
            }
        });

        FormatterResult result = engine.formatFile(tempDir.resolve("Types.hs-boot"), "x = 1\n");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getDiagnostics().get(0).getMessage()).contains("boom");
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    void directoryRunKeepsFilesWhoseTaskDiesWithAnError() throws IOException {
        engine.registerPlugin(FileType.HASKELL_BOOT, new FormatterPlugin() {
            @Override
            public void initialize(FormatterConfig config) {
            }

            @Override
            public FormatterResult format(Path filePath, String sourceCode) {
                throw new StackOverflowError("nested too deep");
            }

            @Override
            public List<Diagnostic> lint(Path filePath, String sourceCode) {
                return List.of();
            }
        });
        Files.writeString(tempDir.resolve("Cart.hs"), FORMATTED, StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("Types.hs-boot"), "x = 1\n", StandardCharsets.UTF_8);

        Map<Path, FormatterResult> results = engine.formatDirectory(tempDir, 2);

        assertThat(results).containsOnlyKeys(tempDir.resolve("Cart.hs"), tempDir.resolve("Types.hs-boot"));
        assertThat(results.get(tempDir.resolve("Cart.hs")).isSuccessful()).isTrue();
        FormatterResult crashed = results.get(tempDir.resolve("Types.hs-boot"));
        assertThat(crashed.isSuccessful()).isFalse();
        assertThat(crashed.getDiagnostics().get(0).getMessage()).contains("nested too deep");
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    void closeRethrowsPluginFailure() {
        engine.registerPlugin(FileType.HASKELL_BOOT, new ClosingPlugin());

        assertThatThrownBy(() -> engine.close()).hasMessage("close failed");
        assertThat(engine.hasPluginFor(FileType.HASKELL)).isFalse();
    }

    private static class ClosingPlugin implements FormatterPlugin, AutoCloseable {
        @Override
        public void initialize(FormatterConfig config) {
        }

        @Override
        public FormatterResult format(Path filePath, String sourceCode) {
            return FormatterResult.builder().successful(true).formattedCode(sourceCode).build();
        }

        @Override
        public List<Diagnostic> lint(Path filePath, String sourceCode) {
            return List.of();
        }

        @Override
        public void close() throws Exception {
            throw new Exception("close failed");
        }
    }
}
