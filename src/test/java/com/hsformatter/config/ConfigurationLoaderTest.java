package com.hsformatter.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void defaultConfigComesFromTheBundledResource() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getGeneralConfig("indentWidth", 0)).isEqualTo(2);
        assertThat(config.getGeneralConfig("maxLineLength", 0)).isEqualTo(80);
        List<String> ignored = config.getGeneralConfig("ignoreFiles", new ArrayList<String>());
        assertThat(ignored).contains("dist-newstyle/**", ".stack-work/**");
        assertThat(config.getPluginConfig(HaskellStyleConfig.PLUGIN_NAME, "qualifyImportThreshold", 0))
                .isEqualTo(15);
        assertThat(ConfigurationLoader.loadDefaultConfig()).isSameAs(config);
    }

    @Test
    void missingOrNullPathFallsBackToDefaults() {
        assertThat(ConfigurationLoader.loadConfig(null)).isSameAs(ConfigurationLoader.loadDefaultConfig());
        assertThat(ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml")))
                .isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void unparsableFileFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "general: [unclosed\n");

        assertThat(ConfigurationLoader.loadConfig(file)).isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void readsValuesAndFillsInTheRest() throws IOException {
        Path file = tempDir.resolve(".hsformatter.yml");
        Files.writeString(file, "general:\n"
                + "  indentWidth: 4\n"
                + "plugins:\n"
                + "  haskell:\n"
                + "    localModulePrefixes: [Shop]\n"
                + "    layoutPolicies:\n"
                + "      exports: always-multiline\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);
        HaskellStyleConfig style = HaskellStyleConfig.from(config);

        assertThat(style.getIndentWidth()).isEqualTo(4);
        assertThat(style.getMaxLineLength()).isEqualTo(80);
        assertThat(style.getLocalModulePrefixes()).containsExactly("Shop");
        assertThat(style.getLayoutPolicy(LayoutTarget.EXPORTS)).isEqualTo(LayoutPolicy.ALWAYS_MULTILINE);
        assertThat(style.getLayoutPolicy(LayoutTarget.RECORDS)).isEqualTo(LayoutPolicy.AUTO);
        assertThat(style.getQualifyImportThreshold()).isEqualTo(15);
        assertThat(config.getGeneralConfigMap().get("ignoreFiles")).isEqualTo(List.of());
    }

    @Test
    void outOfRangeValuesAreReplacedByDefaults() throws IOException {
        Path file = tempDir.resolve("range.yml");
        Files.writeString(file, "general:\n"
                + "  indentWidth: 12\n"
                + "  maxLineLength: 10\n"
                + "plugins:\n"
                + "  haskell:\n"
                + "    qualifyImportThreshold: 0\n"
                + "    maxCompositionChain: not-a-number\n");

        HaskellStyleConfig style = HaskellStyleConfig.from(ConfigurationLoader.loadConfig(file));

        assertThat(style.getIndentWidth()).isEqualTo(2);
        assertThat(style.getMaxLineLength()).isEqualTo(80);
        assertThat(style.getQualifyImportThreshold()).isEqualTo(15);
        assertThat(style.getMaxCompositionChain()).isEqualTo(4);
    }

    @Test
    void invalidNamingRulesAndPoliciesAreDropped() throws IOException {
        Path file = tempDir.resolve("rules.yml");
        Files.writeString(file, "general: {}\n"
                + "plugins:\n"
                + "  haskell:\n"
                + "    namingCaseRules:\n"
                + "      function: \"[a-z\"\n"
                + "      type: \"^T[A-Za-z]*$\"\n"
                + "    layoutPolicies:\n"
                + "      imports: sideways\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);
        Map<String, String> naming = config.getPluginStringMap(HaskellStyleConfig.PLUGIN_NAME, "namingCaseRules");
        HaskellStyleConfig style = HaskellStyleConfig.from(config);

        assertThat(naming.get("function")).isEqualTo(HaskellStyleConfig.DEFAULT_FUNCTION_PATTERN);
        assertThat(style.getTypeNamePattern().pattern()).isEqualTo("^T[A-Za-z]*$");
        assertThat(style.getLayoutPolicy(LayoutTarget.IMPORTS)).isEqualTo(LayoutPolicy.AUTO);
    }

    @Test
    void savedConfigLoadsBack() throws IOException {
        Path file = tempDir.resolve("nested/dir/.hsformatter.yml");

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), file);
        FormatterConfig reloaded = ConfigurationLoader.loadConfig(file);

        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("general:", "plugins:", "haskell:");
        assertThat(HaskellStyleConfig.from(reloaded).getImportGroupOrder())
                .containsExactly(ImportCategory.EXTERNAL, ImportCategory.LOCAL);
        List<String> ignored = reloaded.getGeneralConfig("ignoreFiles", new ArrayList<String>());
        assertThat(ignored).hasSize(2);
    }
}
