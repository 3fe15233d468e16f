package com.hsformatter.api;

import java.nio.file.Path;
import java.util.List;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.config.FormatterConfig;

/**
 * Interface for language-specific formatter plugins.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Format the provided source code according to rules.
     */
    FormatterResult format(Path filePath, String sourceCode);

    /**
     * Report style findings without rewriting the source.
     */
    List<Diagnostic> lint(Path filePath, String sourceCode);
}
