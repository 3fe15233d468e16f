package com.hsformatter.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.hsformatter.api.CodeFormatter;
import com.hsformatter.api.FormatterPlugin;
import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.api.error.FormatterException;
import com.hsformatter.api.error.Severity;
import com.hsformatter.config.FormatterConfig;
import com.hsformatter.plugins.FileType;
import com.hsformatter.util.LoggerUtil;
import com.hsformatter.util.SourceDecoder;

/**
 * Dispatches files to the plugin registered for their type and formats
 * directories on a fixed thread pool. One file's failure never affects
 * another's result.
 */
public class CodeFormatterEngine implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(CodeFormatterEngine.class);
    private static final long TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public CodeFormatterEngine(FormatterConfig config) {
        this.config = config;
        logger.info("Formatter engine initialized");
    }

    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.info("Registered plugin for file type: " + fileType.getDescription());
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FormatterPlugin plugin = plugins.get(FileType.detect(filePath));
        if (plugin == null) {
            logger.warning("No plugin found for " + filePath);
            return _failure(sourceCode, new Diagnostic(DiagnosticKind.PARSE_ERROR, Severity.ERROR,
                    "No plugin registered for " + filePath.getFileName(), 1, 1, -1, -1, null));
        }

        processedFileCount.incrementAndGet();
        try {
            FormatterResult result = plugin.format(filePath, sourceCode);
            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Formatted: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " + result.getDiagnostics().stream()
                        .filter(d -> d.getSeverity() == Severity.ERROR)
                        .map(Diagnostic::getMessage)
                        .collect(Collectors.joining(", ")));
            }
            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            return _failure(sourceCode, new Diagnostic(DiagnosticKind.PARSE_ERROR, Severity.ERROR,
                    "Unexpected error: " + e.getMessage(), 1, 1, -1, -1, null));
        }
    }

    /**
     * Reads and formats one file. Unreadable or non-UTF-8 files yield a
     * failed result.
     */
    public FormatterResult formatPath(Path file) {
        try {
            return formatFile(file, SourceDecoder.decode(Files.readAllBytes(file)));
        } catch (FormatterException e) {
            errorCount.incrementAndGet();
            return _failure(null, e.toDiagnostic());
        } catch (IOException e) {
            errorCount.incrementAndGet();
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return _failure(null, new Diagnostic(DiagnosticKind.ENCODING_ERROR, Severity.ERROR,
                    "Failed to read file: " + e.getMessage(), 1, 1, -1, -1, null));
        }
    }

    /**
     * Lint findings for one file; read failures come back as a single
     * diagnostic.
     */
    public List<Diagnostic> lintPath(Path file) {
        FormatterPlugin plugin = plugins.get(FileType.detect(file));
        if (plugin == null) {
            return List.of();
        }
        try {
            return plugin.lint(file, SourceDecoder.decode(Files.readAllBytes(file)));
        } catch (FormatterException e) {
            return List.of(e.toDiagnostic());
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return List.of(new Diagnostic(DiagnosticKind.ENCODING_ERROR, Severity.ERROR,
                    "Failed to read file: " + e.getMessage(), 1, 1, -1, -1, null));
        }
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return new ConcurrentHashMap<>();
        }

        List<Path> files;
        try {
            files = findSupportedFiles(directory);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return new ConcurrentHashMap<>();
        }
        logger.info("Found " + files.size() + " files to process in " + directory);

        Map<Path, FormatterResult> results = formatFiles(files, threadCount);
        logger.info("Processed " + results.size() + " files");
        return results;
    }

    /**
     * Formats {@code files} on a fixed thread pool. Every file gets a result:
     * a task that dies, even with an {@link Error}, or runs past the timeout
     * yields a failed one. Results keep the order of {@code files}.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> files, int threadCount) {
        Map<Path, FormatterResult> results = new LinkedHashMap<>();
        if (files.isEmpty()) {
            return results;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threadCount, files.size())));
        Map<Path, Future<FormatterResult>> futures = new LinkedHashMap<>();
        try {
            for (Path file : files) {
                futures.put(file, executor.submit(() -> formatPath(file)));
            }
        } finally {
            executor.shutdown();
        }

        long deadline = System.nanoTime() + TimeUnit.MINUTES.toNanos(TIMEOUT_MINUTES);
        for (Map.Entry<Path, Future<FormatterResult>> entry : futures.entrySet()) {
            Path file = entry.getKey();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                results.put(file, entry.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (ExecutionException e) {
                errorCount.incrementAndGet();
                logger.log(Level.SEVERE, "Unexpected error formatting file: " + file, e.getCause());
                results.put(file, _failure(null, new Diagnostic(DiagnosticKind.PARSE_ERROR, Severity.ERROR,
                        "Unexpected error: " + e.getCause(), 1, 1, -1, -1, null)));
            } catch (TimeoutException e) {
                errorCount.incrementAndGet();
                logger.warning("Timeout waiting for " + file);
                entry.getValue().cancel(true);
                results.put(file, _failure(null, new Diagnostic(DiagnosticKind.PARSE_ERROR, Severity.ERROR,
                        "Timed out after " + TIMEOUT_MINUTES + " minutes", 1, 1, -1, -1, null)));
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt();
                break;
            }
        }
        return results;
    }

    /**
     * Regular files under {@code directory} that a registered plugin handles,
     * in path order.
     */
    public List<Path> findSupportedFiles(Path directory) throws IOException {
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> plugins.containsKey(FileType.detect(path)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static FormatterResult _failure(String sourceCode, Diagnostic diagnostic) {
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(sourceCode)
                .addDiagnostic(diagnostic)
                .build();
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    @Override
    public void close() throws Exception {
        logger.info("Closing formatter: processed=" + processedFileCount.get()
                + ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;
        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            if (entry.getValue() instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) entry.getValue()).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }
        plugins.clear();
        if (firstException != null) {
            throw firstException;
        }
    }
}
