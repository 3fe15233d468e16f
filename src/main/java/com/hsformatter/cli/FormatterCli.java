package com.hsformatter.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.Severity;
import com.hsformatter.config.ConfigurationLoader;
import com.hsformatter.config.FormatterConfig;
import com.hsformatter.core.CodeFormatterEngine;
import com.hsformatter.plugins.FileType;
import com.hsformatter.plugins.haskell.HaskellFormatter;
import com.hsformatter.util.ErrorFormatter;
import com.hsformatter.util.LoggerUtil;

/**
 * Command line interface: {@code format}, {@code check}, {@code lint} and
 * {@code init}.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".hsformatter.yml";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public static int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));
        if (args.length < 1) {
            _printUsage();
            return EXIT_FAILURE;
        }
        LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);

        String command = args[0];
        try {
            switch (command) {
                case "format":
                    return _formatFiles(args);
                case "check":
                    return _checkFiles(args);
                case "lint":
                    return _lintFiles(args);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    System.out.println("hs-formatter version " + VERSION);
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return EXIT_FAILURE;
            }
        } catch (IOException | RuntimeException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for stack trace");
            }
            return EXIT_FAILURE;
        }
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "hs-formatter CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  hs-formatter init [--force]      - Write a default " + CONFIG_FILE_NAME);
        System.out.println("  hs-formatter format <path>       - Format files in place");
        System.out.println("  hs-formatter check <path>        - Report files that need formatting");
        System.out.println("  hs-formatter lint <path>         - Report style findings");
        System.out.println("  hs-formatter --help|-h           - Show this help");
        System.out.println("  hs-formatter --version|-v        - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                  - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --verbose                        - Show detailed output");
        System.out.println("  --ci                             - CI friendly output (simplified)");
        System.out.println("  --no-color                       - Disable colored output");
        System.out.println("  --include=<glob>                 - Only include files matching pattern");
        System.out.println("  --threads=<num>                  - Number of threads (default: available processors)");
        System.out.println("  --force                          - Overwrite an existing config file (init)");
    }

    private static int _formatFiles(String[] args) throws IOException {
        Path path = _targetPath(args);
        if (path == null) {
            return EXIT_FAILURE;
        }
        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        try (CodeFormatterEngine engine = _createEngine(config)) {
            List<Path> files = _findFiles(engine, path, config, _getOptionValue(args, "--include"));
            _printInfo("Found " + files.size() + " files to format");
            Instant start = Instant.now();
            Map<Path, FormatterResult> results = engine.formatFiles(files, _threads(args));

            AtomicInteger changed = new AtomicInteger(0);
            Map<Path, List<Diagnostic>> failures = new LinkedHashMap<>();
            for (Path file : files) {
                FormatterResult result = results.get(file);
                if (result == null || !result.isSuccessful()) {
                    _printError("Failed to format: " + file);
                    List<Diagnostic> diagnostics = result == null ? List.of() : result.getDiagnostics();
                    diagnostics.forEach(d -> _printError("  " + errorFormatter.formatDiagnostic(d)));
                    failures.put(file, diagnostics);
                    continue;
                }
                String source = Files.readString(file, StandardCharsets.UTF_8);
                if (!source.equals(result.getFormattedCode())) {
                    Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                    changed.incrementAndGet();
                    _printSuccess("Formatted: " + file);
                    if (verbose && !ciMode) {
                        result.getAppliedRefactorings().forEach(r -> _printInfo("    - " + r));
                    }
                } else if (verbose) {
                    _printInfo("  Already formatted: " + file);
                }
            }

            System.out.println("\nFormatting complete in " + _formatDuration(Duration.between(start, Instant.now())) + ":");
            System.out.println("  Processed files: " + files.size());
            System.out.println("  Reformatted: " + changed.get());
            System.out.println("  Files with errors: " + failures.size());
            if (!failures.isEmpty() && !ciMode) {
                System.out.println("\n" + errorFormatter.formatSummary(failures));
            }
            return failures.isEmpty() ? EXIT_OK : EXIT_FAILURE;
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private static int _checkFiles(String[] args) throws IOException {
        Path path = _targetPath(args);
        if (path == null) {
            return EXIT_FAILURE;
        }
        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        try (CodeFormatterEngine engine = _createEngine(config)) {
            List<Path> files = _findFiles(engine, path, config, _getOptionValue(args, "--include"));
            _printInfo("Found " + files.size() + " files to check");
            Map<Path, FormatterResult> results = engine.formatFiles(files, _threads(args));

            int nonCompliant = 0;
            int errors = 0;
            Map<Path, List<Diagnostic>> findings = new LinkedHashMap<>();
            for (Path file : files) {
                FormatterResult result = results.get(file);
                if (result == null || !result.isSuccessful()) {
                    errors++;
                    _printError("Could not check: " + file);
                    if (result != null) {
                        result.getDiagnostics().forEach(d -> _printError("  " + errorFormatter.formatDiagnostic(d)));
                        findings.put(file, result.getDiagnostics());
                    }
                    continue;
                }
                List<Diagnostic> mechanical = result.getMechanicalDiagnostics();
                String source = Files.readString(file, StandardCharsets.UTF_8);
                if (!source.equals(result.getFormattedCode()) || !mechanical.isEmpty()) {
                    nonCompliant++;
                    _printWarning("File needs formatting: " + file);
                    if (!ciMode) {
                        mechanical.forEach(d -> _printWarning("  " + errorFormatter.formatDiagnostic(d)));
                    }
                    findings.put(file, mechanical);
                } else if (verbose) {
                    _printSuccess("  OK: " + file);
                }
            }

            System.out.println("\nCheck complete:");
            System.out.println("  Checked files: " + files.size());
            System.out.println("  Files needing formatting: " + nonCompliant);
            System.out.println("  Files with processing errors: " + errors);
            if (ciMode) {
                System.out.println("RESULT:files=" + files.size() + ";unformatted=" + nonCompliant
                        + ";errors=" + errors);
            } else if (!findings.isEmpty()) {
                System.out.println("\n" + errorFormatter.formatSummary(findings));
            }
            return nonCompliant > 0 || errors > 0 ? EXIT_FAILURE : EXIT_OK;
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private static int _lintFiles(String[] args) throws IOException {
        Path path = _targetPath(args);
        if (path == null) {
            return EXIT_FAILURE;
        }
        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        try (CodeFormatterEngine engine = _createEngine(config)) {
            List<Path> files = _findFiles(engine, path, config, _getOptionValue(args, "--include"));
            _printInfo("Found " + files.size() + " files to lint");

            Map<Path, List<Diagnostic>> findings = new LinkedHashMap<>();
            int issueCount = 0;
            for (Path file : files) {
                List<Diagnostic> diagnostics = engine.lintPath(file);
                if (diagnostics.isEmpty()) {
                    if (verbose) {
                        _printSuccess("  No issues found: " + file);
                    }
                    continue;
                }
                findings.put(file, diagnostics);
                issueCount += diagnostics.size();
                if (!ciMode) {
                    System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, file + ":"));
                    Map<Severity, List<Diagnostic>> bySeverity = errorFormatter.groupBySeverity(diagnostics);
                    _printBySeverity(bySeverity, Severity.ERROR);
                    _printBySeverity(bySeverity, Severity.WARNING);
                    _printBySeverity(bySeverity, Severity.ADVISORY);
                }
            }

            long filesWithErrors = findings.values().stream()
                    .filter(list -> list.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR))
                    .count();
            System.out.println("\nLint complete:");
            System.out.println("  Files linted: " + files.size());
            System.out.println("  Total issues found: " + issueCount);
            System.out.println("  Files with errors: " + filesWithErrors);
            if (ciMode) {
                System.out.println("RESULT:files=" + files.size() + ";errors=" + filesWithErrors
                        + ";issues=" + issueCount);
            } else if (!findings.isEmpty()) {
                System.out.println("\n" + errorFormatter.formatSummary(findings));
            }
            return filesWithErrors > 0 ? EXIT_FAILURE : EXIT_OK;
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_OK;
        }
        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private static CodeFormatterEngine _createEngine(FormatterConfig config) {
        CodeFormatterEngine engine = new CodeFormatterEngine(config);
        HaskellFormatter haskell = new HaskellFormatter();
        engine.registerPlugin(FileType.HASKELL, haskell);
        engine.registerPlugin(FileType.HASKELL_BOOT, haskell);
        return engine;
    }

    private static FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
    }

    private static Path _targetPath(String[] args) {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return null;
        }
        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return null;
        }
        return path;
    }

    private static int _threads(String[] args) {
        String value = _getOptionValue(args, "--threads");
        if (value == null) {
            return Runtime.getRuntime().availableProcessors();
        }
        try {
            return Math.max(1, Integer.parseInt(value));
        } catch (NumberFormatException e) {
            _printWarning("Invalid thread count: " + value + ", using default");
            return Runtime.getRuntime().availableProcessors();
        }
    }

    private static List<Path> _findFiles(CodeFormatterEngine engine, Path path, FormatterConfig config,
                                         String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        List<String> ignorePatterns = config.getGeneralConfig("ignoreFiles", new ArrayList<String>());
        return engine.findSupportedFiles(path).stream()
                .filter(p -> _matchesIncludePattern(p, includePattern))
                .filter(p -> !_isIgnored(p, path, ignorePatterns))
                .collect(Collectors.toList());
    }

    static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }
        String fileName = file.getFileName().toString();
        if (includePattern.startsWith("*.")) {
            return fileName.endsWith(includePattern.substring(1));
        }
        if (includePattern.contains("*")) {
            return fileName.matches(_globToRegex(includePattern));
        }
        return fileName.contains(includePattern);
    }

    static boolean _isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }
        String relativePath = basePath.relativize(file).toString().replace("\\", "/");
        for (String pattern : ignorePatterns) {
            if (pattern.startsWith("**/")) {
                if (relativePath.endsWith(pattern.substring(3))) {
                    return true;
                }
            } else if (pattern.endsWith("/**")) {
                if (relativePath.startsWith(pattern.substring(0, pattern.length() - 3) + "/")) {
                    return true;
                }
            } else if (pattern.contains("*")) {
                if (relativePath.matches(_globToRegex(pattern))) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }
        return false;
    }

    private static String _globToRegex(String glob) {
        return glob.replace(".", "\\.").replace("*", ".*").replace("?", ".");
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static void _printBySeverity(Map<Severity, List<Diagnostic>> bySeverity, Severity severity) {
        for (Diagnostic diagnostic : bySeverity.getOrDefault(severity, List.of())) {
            String line = "  " + errorFormatter.formatDiagnostic(diagnostic);
            switch (severity) {
                case ERROR -> _printError(line);
                case WARNING -> _printWarning(line);
                case ADVISORY -> _printInfo(line);
            }
        }
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
