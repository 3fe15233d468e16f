package com.hsformatter.plugins.haskell;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import com.hsformatter.api.FormatterPlugin;
import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.api.error.FormatterException;
import com.hsformatter.api.error.Severity;
import com.hsformatter.config.FormatterConfig;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.lexer.Tokenizer;
import com.hsformatter.plugins.haskell.lint.Linter;
import com.hsformatter.plugins.haskell.parser.StructuralReader;
import com.hsformatter.plugins.haskell.render.RenderResult;
import com.hsformatter.plugins.haskell.render.Renderer;
import com.hsformatter.plugins.haskell.rules.PassOutcome;
import com.hsformatter.plugins.haskell.rules.RuleEngine;
import com.hsformatter.util.LoggerUtil;
import com.hsformatter.util.SourceDecoder;

/**
 * Haskell formatter and linter plugin. Parsed modules are cached by path and
 * content so that linting and formatting the same file parse it once.
 */
public class HaskellFormatter implements FormatterPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(HaskellFormatter.class);
    private static final int CACHE_SIZE = 100;

    private HaskellStyleConfig styleConfig = HaskellStyleConfig.defaults();
    private final RuleEngine ruleEngine = RuleEngine.standard();

    private final Map<String, Module> moduleCache = new LinkedHashMap<String, Module>(CACHE_SIZE, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Module> eldest) {
            return size() > CACHE_SIZE;
        }
    };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = cacheLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = cacheLock.writeLock();

    @Override
    public void initialize(FormatterConfig config) {
        this.styleConfig = HaskellStyleConfig.from(config);
    }

    public HaskellStyleConfig getStyleConfig() {
        return styleConfig;
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        return _format(filePath.toString(), sourceCode, styleConfig);
    }

    @Override
    public List<Diagnostic> lint(Path filePath, String sourceCode) {
        return _lint(filePath.toString(), sourceCode, styleConfig);
    }

    public FormatterResult format(String sourceCode, HaskellStyleConfig config) {
        return _format(null, sourceCode, config);
    }

    public List<Diagnostic> lint(String sourceCode, HaskellStyleConfig config) {
        return _lint(null, sourceCode, config);
    }

    public boolean checkIdempotent(String sourceCode, HaskellStyleConfig config) {
        return IdempotenceHarness.check(sourceCode, config).isIdempotent();
    }

    private FormatterResult _format(String path, String sourceCode, HaskellStyleConfig config) {
        Module module;
        try {
            module = _parse(path, sourceCode);
        } catch (FormatterException e) {
            logger.fine("Rejected " + (path == null ? "input" : path) + ": " + e.getMessage());
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(null)
                    .addDiagnostic(e.toDiagnostic())
                    .build();
        }

        PassOutcome outcome = ruleEngine.apply(module, config);
        RenderResult rendered = Renderer.render(outcome, config);
        FormatterResult result = FormatterResult.builder()
                .successful(true)
                .formattedCode(rendered.getText())
                .diagnostics(rendered.getDiagnostics())
                .appliedRefactorings(rendered.getRefactorings())
                .build();

        if (config.isVerifyIdempotence()) {
            HaskellStyleConfig once = config.toBuilder().verifyIdempotence(false).build();
            IdempotenceReport report = IdempotenceHarness.compare(result, format(rendered.getText(), once));
            if (!report.isIdempotent()) {
                logger.severe("Formatting " + (path == null ? module.getModuleName() : path)
                        + " is not idempotent (" + report + "); source left unchanged");
                List<Diagnostic> diagnostics = new ArrayList<>();
                diagnostics.add(new Diagnostic(DiagnosticKind.IDEMPOTENCE_VIOLATION, Severity.ERROR,
                        "Formatting is not idempotent: " + report, Math.max(1, report.getFirstDifferingLine()),
                        1, -1, -1, null));
                for (Diagnostic diagnostic : rendered.getDiagnostics()) {
                    if (diagnostic.getKind().isAdvisory()) {
                        diagnostics.add(diagnostic);
                    }
                }
                return FormatterResult.builder()
                        .successful(false)
                        .formattedCode(sourceCode)
                        .diagnostics(diagnostics)
                        .build();
            }
        }
        return result;
    }

    private List<Diagnostic> _lint(String path, String sourceCode, HaskellStyleConfig config) {
        try {
            return Linter.lint(_parse(path, sourceCode), config);
        } catch (FormatterException e) {
            return List.of(e.toDiagnostic());
        }
    }

    private Module _parse(String path, String sourceCode) {
        String cacheKey = path == null ? null : path + ":" + sourceCode.hashCode();
        if (cacheKey != null) {
            readLock.lock();
            try {
                Module cached = moduleCache.get(cacheKey);
                if (cached != null && cached.getSource().equals(sourceCode)) {
                    return cached;
                }
            } finally {
                readLock.unlock();
            }
        }

        SourceDecoder.validate(sourceCode);
        Module module = StructuralReader.parse(Tokenizer.tokenize(sourceCode));

        if (cacheKey != null) {
            writeLock.lock();
            try {
                moduleCache.put(cacheKey, module);
            } finally {
                writeLock.unlock();
            }
        }
        return module;
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            moduleCache.clear();
        } finally {
            writeLock.unlock();
        }
    }
}
