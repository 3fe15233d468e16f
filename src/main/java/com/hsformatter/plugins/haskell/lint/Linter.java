package com.hsformatter.plugins.haskell.lint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.util.LoggerUtil;

/**
 * Runs every lint check over a parsed module. Read-only: the module is never
 * changed and nothing here depends on the rule engine.
 */
public final class Linter {
    private static final Logger logger = LoggerUtil.getLogger(Linter.class);

    private static final Comparator<Diagnostic> BY_POSITION = Comparator
            .comparingInt(Diagnostic::getLine)
            .thenComparingInt(Diagnostic::getColumn)
            .thenComparing(Diagnostic::getKind);

    private Linter() {
    }

    public static List<LintCheck> checks(HaskellStyleConfig config) {
        List<LintCheck> checks = new ArrayList<>();
        checks.add(new NamingRules(config));
        checks.add(new SignatureCheck());
        checks.add(new DataTypeCheck());
        checks.add(new ExpressionCheck(config));
        checks.add(new SourceLayoutCheck(config));
        return checks;
    }

    /**
     * Findings of the checks enabled by {@code enabledLintChecks}, ordered by
     * position.
     */
    public static List<Diagnostic> lint(Module module, HaskellStyleConfig config) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (LintCheck check : checks(config)) {
            if (check.getKinds().stream().noneMatch(config::isCheckEnabled)) {
                continue;
            }
            for (Diagnostic diagnostic : check.analyze(module).getDiagnostics()) {
                if (config.isCheckEnabled(diagnostic.getKind())) {
                    diagnostics.add(diagnostic);
                }
            }
        }
        diagnostics.sort(BY_POSITION);
        logger.fine("Lint of " + module.getModuleName() + ": " + diagnostics.size() + " findings");
        return diagnostics;
    }
}
