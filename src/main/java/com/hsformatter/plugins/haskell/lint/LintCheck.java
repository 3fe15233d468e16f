package com.hsformatter.plugins.haskell.lint;

import java.util.Set;

import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.plugins.haskell.cst.Module;

/**
 * A read-only check over a parsed module.
 */
public interface LintCheck {
    /**
     * Every kind of finding this check can report.
     */
    Set<DiagnosticKind> getKinds();

    LintResult analyze(Module module);
}
