package com.hsformatter.plugins.haskell.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.hsformatter.api.Refactoring;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.util.LoggerUtil;

/**
 * Runs the formatting passes in their fixed order, each on the previous
 * one's output.
 */
public final class RuleEngine {
    private static final Logger logger = LoggerUtil.getLogger(RuleEngine.class);

    private final List<FormattingPass> passes;

    public RuleEngine(List<FormattingPass> passes) {
        this.passes = List.copyOf(passes);
    }

    public static RuleEngine standard() {
        List<FormattingPass> passes = new ArrayList<>();
        passes.add(new IndentationPass());
        passes.add(new AlignmentPass());
        passes.add(new ImportOrderingPass());
        passes.add(new PragmaPlacementPass());
        passes.add(new StrictnessDerivingPass());
        passes.add(new NamingPass());
        return new RuleEngine(passes);
    }

    public List<FormattingPass> getPasses() {
        return passes;
    }

    public PassOutcome apply(Module module, HaskellStyleConfig config) {
        Module current = module;
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Refactoring> refactorings = new ArrayList<>();
        for (FormattingPass pass : passes) {
            PassResult result = pass.apply(current, config);
            if (result.getModule() != current) {
                logger.finer(pass.getName() + " updated " + current.getModuleName());
            }
            current = result.getModule();
            diagnostics.addAll(result.getDiagnostics());
            refactorings.addAll(result.getRefactorings());
        }
        return new PassOutcome(current, diagnostics, refactorings);
    }
}
