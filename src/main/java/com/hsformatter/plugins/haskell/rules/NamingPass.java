package com.hsformatter.plugins.haskell.rules;

import java.util.Set;

import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.NodeKind;
import com.hsformatter.plugins.haskell.lint.NamingRules;

/**
 * Reports naming findings. Renaming would break every use site, so the tree
 * is never changed.
 */
public class NamingPass implements FormattingPass {

    @Override
    public String getName() {
        return "naming";
    }

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.FUNCTION_CLAUSE, NodeKind.TYPE_SIGNATURE, NodeKind.DATA_DECL);
    }

    @Override
    public PassResult apply(Module module, HaskellStyleConfig config) {
        return new PassResult(module, new NamingRules(config).analyze(module).getDiagnostics());
    }
}
