package com.hsformatter.plugins.haskell.rules;

import java.util.Set;

import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.NodeKind;

/**
 * One step of the rule engine. Implementations are stateless and never
 * modify their input: they return a new tree, or the same instance when
 * there is nothing to change.
 */
public interface FormattingPass {
    String getName();

    /**
     * Node kinds whose layout decisions this pass produces.
     */
    Set<NodeKind> getNodeKinds();

    PassResult apply(Module module, HaskellStyleConfig config);
}
