package com.hsformatter.plugins.haskell.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * One equation of a function or operator definition, or a pattern binding
 * (which has no name), with its optional {@code where} block.
 */
public final class FunctionClause extends Declaration {
    private final int nameToken;
    private final String name;
    private final boolean operator;
    private final Equation equation;
    private final LayoutBlock whereBlock;
    private final List<Declaration> localDeclarations;

    public FunctionClause(int firstToken, int lastToken, List<LayoutBlock> blocks, int nameToken, String name,
                          boolean operator, Equation equation, LayoutBlock whereBlock,
                          List<Declaration> localDeclarations) {
        this(firstToken, lastToken, blocks, nameToken, name, operator, equation, whereBlock, localDeclarations,
                IndentPlan.EMPTY);
    }

    private FunctionClause(int firstToken, int lastToken, List<LayoutBlock> blocks, int nameToken, String name,
                           boolean operator, Equation equation, LayoutBlock whereBlock,
                           List<Declaration> localDeclarations, IndentPlan plan) {
        super(firstToken, lastToken, blocks, plan);
        this.nameToken = nameToken;
        this.name = name;
        this.operator = operator;
        this.equation = equation;
        this.whereBlock = whereBlock;
        this.localDeclarations = List.copyOf(localDeclarations);
        for (Declaration local : this.localDeclarations) {
            local.attachTo(this);
        }
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_CLAUSE;
    }

    /**
     * Bound name; null for a pattern binding.
     */
    @Override
    public String getName() {
        return name;
    }

    public int getNameToken() { return nameToken; }

    /**
     * True for operator definitions such as {@code (<+>) a b = ...} or {@code a <+> b = ...}.
     */
    public boolean isOperator() { return operator; }
    public Equation getEquation() { return equation; }

    /**
     * The {@code where} block closing the clause, or null.
     */
    public LayoutBlock getWhereBlock() { return whereBlock; }

    /**
     * Signatures and clauses bound in the {@code where} block.
     */
    public List<Declaration> getLocalDeclarations() { return localDeclarations; }

    public boolean hasWhere() {
        return whereBlock != null;
    }

    @Override
    protected Declaration copyWith(IndentPlan plan) {
        return new FunctionClause(getFirstToken(), getLastToken(), getBlocks(), nameToken, name, operator,
                equation, whereBlock, localDeclarations, plan);
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        children.add(equation);
        if (whereBlock != null) {
            children.add(whereBlock);
        }
        return children;
    }
}
