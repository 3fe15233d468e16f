package com.hsformatter.plugins.haskell.cst;

import java.util.ArrayList;
import java.util.List;

import com.hsformatter.plugins.haskell.rules.AlignmentGroup;

/**
 * A {@code data} or {@code newtype} declaration in ordinary (non-GADT) syntax.
 */
public final class DataDecl extends Declaration {
    private final int keywordToken;
    private final boolean newtype;
    private final int nameToken;
    private final String typeName;
    private final int equalsToken;
    private final List<Constructor> constructors;
    private final List<Integer> bars;
    private final List<DerivingClause> derivings;
    private final LayoutChoice layout;
    private final AlignmentGroup fieldAlignment;

    public DataDecl(int firstToken, int lastToken, int keywordToken, boolean newtype, int nameToken,
                    String typeName, int equalsToken, List<Constructor> constructors, List<Integer> bars,
                    List<DerivingClause> derivings) {
        this(firstToken, lastToken, keywordToken, newtype, nameToken, typeName, equalsToken, constructors, bars,
                derivings, LayoutChoice.UNDECIDED, null, IndentPlan.EMPTY);
    }

    private DataDecl(int firstToken, int lastToken, int keywordToken, boolean newtype, int nameToken,
                     String typeName, int equalsToken, List<Constructor> constructors, List<Integer> bars,
                     List<DerivingClause> derivings, LayoutChoice layout, AlignmentGroup fieldAlignment,
                     IndentPlan plan) {
        super(firstToken, lastToken, List.of(), plan);
        this.keywordToken = keywordToken;
        this.newtype = newtype;
        this.nameToken = nameToken;
        this.typeName = typeName;
        this.equalsToken = equalsToken;
        this.constructors = List.copyOf(constructors);
        this.bars = List.copyOf(bars);
        this.derivings = List.copyOf(derivings);
        this.layout = layout;
        this.fieldAlignment = fieldAlignment;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DATA_DECL;
    }

    @Override
    public String getName() {
        return typeName;
    }

    public int getKeywordToken() { return keywordToken; }
    public boolean isNewtype() { return newtype; }
    public int getNameToken() { return nameToken; }
    public int getEqualsToken() { return equalsToken; }
    public List<Constructor> getConstructors() { return constructors; }

    /**
     * The {@code |} tokens between constructors.
     */
    public List<Integer> getBars() { return bars; }
    public List<DerivingClause> getDerivings() { return derivings; }
    public LayoutChoice getLayout() { return layout; }
    public AlignmentGroup getFieldAlignment() { return fieldAlignment; }

    public boolean isSumType() {
        return constructors.size() > 1;
    }

    /**
     * One constructor in record syntax; laid out with the braces under the header.
     */
    public boolean isSingleRecord() {
        return constructors.size() == 1 && constructors.get(0).isRecord();
    }

    public List<RecordField> getAllFields() {
        List<RecordField> fields = new ArrayList<>();
        for (Constructor constructor : constructors) {
            fields.addAll(constructor.getFields());
        }
        return fields;
    }

    /**
     * The things multi-line form puts one per line: the fields of a single
     * record, otherwise the constructors and their fields.
     */
    public int getItemCount() {
        if (isSingleRecord()) {
            return getAllFields().size();
        }
        return constructors.size() + getAllFields().size();
    }

    /**
     * Last token before the first deriving clause.
     */
    public int getBodyEnd() {
        return derivings.isEmpty() ? getLastToken() : derivings.get(0).getFirstToken() - 1;
    }

    public DataDecl withLayout(LayoutChoice newLayout, AlignmentGroup newFieldAlignment) {
        return new DataDecl(getFirstToken(), getLastToken(), keywordToken, newtype, nameToken, typeName,
                equalsToken, constructors, bars, derivings, newLayout, newFieldAlignment, getIndentPlan());
    }

    @Override
    protected Declaration copyWith(IndentPlan plan) {
        return new DataDecl(getFirstToken(), getLastToken(), keywordToken, newtype, nameToken, typeName,
                equalsToken, constructors, bars, derivings, layout, fieldAlignment, plan);
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(constructors);
        children.addAll(derivings);
        return children;
    }
}
