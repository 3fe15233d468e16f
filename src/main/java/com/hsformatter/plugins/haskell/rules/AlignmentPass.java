package com.hsformatter.plugins.haskell.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.IntSupplier;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.config.LayoutPolicy;
import com.hsformatter.config.LayoutTarget;
import com.hsformatter.plugins.haskell.cst.BracketList;
import com.hsformatter.plugins.haskell.cst.DataDecl;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.DerivingClause;
import com.hsformatter.plugins.haskell.cst.ExportList;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.ImportDecl;
import com.hsformatter.plugins.haskell.cst.ImportGroup;
import com.hsformatter.plugins.haskell.cst.ImportList;
import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.cst.LayoutChoice;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.ModuleHeader;
import com.hsformatter.plugins.haskell.cst.NodeKind;
import com.hsformatter.plugins.haskell.cst.OpaqueDecl;
import com.hsformatter.plugins.haskell.cst.OpaqueKind;
import com.hsformatter.plugins.haskell.cst.TypeSignature;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lint.SourceLayoutCheck;
import com.hsformatter.plugins.haskell.render.DataDeclLayout;
import com.hsformatter.plugins.haskell.render.ItemListLayout;
import com.hsformatter.plugins.haskell.render.LineReindenter;
import com.hsformatter.plugins.haskell.render.LongLineSplitter;
import com.hsformatter.plugins.haskell.render.SignatureLayout;
import com.hsformatter.plugins.haskell.render.TokenText;

/**
 * Chooses between one-line and one-item-per-line layout for export lists,
 * import lists, data declarations and type signatures, computes the shared
 * separator columns of the multi-line forms, and breaks the over-long lines
 * of function clauses and class and instance bodies.
 *
 * <p>The one-line form is chosen when the policy allows it, it fits the line
 * budget, no comment sits inside the construct, and the source did not
 * already spread more than one item over several lines.
 */
public class AlignmentPass implements FormattingPass {

    @Override
    public String getName() {
        return "alignment";
    }

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.EXPORT_LIST, NodeKind.IMPORT_LIST, NodeKind.DATA_DECL, NodeKind.RECORD_FIELD,
                NodeKind.DERIVING_CLAUSE, NodeKind.TYPE_SIGNATURE, NodeKind.FUNCTION_CLAUSE, NodeKind.OPAQUE_DECL,
                NodeKind.LAYOUT_BLOCK);
    }

    @Override
    public PassResult apply(Module module, HaskellStyleConfig config) {
        List<Diagnostic> diagnostics = new ArrayList<>(SourceLayoutCheck.missingExportList(module));
        if (module.isBodyVerbatim()) {
            return new PassResult(module, diagnostics);
        }

        List<Token> tokens = module.getTokens();
        LineReindenter reindenter = new LineReindenter(tokens);
        int indentWidth = config.getIndentWidth();

        ModuleHeader header = module.getHeader();
        if (header != null && header.getExports() != null) {
            ModuleHeader source = header;
            ExportList exports = source.getExports();
            LayoutChoice choice = _choose(config, LayoutTarget.EXPORTS, exports.getItems().size(),
                    _listSpansLines(tokens, exports), TokenText.hasInteriorComments(tokens,
                            exports.getOpenToken(), exports.getCloseToken()),
                    () -> reindenter.maxWidth(source.getFirstToken(), source.getLastToken(),
                            ItemListLayout.headerPlan(tokens,
                                    source.withExports(exports.withLayout(LayoutChoice.SINGLE_LINE)),
                                    indentWidth)));
            header = source.withExports(exports.withLayout(choice));
        }

        List<ImportGroup> groups = new ArrayList<>();
        for (ImportGroup group : module.getImportGroups()) {
            List<ImportDecl> imports = new ArrayList<>();
            for (ImportDecl importDecl : group.getImports()) {
                imports.add(_layoutImport(tokens, reindenter, importDecl, config));
            }
            groups.add(new ImportGroup(imports, group.getCategory()));
        }

        List<Declaration> declarations = new ArrayList<>();
        for (Declaration declaration : module.getDeclarations()) {
            if (declaration instanceof DataDecl) {
                declarations.add(_layoutData(tokens, reindenter, (DataDecl) declaration, config));
            } else if (declaration instanceof TypeSignature) {
                declarations.add(_layoutSignature(tokens, reindenter, (TypeSignature) declaration, config));
            } else if (_hasSplittableBody(declaration)) {
                declarations.add(_splitLongLines(tokens, reindenter, declaration, config));
            } else {
                declarations.add(declaration);
            }
        }

        Module result = module.toBuilder()
                .header(header)
                .importGroups(groups)
                .declarations(declarations)
                .build();
        return new PassResult(result, diagnostics);
    }

    private ImportDecl _layoutImport(List<Token> tokens, LineReindenter reindenter, ImportDecl importDecl,
                                     HaskellStyleConfig config) {
        ImportList list = importDecl.getImportList();
        if (list == null) {
            return importDecl;
        }
        LayoutChoice choice = _choose(config, LayoutTarget.IMPORTS, list.getItems().size(),
                _listSpansLines(tokens, list),
                TokenText.hasInteriorComments(tokens, list.getOpenToken(), list.getCloseToken()),
                () -> reindenter.maxWidth(importDecl.getFirstToken(), importDecl.getLastToken(),
                        ItemListLayout.importPlan(tokens,
                                importDecl.withImportList(list.withLayout(LayoutChoice.SINGLE_LINE)),
                                config.getIndentWidth())));
        return importDecl.withImportList(list.withLayout(choice));
    }

    private Declaration _layoutData(List<Token> tokens, LineReindenter reindenter, DataDecl decl,
                                    HaskellStyleConfig config) {
        int first = decl.getFirstToken();
        int last = decl.getLastToken();
        LayoutTarget target = decl.getAllFields().isEmpty() ? LayoutTarget.CONSTRUCTORS : LayoutTarget.RECORDS;
        LayoutChoice choice;
        if (_hasSeveralStrategies(decl)) {
            choice = LayoutChoice.MULTI_LINE;
        } else {
            choice = _choose(config, target, decl.getItemCount(), TokenText.spansLines(tokens, first, last),
                    TokenText.hasInteriorComments(tokens, first, last),
                    () -> reindenter.maxWidth(first, last, DataDeclLayout.plan(tokens,
                            decl.withLayout(LayoutChoice.SINGLE_LINE, null), config.getIndentWidth())
                            .merge(DataDeclLayout.derivingParens(tokens, decl))));
        }
        AlignmentGroup fields = null;
        if (choice == LayoutChoice.MULTI_LINE && config.isAlignRecordFields() && !decl.getAllFields().isEmpty()) {
            fields = new AlignmentGroup("::", decl.getAllFields().size(),
                    DataDeclLayout.fieldTargetColumn(tokens, decl, config.getIndentWidth()));
        }
        DataDecl laidOut = decl.withLayout(choice, fields);
        IndentPlan plan = DataDeclLayout.plan(tokens, laidOut, config.getIndentWidth());
        return laidOut.withIndentPlan(decl.getIndentPlan().merge(plan));
    }

    /**
     * Two or more deriving clauses with a strategy each get one line apiece.
     */
    private static boolean _hasSeveralStrategies(DataDecl decl) {
        if (decl.getDerivings().size() < 2) {
            return false;
        }
        for (DerivingClause deriving : decl.getDerivings()) {
            if (deriving.hasStrategy()) {
                return true;
            }
        }
        return false;
    }

    private Declaration _layoutSignature(List<Token> tokens, LineReindenter reindenter, TypeSignature signature,
                                         HaskellStyleConfig config) {
        int first = signature.getFirstToken();
        int last = signature.getLastToken();
        int indentWidth = config.getIndentWidth();
        LayoutChoice choice = _choose(config, LayoutTarget.SIGNATURES, signature.getSegmentCount(),
                TokenText.spansLines(tokens, first, last), TokenText.hasInteriorComments(tokens, first, last),
                () -> reindenter.maxWidth(first, last, SignatureLayout.plan(tokens,
                        signature.withLayout(LayoutChoice.SINGLE_LINE, null), indentWidth)));
        AlignmentGroup arrows = choice == LayoutChoice.MULTI_LINE
                ? new AlignmentGroup("->", signature.getSegmentCount(), 1 + indentWidth)
                : null;
        TypeSignature laidOut = signature.withLayout(choice, arrows);
        IndentPlan plan = SignatureLayout.plan(tokens, laidOut, indentWidth);
        return laidOut.withIndentPlan(signature.getIndentPlan().merge(plan));
    }

    /**
     * Lines over the budget inside a function clause or a class or instance
     * body are broken after their operators, one argument per line, or
     * before each arrow of a signature.
     */
    private Declaration _splitLongLines(List<Token> tokens, LineReindenter reindenter, Declaration declaration,
                                        HaskellStyleConfig config) {
        IndentPlan split = LongLineSplitter.plan(tokens, reindenter, declaration, config.getMaxLineLength(),
                config.getIndentWidth());
        if (split.isEmpty()) {
            return declaration;
        }
        return declaration.withIndentPlan(declaration.getIndentPlan().merge(split));
    }

    private static boolean _hasSplittableBody(Declaration declaration) {
        if (declaration instanceof FunctionClause) {
            return true;
        }
        if (declaration instanceof OpaqueDecl) {
            OpaqueKind kind = ((OpaqueDecl) declaration).getOpaqueKind();
            return kind == OpaqueKind.CLASS || kind == OpaqueKind.INSTANCE;
        }
        return false;
    }

    private static boolean _listSpansLines(List<Token> tokens, BracketList<?> list) {
        return tokens.get(list.getOpenToken()).isFirstOnLine()
                || TokenText.spansLines(tokens, list.getOpenToken(), list.getCloseToken());
    }

    private static LayoutChoice _choose(HaskellStyleConfig config, LayoutTarget target, int itemCount,
                                        boolean spansLines, boolean hasComments, IntSupplier singleLineWidth) {
        if (itemCount == 0) {
            return LayoutChoice.SINGLE_LINE;
        }
        if (config.getLayoutPolicy(target) == LayoutPolicy.ALWAYS_MULTILINE || hasComments
                || (spansLines && itemCount > 1)) {
            return LayoutChoice.MULTI_LINE;
        }
        return singleLineWidth.getAsInt() <= config.getMaxLineLength()
                ? LayoutChoice.SINGLE_LINE
                : LayoutChoice.MULTI_LINE;
    }
}
