package com.hsformatter.plugins.haskell.rules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.config.ImportCategory;
import com.hsformatter.plugins.haskell.cst.ExportItem;
import com.hsformatter.plugins.haskell.cst.ImportDecl;
import com.hsformatter.plugins.haskell.cst.ImportGroup;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.ModuleHeader;
import com.hsformatter.plugins.haskell.cst.NodeKind;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lint.Findings;
import com.hsformatter.plugins.haskell.render.TokenText;

/**
 * Groups imports by category in the configured order and sorts each group
 * by module name. Also reports unqualified imports that bring in everything,
 * and long explicit lists that read better as a qualified import.
 */
public class ImportOrderingPass implements FormattingPass {

    @Override
    public String getName() {
        return "import-ordering";
    }

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.IMPORT_GROUP, NodeKind.IMPORT_DECL);
    }

    @Override
    public PassResult apply(Module module, HaskellStyleConfig config) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        _checkImportLists(module, config, diagnostics);

        List<ImportDecl> imports = module.getImports();
        if (module.isBodyVerbatim() || imports.isEmpty()) {
            return new PassResult(module, diagnostics);
        }

        Map<ImportCategory, List<ImportDecl>> byCategory = new EnumMap<>(ImportCategory.class);
        for (ImportDecl importDecl : imports) {
            ImportCategory category = categorize(importDecl.getModuleName(), module.getModuleName(),
                    config.getLocalModulePrefixes());
            byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(importDecl);
        }

        List<Token> tokens = module.getTokens();
        Comparator<ImportDecl> order = Comparator
                .comparing(ImportDecl::getModuleName)
                .thenComparing(i -> TokenText.flatText(tokens, i.getFirstToken(), i.getLastToken()))
                .thenComparingInt(ImportDecl::getSourceIndex);

        List<ImportGroup> groups = new ArrayList<>();
        for (ImportCategory category : config.getImportGroupOrder()) {
            List<ImportDecl> members = byCategory.get(category);
            if (members != null) {
                members.sort(order);
                groups.add(new ImportGroup(members, category));
            }
        }

        if (_sameGrouping(module.getImportGroups(), groups)) {
            return new PassResult(module, diagnostics);
        }
        return new PassResult(module.toBuilder().importGroups(groups).build(), diagnostics);
    }

    /**
     * {@code LOCAL} when the name matches a configured prefix (the module
     * itself or one of its submodules). Without prefixes, imports sharing
     * the first name component with the importing module are local.
     */
    public static ImportCategory categorize(String importedModule, String ownModule, List<String> localPrefixes) {
        if (!localPrefixes.isEmpty()) {
            for (String prefix : localPrefixes) {
                if (importedModule.equals(prefix) || importedModule.startsWith(prefix + ".")) {
                    return ImportCategory.LOCAL;
                }
            }
            return ImportCategory.EXTERNAL;
        }
        return _rootComponent(importedModule).equals(_rootComponent(ownModule))
                ? ImportCategory.LOCAL
                : ImportCategory.EXTERNAL;
    }

    private static String _rootComponent(String moduleName) {
        int dot = moduleName.indexOf('.');
        return dot < 0 ? moduleName : moduleName.substring(0, dot);
    }

    private static boolean _sameGrouping(List<ImportGroup> current, List<ImportGroup> proposed) {
        if (current.size() != proposed.size()) {
            return false;
        }
        for (int g = 0; g < current.size(); g++) {
            List<ImportDecl> a = current.get(g).getImports();
            List<ImportDecl> b = proposed.get(g).getImports();
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (a.get(i).getSourceIndex() != b.get(i).getSourceIndex()) {
                    return false;
                }
            }
        }
        return true;
    }

    private void _checkImportLists(Module module, HaskellStyleConfig config, List<Diagnostic> diagnostics) {
        Set<String> reexported = new HashSet<>();
        ModuleHeader header = module.getHeader();
        if (header != null && header.getExports() != null) {
            for (ExportItem item : header.getExports().getItems()) {
                if (item.isModuleReexport()) {
                    reexported.add(item.getReexportedModule());
                }
            }
        }
        for (ImportDecl importDecl : module.getImports()) {
            if (importDecl.isQualified()) {
                continue;
            }
            Token first = module.getToken(importDecl.getFirstToken());
            Token last = module.getToken(importDecl.getLastToken());
            if (importDecl.getImportList() == null) {
                boolean reexport = reexported.contains(importDecl.getModuleName())
                        || (importDecl.getAlias() != null && reexported.contains(importDecl.getAlias()));
                if (!reexport) {
                    diagnostics.add(Findings.at(DiagnosticKind.MISSING_IMPORT_LIST,
                            "Unqualified import of " + importDecl.getModuleName()
                                    + " brings every exported name into scope",
                            first, last, "import qualified " + importDecl.getModuleName()));
                }
            } else if (!importDecl.isHiding()
                    && importDecl.getImportList().getItems().size() >= config.getQualifyImportThreshold()) {
                diagnostics.add(Findings.at(DiagnosticKind.QUALIFICATION_CANDIDATE,
                        "Import of " + importDecl.getModuleName() + " lists "
                                + importDecl.getImportList().getItems().size()
                                + " names; a qualified import would read better",
                        first, last, "import qualified " + importDecl.getModuleName()));
            }
        }
    }
}
