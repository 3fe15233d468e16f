package com.hsformatter.plugins.haskell.rules;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.config.ImportCategory;
import com.hsformatter.plugins.haskell.HaskellFormatter;
import com.hsformatter.plugins.haskell.cst.ImportDecl;
import com.hsformatter.plugins.haskell.cst.ImportGroup;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.lexer.Tokenizer;
import com.hsformatter.plugins.haskell.parser.StructuralReader;

class ImportOrderingPassTest {
    private final HaskellStyleConfig config = HaskellStyleConfig.defaults();

    private static PassResult _apply(String source, HaskellStyleConfig config) {
        Module module = StructuralReader.parse(Tokenizer.tokenize(source));
        return new ImportOrderingPass().apply(module, config);
    }

    @Test
    void categorizesByRootComponentWithoutPrefixes() {
        assertThat(ImportOrderingPass.categorize("Shop.Cart.Types", "Shop.Cart", List.of()))
                .isEqualTo(ImportCategory.LOCAL);
        assertThat(ImportOrderingPass.categorize("Data.Text", "Shop.Cart", List.of()))
                .isEqualTo(ImportCategory.EXTERNAL);
    }

    @Test
    void categorizesByConfiguredPrefixes() {
        List<String> prefixes = List.of("Shop.Core", "Billing");

        assertThat(ImportOrderingPass.categorize("Shop.Core", "Main", prefixes)).isEqualTo(ImportCategory.LOCAL);
        assertThat(ImportOrderingPass.categorize("Billing.Invoice", "Main", prefixes))
                .isEqualTo(ImportCategory.LOCAL);
        assertThat(ImportOrderingPass.categorize("Shop.CoreExtras", "Main", prefixes))
                .isEqualTo(ImportCategory.EXTERNAL);
        assertThat(ImportOrderingPass.categorize("Shop.Cart", "Shop.Cart", prefixes))
                .isEqualTo(ImportCategory.EXTERNAL);
    }

    @Test
    void groupsExternalBeforeLocalAndSortsEachGroup() {
        PassResult result = _apply("module Shop.Cart (Cart) where\n\n"
                + "import Shop.Item (Item)\n"
                + "import qualified Data.Map as Map\n"
                + "import Shop.Price (Price)\n"
                + "import Control.Monad (when)\n", config);

        List<ImportGroup> groups = result.getModule().getImportGroups();
        assertThat(groups).extracting(ImportGroup::getCategory)
                .containsExactly(ImportCategory.EXTERNAL, ImportCategory.LOCAL);
        assertThat(groups.get(0).getImports()).extracting(ImportDecl::getModuleName)
                .containsExactly("Control.Monad", "Data.Map");
        assertThat(groups.get(1).getImports()).extracting(ImportDecl::getModuleName)
                .containsExactly("Shop.Item", "Shop.Price");
    }

    @Test
    void configuredGroupOrderIsHonoured() {
        HaskellStyleConfig localFirst = config.toBuilder()
                .importGroupOrder(List.of(ImportCategory.LOCAL))
                .build();

        PassResult result = _apply("module Shop.Cart (Cart) where\n\n"
                + "import Data.Map (Map)\n"
                + "import Shop.Item (Item)\n", localFirst);

        assertThat(result.getModule().getImportGroups()).extracting(ImportGroup::getCategory)
                .containsExactly(ImportCategory.LOCAL, ImportCategory.EXTERNAL);
    }

    @Test
    void duplicateModulesKeepASortedStableOrder() {
        PassResult result = _apply("module M (x) where\n\n"
                + "import Data.Map (insert)\n"
                + "import Data.Map (Map)\n", config);

        List<ImportDecl> imports = result.getModule().getImports();
        assertThat(imports).extracting(ImportDecl::getSourceIndex).containsExactly(1, 0);
    }

    @Test
    void alreadyOrderedImportsLeaveTheModuleAlone() {
        String source = "module Shop.Cart (Cart) where\n\n"
                + "import Data.Map (Map)\n"
                + "\n"
                + "import Shop.Item (Item)\n";
        Module module = StructuralReader.parse(Tokenizer.tokenize(source));

        PassResult result = new ImportOrderingPass().apply(module, config);

        assertThat(result.getModule()).isSameAs(module);
        assertThat(new HaskellFormatter().format(source, config).getFormattedCode()).isEqualTo(source);
    }

    @Test
    void reportsOpenAndOversizedImports() {
        HaskellStyleConfig lowThreshold = config.toBuilder().qualifyImportThreshold(3).build();

        List<Diagnostic> diagnostics = _apply("module M (x) where\n\n"
                + "import Data.Text\n"
                + "import Data.List (sortOn, nub, group)\n"
                + "import Data.Char hiding (isSpace, isDigit, ord)\n"
                + "import qualified Data.Set as Set\n", lowThreshold).getDiagnostics();

        assertThat(diagnostics).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.MISSING_IMPORT_LIST, DiagnosticKind.QUALIFICATION_CANDIDATE);
        assertThat(diagnostics.get(0).getSuggestion()).isEqualTo("import qualified Data.Text");
    }

    @Test
    void reexportedModuleNeedsNoImportList() {
        List<Diagnostic> diagnostics = _apply("module M (module Data.Text) where\n\n"
                + "import Data.Text\n", config).getDiagnostics();

        assertThat(diagnostics).isEmpty();
    }

    @Test
    void blankLineSeparatesGroupsInTheOutput() {
        String formatted = new HaskellFormatter().format("module Shop.Cart (Cart) where\n\n"
                + "import Shop.Item (Item)\n"
                + "import Data.Map (Map)\n", config).getFormattedCode();

        assertThat(formatted).isEqualTo("module Shop.Cart (Cart) where\n\n"
                + "import Data.Map (Map)\n"
                + "\n"
                + "import Shop.Item (Item)\n");
    }

    @Test
    void commentsTravelWithTheirImport() {
        String formatted = new HaskellFormatter().format("module M (x) where\n\n"
                + "-- for text\n"
                + "import Data.Text (Text)\n"
                + "-- for control\n"
                + "import Control.Monad (when)\n", config).getFormattedCode();

        assertThat(formatted).isEqualTo("module M (x) where\n\n"
                + "-- for control\n"
                + "import Control.Monad (when)\n"
                + "-- for text\n"
                + "import Data.Text (Text)\n");
    }
}
