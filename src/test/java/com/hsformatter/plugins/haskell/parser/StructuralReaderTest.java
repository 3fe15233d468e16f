package com.hsformatter.plugins.haskell.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.error.ParseException;
import com.hsformatter.plugins.haskell.cst.Constructor;
import com.hsformatter.plugins.haskell.cst.DataDecl;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.DerivingClause;
import com.hsformatter.plugins.haskell.cst.ExportItem;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.ImportDecl;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.ModuleHeader;
import com.hsformatter.plugins.haskell.cst.OpaqueDecl;
import com.hsformatter.plugins.haskell.cst.OpaqueKind;
import com.hsformatter.plugins.haskell.cst.PragmaKind;
import com.hsformatter.plugins.haskell.cst.RecordField;
import com.hsformatter.plugins.haskell.cst.TypeSignature;
import com.hsformatter.plugins.haskell.lexer.Tokenizer;

class StructuralReaderTest {

    private static Module _parse(String source) {
        return StructuralReader.parse(Tokenizer.tokenize(source));
    }

    @Test
    void readsHeaderWithExports() {
        Module module = _parse("module Data.Shop (Item (..), addItem, module Data.Shop.Types) where\n");

        ModuleHeader header = module.getHeader();
        assertThat(header.getName()).isEqualTo("Data.Shop");
        assertThat(module.getModuleName()).isEqualTo("Data.Shop");
        assertThat(header.getExports().getItems()).extracting(ExportItem::getText)
                .containsExactly("Item (..)", "addItem", "module Data.Shop.Types");
        assertThat(header.getExports().getItems().get(2).isModuleReexport()).isTrue();
        assertThat(header.getExports().getItems().get(2).getReexportedModule()).isEqualTo("Data.Shop.Types");
        assertThat(module.getToken(header.getWhereToken()).isKeyword("where")).isTrue();
    }

    @Test
    void moduleWithoutHeaderIsMain() {
        Module module = _parse("main :: IO ()\nmain = pure ()\n");

        assertThat(module.getHeader()).isNull();
        assertThat(module.getModuleName()).isEqualTo("Main");
        assertThat(module.getDeclarations()).hasSize(2);
    }

    @Test
    void readsImportsAndTheirGroups() {
        Module module = _parse("module M where\n\n"
                + "import qualified Data.Map.Strict as Map\n"
                + "import Data.List (sortOn, foldl')\n"
                + "\n"
                + "import Prelude hiding (lookup)\n"
                + "import M.Internal\n");

        List<ImportDecl> imports = module.getImports();
        assertThat(module.getImportGroups()).hasSize(2);
        assertThat(imports).extracting(ImportDecl::getModuleName)
                .containsExactly("Data.Map.Strict", "Data.List", "Prelude", "M.Internal");

        assertThat(imports.get(0).isQualified()).isTrue();
        assertThat(imports.get(0).getAlias()).isEqualTo("Map");
        assertThat(imports.get(0).getImportList()).isNull();
        assertThat(imports.get(1).getImportList().getItems()).hasSize(2);
        assertThat(imports.get(2).isHiding()).isTrue();
        assertThat(imports.get(3).getSourceIndex()).isEqualTo(3);
    }

    @Test
    void postpositiveQualifiedImport() {
        Module module = _parse("import Data.Text qualified as T\n");

        ImportDecl importDecl = module.getImports().get(0);
        assertThat(importDecl.getModuleName()).isEqualTo("Data.Text");
        assertThat(importDecl.isQualified()).isTrue();
        assertThat(importDecl.getAlias()).isEqualTo("T");
    }

    @Test
    void classifiesDeclarations() {
        Module module = _parse("module M (f) where\n\n"
                + "f :: Int -> Int\n"
                + "f x = x + 1\n\n"
                + "class Shape a where\n"
                + "  area :: a -> Double\n\n"
                + "infixl 6 <+>\n");

        List<Declaration> declarations = module.getDeclarations();
        assertThat(declarations).hasSize(4);
        assertThat(declarations.get(0)).isInstanceOf(TypeSignature.class);
        assertThat(((TypeSignature) declarations.get(0)).getNames()).containsExactly("f");
        assertThat(declarations.get(1)).isInstanceOf(FunctionClause.class);
        assertThat(declarations.get(1).getName()).isEqualTo("f");
        assertThat(((OpaqueDecl) declarations.get(2)).getOpaqueKind()).isEqualTo(OpaqueKind.CLASS);
        assertThat(((OpaqueDecl) declarations.get(3)).getOpaqueKind()).isEqualTo(OpaqueKind.FIXITY);
    }

    @Test
    void readsSumTypeWithDeriving() {
        Module module = _parse("data TrafficLight = Red | Yellow | Green deriving (Eq, Ord)\n");

        DataDecl decl = (DataDecl) module.getDeclarations().get(0);
        assertThat(decl.getName()).isEqualTo("TrafficLight");
        assertThat(decl.isSumType()).isTrue();
        assertThat(decl.getConstructors()).extracting(Constructor::getName)
                .containsExactly("Red", "Yellow", "Green");
        assertThat(decl.getDerivings()).hasSize(1);
        DerivingClause deriving = decl.getDerivings().get(0);
        assertThat(deriving.isParenthesized()).isTrue();
        assertThat(deriving.getClassNames()).containsExactly("Eq", "Ord");
    }

    @Test
    void readsRecordFieldsAndStrictness() {
        Module module = _parse("data Person = Person\n"
                + "  { name :: !Text\n"
                + "  , age, height :: Int\n"
                + "  }\n"
                + "  deriving stock Show\n");

        DataDecl decl = (DataDecl) module.getDeclarations().get(0);
        assertThat(decl.isSingleRecord()).isTrue();
        List<RecordField> fields = decl.getAllFields();
        assertThat(fields).hasSize(2);
        assertThat(fields.get(0).getNames()).containsExactly("name");
        assertThat(fields.get(0).isStrict()).isTrue();
        assertThat(fields.get(1).getNames()).containsExactly("age", "height");
        assertThat(fields.get(1).isStrict()).isFalse();

        DerivingClause deriving = decl.getDerivings().get(0);
        assertThat(deriving.getStrategy()).isEqualTo("stock");
        assertThat(deriving.isBareClass()).isTrue();
    }

    @Test
    void collectsLanguageExtensions() {
        Module module = _parse("{-# LANGUAGE OverloadedStrings, LambdaCase #-}\n"
                + "{-# OPTIONS_GHC -Wall #-}\n"
                + "module M where\n");

        assertThat(module.getHeaderPragmas()).hasSize(2);
        assertThat(module.getHeaderPragmas().get(0).getPragmaKind()).isEqualTo(PragmaKind.LANGUAGE);
        assertThat(module.hasExtension("OverloadedStrings")).isTrue();
        assertThat(module.hasExtension("LambdaCase")).isTrue();
    }

    @Test
    void cppKeepsTheBodyVerbatim() {
        Module module = _parse("module M where\n#if 1\nx = 1\n#endif\n");

        assertThat(module.isBodyVerbatim()).isTrue();
    }

    @Test
    void explicitBracesKeepTheBodyVerbatim() {
        Module module = _parse("module M where {\nx = 1;\ny = 2 }\n");

        assertThat(module.isBodyVerbatim()).isTrue();
    }

    @Test
    void rejectsUnclosedBracket() {
        assertThatThrownBy(() -> _parse("f = (1 + 2\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unclosed bracket")
                .satisfies(e -> assertThat(((ParseException) e).getExpected()).isEqualTo(")"));
    }

    @Test
    void rejectsMismatchedBracket() {
        assertThatThrownBy(() -> _parse("f = [1, 2)\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Mismatched bracket");
    }

    @Test
    void rejectsUnterminatedTokens() {
        assertThatThrownBy(() -> _parse("s = \"abc\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated string literal");
        assertThatThrownBy(() -> _parse("x = 1\n{- open comment\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated block comment");
        assertThatThrownBy(() -> _parse("{-# LANGUAGE GADTs\nmodule M where\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated pragma");
    }

    @Test
    void parseErrorCarriesPosition() {
        assertThatThrownBy(() -> _parse("x = 1\ny = )\n"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> {
                    ParseException parseException = (ParseException) e;
                    assertThat(parseException.getLine()).isEqualTo(2);
                    assertThat(parseException.getColumn()).isEqualTo(5);
                });
    }
}
