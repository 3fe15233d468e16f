package com.hsformatter.plugins.haskell.rules;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.HaskellFormatter;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.Pragma;
import com.hsformatter.plugins.haskell.cst.PragmaKind;
import com.hsformatter.plugins.haskell.lexer.Tokenizer;
import com.hsformatter.plugins.haskell.parser.StructuralReader;

class PragmaPlacementPassTest {
    private static final String HEADER = "{-# LANGUAGE TupleSections #-}\n"
            + "{-# OPTIONS_GHC -Wall #-}\n"
            + "{-# LANGUAGE LambdaCase, DeriveGeneric #-}\n"
            + "module M where\n";

    private final HaskellStyleConfig config = HaskellStyleConfig.defaults();

    private static PassResult _apply(String source) {
        Module module = StructuralReader.parse(Tokenizer.tokenize(source));
        return new PragmaPlacementPass().apply(module, HaskellStyleConfig.defaults());
    }

    @Test
    void ordersOptionsThenSortedLanguageExtensions() {
        Module module = _apply(HEADER).getModule();

        List<Pragma> pragmas = module.getHeaderPragmas();
        assertThat(pragmas).extracting(Pragma::getPragmaKind)
                .containsExactly(PragmaKind.OPTIONS, PragmaKind.LANGUAGE, PragmaKind.LANGUAGE, PragmaKind.LANGUAGE);
        assertThat(pragmas.subList(1, 4)).extracting(p -> p.getExtensions().get(0))
                .containsExactly("DeriveGeneric", "LambdaCase", "TupleSections");
        assertThat(pragmas.subList(1, 4)).extracting(Pragma::isPrimary).containsExactly(true, false, true);
        assertThat(module.isPragmasNormalized()).isTrue();
        assertThat(module.getPragmaAlignment().getTargetColumn()).isEqualTo(28);
    }

    @Test
    void otherPragmasComeLast() {
        Module module = _apply("{-# ANN module \"HLint: ignore\" #-}\n{-# LANGUAGE GADTs #-}\nmodule M where\n")
                .getModule();

        assertThat(module.getHeaderPragmas()).extracting(Pragma::getPragmaKind)
                .containsExactly(PragmaKind.LANGUAGE, PragmaKind.OTHER);
    }

    @Test
    void rendersOnePragmaPerLineInGroups() {
        FormatterResult result = new HaskellFormatter().format(HEADER, config);

        assertThat(result.getFormattedCode()).isEqualTo("{-# OPTIONS_GHC -Wall #-}\n"
                + "\n"
                + "{-# LANGUAGE DeriveGeneric #-}\n"
                + "{-# LANGUAGE LambdaCase    #-}\n"
                + "{-# LANGUAGE TupleSections #-}\n"
                + "module M where\n");
        assertThat(result.getDiagnostics(DiagnosticKind.PRAGMA_PLACEMENT)).hasSize(1);

        FormatterResult again = new HaskellFormatter().format(result.getFormattedCode(), config);
        assertThat(again.getFormattedCode()).isEqualTo(result.getFormattedCode());
        assertThat(again.getDiagnostics(DiagnosticKind.PRAGMA_PLACEMENT)).isEmpty();
    }

    @Test
    void movesInlinePragmaBelowTheDefinition() {
        PassResult result = _apply("module M (f) where\n\nf :: Int\n{-# INLINE f #-}\nf = 1\n");

        List<Declaration> declarations = result.getModule().getDeclarations();
        assertThat(declarations.get(2)).isInstanceOf(Pragma.class);
        assertThat(result.getModule().getRelocatedPragmas()).hasSize(1);
        assertThat(result.getDiagnostics()).extracting(d -> d.getKind())
                .containsExactly(DiagnosticKind.PRAGMA_PLACEMENT);
        assertThat(result.getRefactorings()).hasSize(1);
    }

    @Test
    void pragmaAlreadyAfterTheDefinitionStays() {
        PassResult result = _apply("module M (f) where\n\nf :: Int\nf = 1\n{-# NOINLINE f #-}\n");

        assertThat(result.getDiagnostics()).isEmpty();
        assertThat(result.getModule().getRelocatedPragmas()).isEmpty();
    }

    @Test
    void pragmaForAnUnknownNameStays() {
        PassResult result = _apply("module M (f) where\n\n{-# INLINE g #-}\nf = 1\n");

        assertThat(result.getDiagnostics()).isEmpty();
        assertThat(result.getModule().getDeclarations().get(0)).isInstanceOf(Pragma.class);
    }
}
