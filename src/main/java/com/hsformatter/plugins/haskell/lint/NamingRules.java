package com.hsformatter.plugins.haskell.lint;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Constructor;
import com.hsformatter.plugins.haskell.cst.DataDecl;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.OpaqueDecl;
import com.hsformatter.plugins.haskell.cst.RecordField;
import com.hsformatter.plugins.haskell.cst.TypeSignature;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.TokenKind;

/**
 * Case rules for defined names. Functions, variables and record fields are
 * lower camel case; types, classes and constructors upper camel case.
 * Abbreviations are written like ordinary words ({@code HttpServer}, not
 * {@code HTTPServer}). Custom operators are flagged where they are defined.
 *
 * <p>Each name is reported once, at its first definition.
 */
public class NamingRules implements LintCheck {
    private final Pattern functionPattern;
    private final Pattern typePattern;

    public NamingRules(HaskellStyleConfig config) {
        this.functionPattern = config.getFunctionNamePattern();
        this.typePattern = config.getTypeNamePattern();
    }

    @Override
    public Set<DiagnosticKind> getKinds() {
        return Set.of(DiagnosticKind.NAMING_VIOLATION, DiagnosticKind.ABBREVIATION_CASING,
                DiagnosticKind.OPERATOR_DEFINITION);
    }

    @Override
    public LintResult analyze(Module module) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        _checkDeclarations(module, module.getDeclarations(), seen, diagnostics);
        return new LintResult(diagnostics);
    }

    private void _checkDeclarations(Module module, List<Declaration> declarations, Set<String> seen,
                                    List<Diagnostic> diagnostics) {
        for (Declaration declaration : declarations) {
            if (declaration instanceof TypeSignature) {
                TypeSignature signature = (TypeSignature) declaration;
                for (int nameToken : signature.getNameTokens()) {
                    _checkValueName(module.getToken(nameToken), seen, diagnostics);
                }
            } else if (declaration instanceof FunctionClause) {
                FunctionClause clause = (FunctionClause) declaration;
                if (clause.getName() != null) {
                    _checkValueName(module.getToken(clause.getNameToken()), seen, diagnostics);
                }
                _checkDeclarations(module, clause.getLocalDeclarations(), seen, diagnostics);
            } else if (declaration instanceof DataDecl) {
                _checkData(module, (DataDecl) declaration, seen, diagnostics);
            } else if (declaration instanceof OpaqueDecl) {
                _checkOpaque(module, (OpaqueDecl) declaration, seen, diagnostics);
            }
        }
    }

    private void _checkData(Module module, DataDecl decl, Set<String> seen, List<Diagnostic> diagnostics) {
        if (decl.getNameToken() >= 0) {
            _checkTypeName(module.getToken(decl.getNameToken()), seen, diagnostics);
        }
        for (Constructor constructor : decl.getConstructors()) {
            if (constructor.getNameToken() >= 0) {
                _checkTypeName(module.getToken(constructor.getNameToken()), seen, diagnostics);
            }
            for (RecordField field : constructor.getFields()) {
                for (int nameToken : field.getNameTokens()) {
                    _checkValueName(module.getToken(nameToken), seen, diagnostics);
                }
            }
        }
    }

    private void _checkOpaque(Module module, OpaqueDecl decl, Set<String> seen, List<Diagnostic> diagnostics) {
        if (decl.getName() == null) {
            return;
        }
        switch (decl.getOpaqueKind()) {
            case CLASS:
            case TYPE_SYNONYM:
            case GADT:
                for (int j = decl.getFirstToken(); j <= decl.getLastToken(); j++) {
                    if (module.getToken(j).getText().equals(decl.getName())) {
                        _checkTypeName(module.getToken(j), seen, diagnostics);
                        return;
                    }
                }
                break;
            default:
                break;
        }
    }

    private void _checkValueName(Token token, Set<String> seen, List<Diagnostic> diagnostics) {
        String name = token.getText();
        if (token.getKind() == TokenKind.OPERATOR) {
            if (seen.add("op:" + name)) {
                diagnostics.add(Findings.at(DiagnosticKind.OPERATOR_DEFINITION,
                        "Custom operator (" + name + ") is defined here; check that a named function "
                                + "would not read better", token));
            }
            return;
        }
        if (!seen.add("value:" + name)) {
            return;
        }
        if (!functionPattern.matcher(name).matches()) {
            String suggestion = toLowerCamelCase(name);
            diagnostics.add(Findings.at(DiagnosticKind.NAMING_VIOLATION,
                    "Name '" + name + "' should be lower camel case", token, token,
                    suggestion.equals(name) ? null : suggestion));
        }
        _checkAbbreviations(token, diagnostics);
    }

    private void _checkTypeName(Token token, Set<String> seen, List<Diagnostic> diagnostics) {
        String name = token.getText();
        if (token.getKind() != TokenKind.IDENTIFIER || !seen.add("type:" + name)) {
            return;
        }
        if (!typePattern.matcher(name).matches()) {
            String suggestion = toUpperCamelCase(name);
            diagnostics.add(Findings.at(DiagnosticKind.NAMING_VIOLATION,
                    "Type name '" + name + "' should be upper camel case", token, token,
                    suggestion.equals(name) ? null : suggestion));
        }
        _checkAbbreviations(token, diagnostics);
    }

    private void _checkAbbreviations(Token token, List<Diagnostic> diagnostics) {
        String name = token.getText();
        String fixed = fixAbbreviations(name);
        if (!fixed.equals(name)) {
            diagnostics.add(Findings.at(DiagnosticKind.ABBREVIATION_CASING,
                    "Abbreviation in '" + name + "' should be written as a word: " + fixed,
                    token, token, fixed));
        }
    }

    /**
     * Rewrites every run of two or more capitals inside a name that also
     * has lower-case letters: {@code parseHTTPRequest} becomes
     * {@code parseHttpRequest}. A capital directly before a lower-case
     * letter starts the next word and is kept.
     */
    public static String fixAbbreviations(String name) {
        if (name.chars().noneMatch(Character::isLowerCase)) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length());
        int i = 0;
        int n = name.length();
        while (i < n) {
            char c = name.charAt(i);
            if (!Character.isUpperCase(c)) {
                sb.append(c);
                i++;
                continue;
            }
            int j = i;
            while (j < n && Character.isUpperCase(name.charAt(j))) {
                j++;
            }
            int runEnd = j < n && Character.isLowerCase(name.charAt(j)) ? j - 1 : j;
            if (runEnd - i >= 2) {
                sb.append(c).append(name.substring(i + 1, runEnd).toLowerCase());
                sb.append(name, runEnd, j);
            } else {
                sb.append(name, i, j);
            }
            i = j;
        }
        return sb.toString();
    }

    public static String toLowerCamelCase(String name) {
        String camel = _joinWords(name);
        if (camel.isEmpty()) {
            return name;
        }
        int start = camel.startsWith("_") ? 1 : 0;
        if (start >= camel.length()) {
            return camel;
        }
        return camel.substring(0, start) + Character.toLowerCase(camel.charAt(start)) + camel.substring(start + 1);
    }

    public static String toUpperCamelCase(String name) {
        String camel = _joinWords(name);
        if (camel.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(camel.charAt(0)) + camel.substring(1);
    }

    /**
     * Drops the underscores between words and capitalizes each word after
     * the first; a single leading underscore is kept.
     */
    private static String _joinWords(String name) {
        boolean leading = name.startsWith("_");
        String[] words = (leading ? name.substring(1) : name).split("_+");
        StringBuilder sb = new StringBuilder(leading ? "_" : "");
        boolean first = true;
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (first) {
                sb.append(word);
                first = false;
            } else {
                sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return sb.toString();
    }
}
