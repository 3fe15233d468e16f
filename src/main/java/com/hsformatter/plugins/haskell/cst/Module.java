package com.hsformatter.plugins.haskell.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.rules.AlignmentGroup;

/**
 * Root of the concrete syntax tree. Holds the full token list; every other
 * node refers to it by index. Immutable; passes derive new instances through
 * {@link #toBuilder()}.
 */
public final class Module implements Node {
    private final String source;
    private final List<Token> tokens;
    private final boolean quasiQuotes;
    private final String lineSeparator;
    private final List<Pragma> headerPragmas;
    private final boolean pragmasNormalized;
    private final AlignmentGroup pragmaAlignment;
    private final ModuleHeader header;
    private final List<ImportGroup> importGroups;
    private final List<Declaration> declarations;
    private final Set<Integer> relocatedPragmas;
    private final boolean bodyVerbatim;
    private final Set<String> extensions;

    private Module(Builder builder) {
        this.source = builder.source;
        this.tokens = List.copyOf(builder.tokens);
        this.quasiQuotes = builder.quasiQuotes;
        this.lineSeparator = builder.lineSeparator;
        this.headerPragmas = List.copyOf(builder.headerPragmas);
        this.pragmasNormalized = builder.pragmasNormalized;
        this.pragmaAlignment = builder.pragmaAlignment;
        this.header = builder.header;
        this.importGroups = List.copyOf(builder.importGroups);
        this.declarations = List.copyOf(builder.declarations);
        this.relocatedPragmas = Collections.unmodifiableSet(new LinkedHashSet<>(builder.relocatedPragmas));
        this.bodyVerbatim = builder.bodyVerbatim;
        this.extensions = Collections.unmodifiableSet(new LinkedHashSet<>(builder.extensions));
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE;
    }

    @Override
    public int getFirstToken() {
        return 0;
    }

    @Override
    public int getLastToken() {
        return tokens.size() - 1;
    }

    public String getSource() { return source; }

    /**
     * Every token of the source, ending with the end-of-file token.
     */
    public List<Token> getTokens() { return tokens; }

    public Token getToken(int index) {
        return tokens.get(index);
    }

    public Token getEofToken() {
        return tokens.get(tokens.size() - 1);
    }

    public boolean isQuasiQuotes() { return quasiQuotes; }

    /**
     * The line break sequence used by the source ({@code \n} when it has none).
     */
    public String getLineSeparator() { return lineSeparator; }

    /**
     * File-header pragmas in render order.
     */
    public List<Pragma> getHeaderPragmas() { return headerPragmas; }

    /**
     * True once the pragma pass has split and sorted the header pragmas; they
     * are then printed in canonical form instead of verbatim.
     */
    public boolean isPragmasNormalized() { return pragmasNormalized; }
    public AlignmentGroup getPragmaAlignment() { return pragmaAlignment; }

    /**
     * The module header, or null for an implicit {@code Main} module.
     */
    public ModuleHeader getHeader() { return header; }
    public List<ImportGroup> getImportGroups() { return importGroups; }
    public List<Declaration> getDeclarations() { return declarations; }

    /**
     * First-token indices of per-declaration pragmas moved away from their
     * source position.
     */
    public Set<Integer> getRelocatedPragmas() { return relocatedPragmas; }

    /**
     * Imports and declarations are copied through unchanged: the body uses a
     * non-standard layout column, explicit braces or CPP directives.
     */
    public boolean isBodyVerbatim() { return bodyVerbatim; }

    /**
     * Language extensions enabled by {@code LANGUAGE} pragmas or {@code -X} options.
     */
    public Set<String> getExtensions() { return extensions; }

    public boolean hasExtension(String extension) {
        return extensions.contains(extension);
    }

    public String getModuleName() {
        return header == null ? "Main" : header.getName();
    }

    public List<ImportDecl> getImports() {
        List<ImportDecl> imports = new ArrayList<>();
        for (ImportGroup group : importGroups) {
            imports.addAll(group.getImports());
        }
        return imports;
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(headerPragmas);
        if (header != null) {
            children.add(header);
        }
        children.addAll(importGroups);
        children.addAll(declarations);
        return children;
    }

    public Builder toBuilder() {
        return new Builder()
                .source(source)
                .tokens(tokens)
                .quasiQuotes(quasiQuotes)
                .lineSeparator(lineSeparator)
                .headerPragmas(headerPragmas)
                .pragmasNormalized(pragmasNormalized)
                .pragmaAlignment(pragmaAlignment)
                .header(header)
                .importGroups(importGroups)
                .declarations(declarations)
                .relocatedPragmas(relocatedPragmas)
                .bodyVerbatim(bodyVerbatim)
                .extensions(extensions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String source = "";
        private List<Token> tokens = new ArrayList<>();
        private boolean quasiQuotes;
        private String lineSeparator = "\n";
        private List<Pragma> headerPragmas = new ArrayList<>();
        private boolean pragmasNormalized;
        private AlignmentGroup pragmaAlignment;
        private ModuleHeader header;
        private List<ImportGroup> importGroups = new ArrayList<>();
        private List<Declaration> declarations = new ArrayList<>();
        private Set<Integer> relocatedPragmas = new LinkedHashSet<>();
        private boolean bodyVerbatim;
        private Set<String> extensions = new LinkedHashSet<>();

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder tokens(List<Token> tokens) {
            this.tokens = tokens;
            return this;
        }

        public Builder quasiQuotes(boolean quasiQuotes) {
            this.quasiQuotes = quasiQuotes;
            return this;
        }

        public Builder lineSeparator(String lineSeparator) {
            this.lineSeparator = lineSeparator;
            return this;
        }

        public Builder headerPragmas(List<Pragma> headerPragmas) {
            this.headerPragmas = headerPragmas;
            return this;
        }

        public Builder pragmasNormalized(boolean pragmasNormalized) {
            this.pragmasNormalized = pragmasNormalized;
            return this;
        }

        public Builder pragmaAlignment(AlignmentGroup pragmaAlignment) {
            this.pragmaAlignment = pragmaAlignment;
            return this;
        }

        public Builder header(ModuleHeader header) {
            this.header = header;
            return this;
        }

        public Builder importGroups(List<ImportGroup> importGroups) {
            this.importGroups = importGroups;
            return this;
        }

        public Builder declarations(List<Declaration> declarations) {
            this.declarations = declarations;
            return this;
        }

        public Builder relocatedPragmas(Set<Integer> relocatedPragmas) {
            this.relocatedPragmas = relocatedPragmas;
            return this;
        }

        public Builder bodyVerbatim(boolean bodyVerbatim) {
            this.bodyVerbatim = bodyVerbatim;
            return this;
        }

        public Builder extensions(Set<String> extensions) {
            this.extensions = extensions;
            return this;
        }

        public Module build() {
            return new Module(this);
        }
    }
}
