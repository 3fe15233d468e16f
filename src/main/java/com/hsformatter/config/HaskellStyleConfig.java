package com.hsformatter.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.util.LoggerUtil;

/**
 * Typed, immutable view of the {@code general} and {@code plugins.haskell}
 * configuration sections. Safe to share between threads.
 */
public final class HaskellStyleConfig {
    private static final Logger logger = LoggerUtil.getLogger(HaskellStyleConfig.class);

    public static final String PLUGIN_NAME = "haskell";
    public static final String DEFAULT_FUNCTION_PATTERN = "^_?[a-z][a-zA-Z0-9']*$";
    public static final String DEFAULT_TYPE_PATTERN = "^[A-Z][a-zA-Z0-9']*$";

    private static final HaskellStyleConfig DEFAULTS = builder().build();

    private final int indentWidth;
    private final int maxLineLength;
    private final List<ImportCategory> importGroupOrder;
    private final List<String> localModulePrefixes;
    private final int qualifyImportThreshold;
    private final Set<DiagnosticKind> enabledLintChecks;
    private final Pattern functionNamePattern;
    private final Pattern typeNamePattern;
    private final Map<LayoutTarget, LayoutPolicy> layoutPolicies;
    private final boolean alignRecordFields;
    private final int maxCompositionChain;
    private final boolean verifyIdempotence;

    private HaskellStyleConfig(Builder builder) {
        this.indentWidth = builder.indentWidth;
        this.maxLineLength = builder.maxLineLength;
        this.importGroupOrder = List.copyOf(builder.importGroupOrder);
        this.localModulePrefixes = List.copyOf(builder.localModulePrefixes);
        this.qualifyImportThreshold = builder.qualifyImportThreshold;
        this.enabledLintChecks = builder.enabledLintChecks.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.enabledLintChecks));
        this.functionNamePattern = builder.functionNamePattern;
        this.typeNamePattern = builder.typeNamePattern;
        this.layoutPolicies = Collections.unmodifiableMap(new EnumMap<>(builder.layoutPolicies));
        this.alignRecordFields = builder.alignRecordFields;
        this.maxCompositionChain = builder.maxCompositionChain;
        this.verifyIdempotence = builder.verifyIdempotence;
    }

    public static HaskellStyleConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Builds the typed view from raw configuration. Values the loader already
     * validated are trusted; anything unparsable falls back to its default.
     */
    public static HaskellStyleConfig from(FormatterConfig config) {
        Builder builder = builder()
                .indentWidth(config.getGeneralConfig("indentWidth", 2))
                .maxLineLength(config.getGeneralConfig("maxLineLength", 80))
                .qualifyImportThreshold(config.getPluginConfig(PLUGIN_NAME, "qualifyImportThreshold", 15))
                .alignRecordFields(config.getPluginConfig(PLUGIN_NAME, "alignRecordFields", true))
                .maxCompositionChain(config.getPluginConfig(PLUGIN_NAME, "maxCompositionChain", 4))
                .verifyIdempotence(config.getPluginConfig(PLUGIN_NAME, "verifyIdempotence", false))
                .localModulePrefixes(config.getPluginStringList(PLUGIN_NAME, "localModulePrefixes", List.of()));

        List<ImportCategory> order = new ArrayList<>();
        for (String name : config.getPluginStringList(PLUGIN_NAME, "importGroupOrder", List.of("external", "local"))) {
            ImportCategory category = ImportCategory.parse(name);
            if (category == null) {
                logger.warning("Unknown import group '" + name + "' ignored");
            } else if (!order.contains(category)) {
                order.add(category);
            }
        }
        builder.importGroupOrder(order);

        Set<DiagnosticKind> checks = EnumSet.noneOf(DiagnosticKind.class);
        for (String name : config.getPluginStringList(PLUGIN_NAME, "enabledLintChecks", List.of())) {
            try {
                checks.add(DiagnosticKind.valueOf(name.trim().toUpperCase().replace('-', '_')));
            } catch (IllegalArgumentException e) {
                logger.warning("Unknown lint check '" + name + "' ignored");
            }
        }
        builder.enabledLintChecks(checks);

        Map<String, String> naming = config.getPluginStringMap(PLUGIN_NAME, "namingCaseRules");
        builder.functionNamePattern(naming.getOrDefault("function", DEFAULT_FUNCTION_PATTERN));
        builder.typeNamePattern(naming.getOrDefault("type", DEFAULT_TYPE_PATTERN));

        Map<String, String> policies = config.getPluginStringMap(PLUGIN_NAME, "layoutPolicies");
        for (LayoutTarget target : LayoutTarget.values()) {
            String value = policies.get(target.getConfigKey());
            LayoutPolicy policy = LayoutPolicy.parse(value, null);
            if (value != null && policy == null) {
                logger.warning("Unknown layout policy '" + value + "' for " + target.getConfigKey() + ", using AUTO");
            }
            builder.layoutPolicy(target, policy == null ? LayoutPolicy.AUTO : policy);
        }

        return builder.build();
    }

    // Getters
    public int getIndentWidth() { return indentWidth; }
    public int getMaxLineLength() { return maxLineLength; }
    public List<ImportCategory> getImportGroupOrder() { return importGroupOrder; }
    public List<String> getLocalModulePrefixes() { return localModulePrefixes; }
    public int getQualifyImportThreshold() { return qualifyImportThreshold; }
    public Pattern getFunctionNamePattern() { return functionNamePattern; }
    public Pattern getTypeNamePattern() { return typeNamePattern; }
    public boolean isAlignRecordFields() { return alignRecordFields; }
    public int getMaxCompositionChain() { return maxCompositionChain; }
    public boolean isVerifyIdempotence() { return verifyIdempotence; }

    public LayoutPolicy getLayoutPolicy(LayoutTarget target) {
        return layoutPolicies.getOrDefault(target, LayoutPolicy.AUTO);
    }

    /**
     * An empty {@code enabledLintChecks} list enables every check.
     */
    public boolean isCheckEnabled(DiagnosticKind kind) {
        return enabledLintChecks.isEmpty() || enabledLintChecks.contains(kind);
    }

    public String indent(int units) {
        return " ".repeat(indentWidth * units);
    }

    public Builder toBuilder() {
        Builder builder = builder()
                .indentWidth(indentWidth)
                .maxLineLength(maxLineLength)
                .importGroupOrder(importGroupOrder)
                .localModulePrefixes(localModulePrefixes)
                .qualifyImportThreshold(qualifyImportThreshold)
                .enabledLintChecks(enabledLintChecks)
                .functionNamePattern(functionNamePattern.pattern())
                .typeNamePattern(typeNamePattern.pattern())
                .alignRecordFields(alignRecordFields)
                .maxCompositionChain(maxCompositionChain)
                .verifyIdempotence(verifyIdempotence);
        layoutPolicies.forEach(builder::layoutPolicy);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int indentWidth = 2;
        private int maxLineLength = 80;
        private List<ImportCategory> importGroupOrder = List.of(ImportCategory.EXTERNAL, ImportCategory.LOCAL);
        private List<String> localModulePrefixes = List.of();
        private int qualifyImportThreshold = 15;
        private Set<DiagnosticKind> enabledLintChecks = new LinkedHashSet<>();
        private Pattern functionNamePattern = Pattern.compile(DEFAULT_FUNCTION_PATTERN);
        private Pattern typeNamePattern = Pattern.compile(DEFAULT_TYPE_PATTERN);
        private final Map<LayoutTarget, LayoutPolicy> layoutPolicies = new EnumMap<>(LayoutTarget.class);
        private boolean alignRecordFields = true;
        private int maxCompositionChain = 4;
        private boolean verifyIdempotence = false;

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder importGroupOrder(List<ImportCategory> importGroupOrder) {
            List<ImportCategory> order = new ArrayList<>(importGroupOrder);
            for (ImportCategory category : ImportCategory.values()) {
                if (!order.contains(category)) {
                    order.add(category);
                }
            }
            this.importGroupOrder = order;
            return this;
        }

        public Builder localModulePrefixes(List<String> localModulePrefixes) {
            this.localModulePrefixes = new ArrayList<>(localModulePrefixes);
            return this;
        }

        public Builder qualifyImportThreshold(int qualifyImportThreshold) {
            this.qualifyImportThreshold = qualifyImportThreshold;
            return this;
        }

        public Builder enabledLintChecks(Set<DiagnosticKind> enabledLintChecks) {
            this.enabledLintChecks = new LinkedHashSet<>(enabledLintChecks);
            return this;
        }

        public Builder functionNamePattern(String regex) {
            this.functionNamePattern = _compile(regex, DEFAULT_FUNCTION_PATTERN);
            return this;
        }

        public Builder typeNamePattern(String regex) {
            this.typeNamePattern = _compile(regex, DEFAULT_TYPE_PATTERN);
            return this;
        }

        public Builder layoutPolicy(LayoutTarget target, LayoutPolicy policy) {
            this.layoutPolicies.put(target, policy);
            return this;
        }

        public Builder alignRecordFields(boolean alignRecordFields) {
            this.alignRecordFields = alignRecordFields;
            return this;
        }

        public Builder maxCompositionChain(int maxCompositionChain) {
            this.maxCompositionChain = maxCompositionChain;
            return this;
        }

        public Builder verifyIdempotence(boolean verifyIdempotence) {
            this.verifyIdempotence = verifyIdempotence;
            return this;
        }

        public HaskellStyleConfig build() {
            return new HaskellStyleConfig(this);
        }

        private static Pattern _compile(String regex, String fallback) {
            try {
                return Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                logger.warning("Invalid naming pattern '" + regex + "', using " + fallback);
                return Pattern.compile(fallback);
            }
        }
    }
}
