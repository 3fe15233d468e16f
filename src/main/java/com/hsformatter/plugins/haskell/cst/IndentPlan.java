package com.hsformatter.plugins.haskell.cst;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Whitespace decisions for the tokens of one rendered unit, keyed by token
 * index. A token with no entry keeps the whitespace it had in the source
 * (line starts keep their original column).
 *
 * <ul>
 *   <li>column: a token that already starts a line moves to a new column</li>
 *   <li>break: a new line is started before the token, at the given column</li>
 *   <li>join: the token follows the previous one on the same line after the
 *       given number of spaces</li>
 *   <li>text: the token is printed with replacement text</li>
 * </ul>
 */
public final class IndentPlan {
    public static final IndentPlan EMPTY = new IndentPlan(
            Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap());

    private final Map<Integer, Integer> lineColumns;
    private final Map<Integer, Integer> breaks;
    private final Map<Integer, Integer> joins;
    private final Map<Integer, String> textOverrides;

    private IndentPlan(Map<Integer, Integer> lineColumns, Map<Integer, Integer> breaks,
                       Map<Integer, Integer> joins, Map<Integer, String> textOverrides) {
        this.lineColumns = lineColumns;
        this.breaks = breaks;
        this.joins = joins;
        this.textOverrides = textOverrides;
    }

    public boolean isEmpty() {
        return lineColumns.isEmpty() && breaks.isEmpty() && joins.isEmpty() && textOverrides.isEmpty();
    }

    public boolean hasColumn(int tokenIndex) {
        return lineColumns.containsKey(tokenIndex);
    }

    public int getColumn(int tokenIndex, int defaultColumn) {
        return lineColumns.getOrDefault(tokenIndex, defaultColumn);
    }

    public boolean hasBreak(int tokenIndex) {
        return breaks.containsKey(tokenIndex);
    }

    public int getBreakColumn(int tokenIndex) {
        return breaks.get(tokenIndex);
    }

    public boolean hasJoin(int tokenIndex) {
        return joins.containsKey(tokenIndex);
    }

    public int getJoinSpaces(int tokenIndex) {
        return joins.get(tokenIndex);
    }

    public String getText(int tokenIndex, String original) {
        return textOverrides.getOrDefault(tokenIndex, original);
    }

    public boolean hasBreaks() {
        return !breaks.isEmpty();
    }

    public boolean hasTextOverrides() {
        return !textOverrides.isEmpty();
    }

    public Map<Integer, Integer> getLineColumns() {
        return lineColumns;
    }

    public Map<Integer, Integer> getBreaks() {
        return breaks;
    }

    public Map<Integer, Integer> getJoins() {
        return joins;
    }

    public Map<Integer, String> getTextOverrides() {
        return textOverrides;
    }

    /**
     * A plan holding the entries of both plans; on conflict {@code other} wins.
     */
    public IndentPlan merge(IndentPlan other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return toBuilder().addAll(other).build();
    }

    public Builder toBuilder() {
        return new Builder().addAll(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "IndentPlan{columns=" + lineColumns + ", breaks=" + breaks
                + ", joins=" + joins + ", text=" + textOverrides + "}";
    }

    public static class Builder {
        private final Map<Integer, Integer> lineColumns = new HashMap<>();
        private final Map<Integer, Integer> breaks = new HashMap<>();
        private final Map<Integer, Integer> joins = new HashMap<>();
        private final Map<Integer, String> textOverrides = new HashMap<>();

        public Builder column(int tokenIndex, int column) {
            lineColumns.put(tokenIndex, column);
            return this;
        }

        public Builder breakBefore(int tokenIndex, int column) {
            joins.remove(tokenIndex);
            breaks.put(tokenIndex, column);
            return this;
        }

        public Builder join(int tokenIndex, int spaces) {
            breaks.remove(tokenIndex);
            joins.put(tokenIndex, spaces);
            return this;
        }

        public Builder text(int tokenIndex, String text) {
            textOverrides.put(tokenIndex, text);
            return this;
        }

        public boolean hasColumn(int tokenIndex) {
            return lineColumns.containsKey(tokenIndex);
        }

        public int getColumn(int tokenIndex, int defaultColumn) {
            return lineColumns.getOrDefault(tokenIndex, defaultColumn);
        }

        public boolean hasBreak(int tokenIndex) {
            return breaks.containsKey(tokenIndex);
        }

        public int getBreakColumn(int tokenIndex) {
            return breaks.get(tokenIndex);
        }

        public Builder addAll(IndentPlan plan) {
            lineColumns.putAll(plan.lineColumns);
            for (Map.Entry<Integer, Integer> entry : plan.breaks.entrySet()) {
                breakBefore(entry.getKey(), entry.getValue());
            }
            for (Map.Entry<Integer, Integer> entry : plan.joins.entrySet()) {
                join(entry.getKey(), entry.getValue());
            }
            textOverrides.putAll(plan.textOverrides);
            return this;
        }

        public IndentPlan build() {
            if (lineColumns.isEmpty() && breaks.isEmpty() && joins.isEmpty() && textOverrides.isEmpty()) {
                return EMPTY;
            }
            return new IndentPlan(Map.copyOf(lineColumns), Map.copyOf(breaks),
                    Map.copyOf(joins), Map.copyOf(textOverrides));
        }
    }
}
