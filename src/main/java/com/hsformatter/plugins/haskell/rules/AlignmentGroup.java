package com.hsformatter.plugins.haskell.rules;

/**
 * Sibling constructs that share one separator column, e.g. the {@code ::} of
 * every field in a record. Produced by the alignment pass, read by the renderer.
 */
public final class AlignmentGroup {
    private final String separator;
    private final int memberCount;
    private final int targetColumn;

    public AlignmentGroup(String separator, int memberCount, int targetColumn) {
        this.separator = separator;
        this.memberCount = memberCount;
        this.targetColumn = targetColumn;
    }

    public String getSeparator() {
        return separator;
    }

    public int getMemberCount() {
        return memberCount;
    }

    /**
     * 1-based output column of the separator on every member line.
     */
    public int getTargetColumn() {
        return targetColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AlignmentGroup)) {
            return false;
        }
        AlignmentGroup other = (AlignmentGroup) o;
        return memberCount == other.memberCount && targetColumn == other.targetColumn
                && separator.equals(other.separator);
    }

    @Override
    public int hashCode() {
        return (separator.hashCode() * 31 + memberCount) * 31 + targetColumn;
    }

    @Override
    public String toString() {
        return "AlignmentGroup{'" + separator + "' x" + memberCount + " @" + targetColumn + "}";
    }
}
