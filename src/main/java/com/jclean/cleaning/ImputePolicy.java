package com.jclean.cleaning;

import java.util.Objects;

/**
 * How missing values should be resolved.
 */
public final class ImputePolicy {
    public enum Kind {
        DROP_ROWS,
        FILL_MEAN,
        FILL_MEDIAN,
        FILL_LITERAL
    }

    private static final ImputePolicy DROP_ROWS = new ImputePolicy(Kind.DROP_ROWS, null);
    private static final ImputePolicy FILL_MEAN = new ImputePolicy(Kind.FILL_MEAN, null);
    private static final ImputePolicy FILL_MEDIAN = new ImputePolicy(Kind.FILL_MEDIAN, null);

    private final Kind kind;
    private final String literal;

    private ImputePolicy(Kind kind, String literal) {
        this.kind = kind;
        this.literal = literal;
    }

    public static ImputePolicy dropRows() {
        return DROP_ROWS;
    }

    public static ImputePolicy fillMean() {
        return FILL_MEAN;
    }

    public static ImputePolicy fillMedian() {
        return FILL_MEDIAN;
    }

    public static ImputePolicy fillLiteral(String literal) {
        return new ImputePolicy(Kind.FILL_LITERAL, Objects.requireNonNull(literal, "literal cannot be null"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The fill text for {@link Kind#FILL_LITERAL}; null for every other kind.
     */
    public String getLiteral() {
        return literal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImputePolicy that = (ImputePolicy) o;
        return kind == that.kind && Objects.equals(literal, that.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, literal);
    }

    @Override
    public String toString() {
        return kind == Kind.FILL_LITERAL ? kind + "(" + literal + ")" : kind.toString();
    }
}
