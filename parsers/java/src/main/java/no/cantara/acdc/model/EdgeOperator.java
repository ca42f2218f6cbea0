package no.cantara.acdc.model;

import no.cantara.acdc.AcdcException;

/**
 * How an edge combines with its siblings during chain validation.
 */
public enum EdgeOperator {
    /** Every AND edge must validate. */
    AND,
    /** At least one OR edge must validate. */
    OR,
    /** The edge must not validate; an unresolvable target satisfies it. */
    NOT;

    /** Parses a wire tag; {@code null} means the default, {@link #AND}. */
    public static EdgeOperator parse(Object tag) {
        if (tag == null) {
            return AND;
        }
        for (EdgeOperator op : values()) {
            if (op.name().equals(tag)) {
                return op;
            }
        }
        throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "unknown edge operator '" + tag + "'");
    }
}
