package no.cantara.acdc;

/**
 * Thrown when a container cannot be built, decoded, verified or chained.
 *
 * <p>Every failure carries a {@link Reason}, so callers can branch on the kind of
 * failure without parsing messages. None of these are transient; retrying the same
 * input gives the same result.
 */
public class AcdcException extends RuntimeException {

    /** What went wrong. */
    public enum Reason {
        /** Version string cannot be parsed. */
        MALFORMED_HEADER,
        /** Version string names a serialization kind this codec does not know. */
        UNSUPPORTED_KIND,
        /** Body is not a well-formed document of the declared kind. */
        MALFORMED_BODY,
        /** Declared size differs from the actual byte length. */
        SIZE_MISMATCH,
        /** Identifier starts with an unrecognised digest code. */
        UNKNOWN_ALGORITHM,
        /** Recomputed digest differs from the stored identifier. */
        DIGEST_MISMATCH,
        /** A required field is missing or structurally invalid. */
        INVALID_FIELD,
        /** Inline data was requested from a compacted section. */
        COMPACT_ONLY,
        /** Disclosed data does not hash to the compact identifier it should replace. */
        EXPANSION_MISMATCH,
        /** An edge leads back to a container already on the current path. */
        CYCLE_DETECTED,
        /** The resolver could not supply a referenced container. */
        NOT_FOUND,
        /** A referenced container does not use the schema its edge demands. */
        SCHEMA_CONSTRAINT_FAILED,
        /** A NOT edge points at a container that validates. */
        NOT_EDGE_SATISFIED,
        /** Serialized container is too large for the fixed-width size field. */
        HEADER_SIZE_OVERFLOW
    }

    private final Reason reason;

    public AcdcException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AcdcException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return reason + ": " + super.getMessage();
    }
}
