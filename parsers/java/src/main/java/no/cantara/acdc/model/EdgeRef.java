package no.cantara.acdc.model;

import no.cantara.acdc.AcdcException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A reference from one container to another.
 *
 * <p>Wire form: {@code {"n": target, "s": schema, "o": operator}}, where {@code s} and
 * {@code o} are optional. An operator is only written when it was given explicitly.
 *
 * @param target   identifier of the referenced container
 * @param schema   schema the referenced container must use, or {@code null}
 * @param operator combinator tag, or {@code null} for the default ({@link EdgeOperator#AND})
 */
public record EdgeRef(String target, String schema, EdgeOperator operator) {

    public static final String NODE = "n";
    public static final String SCHEMA = "s";
    public static final String OPERATOR = "o";

    public EdgeRef {
        if (target == null || target.isBlank()) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "edge target 'n' is required");
        }
    }

    public static EdgeRef to(String target) {
        return new EdgeRef(target, null, null);
    }

    public EdgeRef withSchema(String requiredSchema) {
        return new EdgeRef(target, requiredSchema, operator);
    }

    public EdgeRef withOperator(EdgeOperator op) {
        return new EdgeRef(target, schema, op);
    }

    /** The operator that applies, with the default filled in. */
    public EdgeOperator effectiveOperator() {
        return operator != null ? operator : EdgeOperator.AND;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(NODE, target);
        if (schema != null) {
            m.put(SCHEMA, schema);
        }
        if (operator != null) {
            m.put(OPERATOR, operator.name());
        }
        return m;
    }

    public static EdgeRef fromMap(String label, Map<?, ?> m) {
        if (!(m.get(NODE) instanceof String target)) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "edge '" + label + "': 'n' must be a string");
        }
        Object schema = m.get(SCHEMA);
        if (schema != null && !(schema instanceof String)) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "edge '" + label + "': 's' must be a string");
        }
        Object op = m.get(OPERATOR);
        return new EdgeRef(target, (String) schema, op == null ? null : EdgeOperator.parse(op));
    }
}
