package no.cantara.acdc.model;

import no.cantara.acdc.AcdcException;
import no.cantara.acdc.said.DigestCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A container section ({@code a}, {@code e} or {@code r}) in one of its two disclosure
 * forms: the full inline map, or the compact identifier of that map.
 */
public sealed interface Block permits Block.Inline, Block.Compact {

    /** The value written for this section on the wire. */
    Object toWire();

    /**
     * The section with its data disclosed. Entry order is kept. Nested maps and lists are
     * copied too, so later changes to the caller's data cannot reach a sealed container.
     */
    record Inline(Map<String, Object> data) implements Block {
        @SuppressWarnings("unchecked")
        public Inline {
            if (data == null) {
                throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "inline section needs a map");
            }
            data = (Map<String, Object>) frozen(data);
        }

        private static Object frozen(Object value) {
            if (value instanceof Map<?, ?> map) {
                Map<Object, Object> copy = new LinkedHashMap<>();
                map.forEach((k, v) -> copy.put(k, frozen(v)));
                return Collections.unmodifiableMap(copy);
            }
            if (value instanceof List<?> list) {
                List<Object> copy = new ArrayList<>(list.size());
                list.forEach(v -> copy.add(frozen(v)));
                return Collections.unmodifiableList(copy);
            }
            return value;
        }

        @Override
        public Object toWire() {
            return data;
        }
    }

    /** The section reduced to its self-addressing identifier. */
    record Compact(String said) implements Block {
        public Compact {
            if (!DigestCode.isSaid(said)) {
                throw new AcdcException(AcdcException.Reason.INVALID_FIELD,
                        "not a well-formed identifier: '" + said + "'");
            }
        }

        @Override
        public Object toWire() {
            return said;
        }
    }

    static Block inline(Map<String, ?> data) {
        return new Inline(data == null ? null : new LinkedHashMap<>(data));
    }

    static Block compact(String said) {
        return new Compact(said);
    }

    /**
     * Reads a section value as it comes off the wire: a map is inline, a string is compact.
     *
     * @throws AcdcException {@code INVALID_FIELD} for anything else
     */
    @SuppressWarnings("unchecked")
    static Block fromWire(String label, Object value) {
        if (value instanceof Map<?, ?> map) {
            return new Inline((Map<String, Object>) map);
        }
        if (value instanceof String said) {
            return new Compact(said);
        }
        throw new AcdcException(AcdcException.Reason.INVALID_FIELD,
                "section '" + label + "' must be a map or an identifier");
    }
}
