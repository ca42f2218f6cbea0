package no.cantara.acdc.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import no.cantara.acdc.AcdcException;
import no.cantara.acdc.model.Container;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a container's logical fields into canonical bytes and back.
 *
 * <p>Top-level labels always come out in the order of {@link #LABELS}; absent optional
 * sections are left out, never written as null. Nested maps keep the order their entries
 * were inserted in. The same content gives different bytes in different kinds; only
 * same-kind round trips are byte-stable.
 */
public final class CanonicalCodec {

    public static final String VERSION = "v";
    public static final String DIGEST = "d";
    public static final String ISSUER = "i";
    public static final String REGISTRY = "ri";
    public static final String SCHEMA = "s";
    public static final String ATTRIBUTES = "a";
    public static final String EDGES = "e";
    public static final String RULES = "r";

    public static final List<String> LABELS =
            List.of(VERSION, DIGEST, ISSUER, REGISTRY, SCHEMA, ATTRIBUTES, EDGES, RULES);

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private CanonicalCodec() {}

    /**
     * The container's fields in wire order. A container that was never sealed gets empty
     * strings for {@code v} and {@code d}; the identifier engine overwrites both in place.
     */
    public static LinkedHashMap<String, Object> fields(Container container) {
        LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
        fields.put(VERSION, container.version() != null ? container.version().encode() : "");
        fields.put(DIGEST, container.digest() != null ? container.digest() : "");
        fields.put(ISSUER, container.issuer());
        fields.put(REGISTRY, container.registryIdentifier());
        fields.put(SCHEMA, container.schema());
        if (container.attributes() != null) {
            fields.put(ATTRIBUTES, container.attributes().toWire());
        }
        if (container.edges() != null) {
            fields.put(EDGES, container.edges().toWire());
        }
        if (container.rules() != null) {
            fields.put(RULES, container.rules().toWire());
        }
        return fields;
    }

    public static byte[] encode(SerializationKind kind, Map<String, ?> fields) {
        try {
            return kind.mapper().writeValueAsBytes(fields);
        } catch (JsonProcessingException e) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD,
                    "cannot serialize as " + kind.code() + ": " + e.getOriginalMessage(), e);
        }
    }

    public static byte[] encode(Container container) {
        if (container.version() == null) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "container has no version header");
        }
        return encode(container.version().kind(), fields(container));
    }

    /**
     * Decodes one top-level map, keeping key order.
     *
     * @throws AcdcException {@code MALFORMED_BODY} if the bytes are not a single well-formed map
     */
    public static LinkedHashMap<String, Object> decode(SerializationKind kind, byte[] raw) {
        try {
            LinkedHashMap<String, Object> fields = kind.mapper().readValue(raw, FIELDS);
            if (fields == null) {
                throw new AcdcException(AcdcException.Reason.MALFORMED_BODY, "empty " + kind.code() + " body");
            }
            if (kind == SerializationKind.MGPK) {
                requireSingleValue(raw);
            }
            return fields;
        } catch (IOException | MessagePackException e) {
            throw new AcdcException(AcdcException.Reason.MALFORMED_BODY,
                    "unreadable " + kind.code() + " body: " + e.getMessage(), e);
        }
    }

    private static void requireSingleValue(byte[] raw) throws IOException {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(raw)) {
            unpacker.skipValue();
            if (unpacker.hasNext()) {
                throw new AcdcException(AcdcException.Reason.MALFORMED_BODY,
                        "trailing bytes after MGPK body at offset " + unpacker.getTotalReadBytes());
            }
        }
    }
}
