package no.cantara.acdc;

import no.cantara.acdc.codec.CanonicalCodec;
import no.cantara.acdc.codec.VersionHeader;
import no.cantara.acdc.model.Block;
import no.cantara.acdc.model.Container;
import no.cantara.acdc.said.SelfAddressing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Parses serialized containers of any supported kind into {@link Container}s.
 *
 * <p>Parsing checks structure only. Use {@link #verify(byte[])} (or
 * {@link Container#verify()}) before trusting the content.
 */
public class AcdcParser {

    private static final Set<String> KNOWN_LABELS = new HashSet<>(CanonicalCodec.LABELS);

    public static Container parse(Path path) throws IOException {
        return parse(Files.readAllBytes(path));
    }

    public static Container parse(InputStream is) throws IOException {
        return parse(is.readAllBytes());
    }

    public static Container parse(String text) {
        return parse(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws AcdcException {@code MALFORMED_HEADER}, {@code UNSUPPORTED_KIND},
     *                       {@code MALFORMED_BODY} or {@code INVALID_FIELD}
     */
    public static Container parse(byte[] raw) {
        VersionHeader header = VersionHeader.sniff(raw);
        return fromMap(CanonicalCodec.decode(header.kind(), raw), raw);
    }

    /**
     * Verifies a serialized container against its own bytes, without re-deriving field
     * order. Any integrity failure gives {@code false}.
     */
    public static boolean verify(byte[] raw) {
        return SelfAddressing.isValid(raw);
    }

    /** Maps decoded fields to a container that has no source bytes. */
    public static Container fromMap(Map<String, Object> data) {
        return fromMap(data, null);
    }

    private static Container fromMap(Map<String, Object> data, byte[] raw) {
        for (String label : data.keySet()) {
            if (!KNOWN_LABELS.contains(label)) {
                throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "unknown top-level label '" + label + "'");
            }
        }
        VersionHeader version = VersionHeader.parse(asString(data, CanonicalCodec.VERSION, true));
        return new Container(
                version,
                asString(data, CanonicalCodec.DIGEST, true),
                asString(data, CanonicalCodec.ISSUER, true),
                asString(data, CanonicalCodec.REGISTRY, false),
                asString(data, CanonicalCodec.SCHEMA, true),
                section(data, CanonicalCodec.ATTRIBUTES),
                section(data, CanonicalCodec.EDGES),
                section(data, CanonicalCodec.RULES),
                raw
        );
    }

    private static String asString(Map<String, Object> data, String label, boolean required) {
        Object value = data.get(label);
        if (value == null) {
            if (required) {
                throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "'" + label + "' is required");
            }
            return null;
        }
        if (!(value instanceof String s)) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "'" + label + "' must be a string");
        }
        return s;
    }

    private static Block section(Map<String, Object> data, String label) {
        Object value = data.get(label);
        return value == null ? null : Block.fromWire(label, value);
    }
}
