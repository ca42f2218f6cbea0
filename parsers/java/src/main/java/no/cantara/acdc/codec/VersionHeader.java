package no.cantara.acdc.codec;

import no.cantara.acdc.AcdcException;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The fixed-width version string carried in the {@code v} field of every container,
 * e.g. {@code ACDC10JSON0000aa_}.
 *
 * <p>Layout: protocol tag, major and minor version as one hex digit each, four-character
 * kind code, total byte size as six hex digits, {@code _} terminator. Decoding never checks
 * the size against an actual buffer; that belongs to identifier verification.
 *
 * @param major major protocol version (0-15)
 * @param minor minor protocol version (0-15)
 * @param kind  serialization kind of the surrounding container
 * @param size  total byte length of the serialized container
 */
public record VersionHeader(int major, int minor, SerializationKind kind, int size) {

    public static final String PROTOCOL = "ACDC";
    public static final int LENGTH = 17;
    public static final int MAX_SIZE = 0xffffff;

    private static final int SNIFF_WINDOW = 32;
    private static final Pattern STRICT = Pattern.compile(
            "^ACDC([0-9a-f])([0-9a-f])([A-Z0-9]{4})([0-9a-f]{6})_$");
    private static final Pattern EMBEDDED = Pattern.compile(
            "ACDC[0-9a-f]{2}[A-Z0-9]{4}[0-9a-f]{6}_");

    public VersionHeader {
        if (major < 0 || major > 0xf || minor < 0 || minor > 0xf) {
            throw new IllegalArgumentException("version digits out of range: " + major + "." + minor);
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (size < 0) {
            throw new IllegalArgumentException("negative size: " + size);
        }
        if (size > MAX_SIZE) {
            throw new AcdcException(AcdcException.Reason.HEADER_SIZE_OVERFLOW,
                    "size " + size + " exceeds " + MAX_SIZE);
        }
    }

    /** Version 1.0 header for {@code kind} with the size field still zero. */
    public static VersionHeader initial(SerializationKind kind) {
        return new VersionHeader(1, 0, kind, 0);
    }

    public VersionHeader withSize(int newSize) {
        return new VersionHeader(major, minor, kind, newSize);
    }

    public String encode() {
        return String.format("%s%x%x%s%06x_", PROTOCOL, major, minor, kind.code(), size);
    }

    /**
     * Parses a version string.
     *
     * @throws AcdcException {@code MALFORMED_HEADER} if the layout is wrong,
     *                       {@code UNSUPPORTED_KIND} if only the kind code is unknown
     */
    public static VersionHeader parse(String text) {
        if (text == null) {
            throw new AcdcException(AcdcException.Reason.MALFORMED_HEADER, "version string is missing");
        }
        Matcher m = STRICT.matcher(text);
        if (!m.matches()) {
            throw new AcdcException(AcdcException.Reason.MALFORMED_HEADER,
                    "not an " + PROTOCOL + " version string: '" + text + "'");
        }
        SerializationKind kind = SerializationKind.fromCode(m.group(3));
        return new VersionHeader(
                Integer.parseInt(m.group(1), 16),
                Integer.parseInt(m.group(2), 16),
                kind,
                Integer.parseInt(m.group(4), 16));
    }

    /**
     * Finds the version string near the start of a raw container of any kind.
     * Binary kinds put a few framing bytes before it, so the first bytes are scanned
     * rather than read at a fixed offset.
     */
    public static VersionHeader sniff(byte[] raw) {
        int window = Math.min(raw.length, SNIFF_WINDOW);
        String head = new String(raw, 0, window, StandardCharsets.ISO_8859_1);
        Matcher m = EMBEDDED.matcher(head);
        if (!m.find()) {
            throw new AcdcException(AcdcException.Reason.MALFORMED_HEADER,
                    "no " + PROTOCOL + " version string in the first " + window + " bytes");
        }
        return parse(m.group());
    }

    @Override
    public String toString() {
        return encode();
    }
}
