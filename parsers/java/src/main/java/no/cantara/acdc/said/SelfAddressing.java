package no.cantara.acdc.said;

import no.cantara.acdc.AcdcException;
import no.cantara.acdc.codec.CanonicalCodec;
import no.cantara.acdc.codec.SerializationKind;
import no.cantara.acdc.codec.VersionHeader;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes and verifies self-addressing identifiers.
 *
 * <p>A container's identifier is a digest over its own serialization, and that
 * serialization carries its byte size in the version header. Both are resolved with a
 * placeholder of the final identifier length: size the placeholder form, fix the header,
 * digest, then put the identifier where the placeholder was. Identifiers have a fixed
 * length per algorithm, so the byte size never changes along the way.
 */
public final class SelfAddressing {

    private SelfAddressing() {}

    /**
     * Outcome of sealing a container.
     *
     * @param bytes   the final canonical serialization
     * @param version the header carried in {@code bytes}
     * @param said    the identifier carried in {@code bytes}
     */
    public record Sealed(byte[] bytes, VersionHeader version, String said) {}

    /**
     * Runs the identifier computation over top-level container fields.
     *
     * @param fields container fields in wire order; {@code v} and {@code d} must be present
     *               and are overwritten in place
     * @throws AcdcException {@code HEADER_SIZE_OVERFLOW} if the container is too large for the header
     */
    public static Sealed compute(Map<String, Object> fields, SerializationKind kind, DigestCode code) {
        if (!fields.containsKey(CanonicalCodec.VERSION) || !fields.containsKey(CanonicalCodec.DIGEST)) {
            throw new IllegalArgumentException("fields must contain 'v' and 'd'");
        }
        LinkedHashMap<String, Object> work = new LinkedHashMap<>(fields);
        work.put(CanonicalCodec.DIGEST, DigestCode.placeholder());
        work.put(CanonicalCodec.VERSION, VersionHeader.initial(kind).encode());
        int size = CanonicalCodec.encode(kind, work).length;
        if (size > VersionHeader.MAX_SIZE) {
            throw new AcdcException(AcdcException.Reason.HEADER_SIZE_OVERFLOW,
                    "container is " + size + " bytes, header allows " + VersionHeader.MAX_SIZE);
        }

        VersionHeader version = VersionHeader.initial(kind).withSize(size);
        work.put(CanonicalCodec.VERSION, version.encode());
        byte[] bytes = CanonicalCodec.encode(kind, work);
        if (bytes.length != size) {
            throw new IllegalStateException("fixed-width header changed the size from " + size + " to " + bytes.length);
        }

        String said = code.derive(bytes);
        int at = indexOf(bytes, DigestCode.placeholder().getBytes(StandardCharsets.US_ASCII), 0);
        if (at < 0) {
            throw new IllegalStateException("placeholder not found in " + kind.code() + " serialization");
        }
        System.arraycopy(said.getBytes(StandardCharsets.US_ASCII), 0, bytes, at, DigestCode.SAID_LENGTH);
        return new Sealed(bytes, version, said);
    }

    /**
     * Verifies a serialized container using its own bytes only: the identifier span is
     * replaced by a placeholder and everything else is digested as received.
     *
     * @return the verified identifier
     * @throws AcdcException {@code SIZE_MISMATCH}, {@code UNKNOWN_ALGORITHM},
     *                       {@code DIGEST_MISMATCH} or any decoding reason
     */
    public static String verify(byte[] raw) {
        VersionHeader header = VersionHeader.sniff(raw);
        if (header.size() != raw.length) {
            throw new AcdcException(AcdcException.Reason.SIZE_MISMATCH,
                    "header declares " + header.size() + " bytes, got " + raw.length);
        }
        Map<String, Object> fields = CanonicalCodec.decode(header.kind(), raw);
        if (!(fields.get(CanonicalCodec.VERSION) instanceof String v) || !VersionHeader.parse(v).equals(header)) {
            throw new AcdcException(AcdcException.Reason.MALFORMED_HEADER, "'v' is not the leading version string");
        }
        if (!(fields.get(CanonicalCodec.DIGEST) instanceof String said)) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "'d' is missing or not a string");
        }
        DigestCode code = DigestCode.of(said);
        if (said.length() != DigestCode.SAID_LENGTH) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD,
                    "identifier must be " + DigestCode.SAID_LENGTH + " characters, got " + said.length());
        }
        byte[] saidBytes = said.getBytes(StandardCharsets.US_ASCII);
        int at = indexOf(raw, saidBytes, VersionHeader.LENGTH);
        if (at < 0) {
            throw new AcdcException(AcdcException.Reason.MALFORMED_BODY, "identifier not found in raw bytes");
        }
        byte[] blanked = raw.clone();
        Arrays.fill(blanked, at, at + DigestCode.SAID_LENGTH, (byte) DigestCode.PLACEHOLDER_CHAR);
        String expected = code.derive(blanked);
        if (!expected.equals(said)) {
            throw new AcdcException(AcdcException.Reason.DIGEST_MISMATCH,
                    "content digests to " + expected + ", container claims " + said);
        }
        return said;
    }

    /** Boolean form of {@link #verify(byte[])}; never throws for bad input. */
    public static boolean isValid(byte[] raw) {
        try {
            verify(raw);
            return true;
        } catch (AcdcException e) {
            return false;
        }
    }

    /**
     * Computes the identifier of a nested block treated as a standalone document: its own
     * {@code d} field holds the placeholder (put in front if the block has none) and there
     * is no version header.
     */
    public static String computeBlock(Map<String, ?> block, SerializationKind kind, DigestCode code) {
        return code.derive(CanonicalCodec.encode(kind, withPlaceholder(block)));
    }

    static LinkedHashMap<String, Object> withPlaceholder(Map<String, ?> block) {
        LinkedHashMap<String, Object> work = new LinkedHashMap<>();
        if (!block.containsKey(CanonicalCodec.DIGEST)) {
            work.put(CanonicalCodec.DIGEST, DigestCode.placeholder());
        }
        work.putAll(block);
        work.put(CanonicalCodec.DIGEST, DigestCode.placeholder());
        return work;
    }

    static int indexOf(byte[] haystack, byte[] needle, int from) {
        outer:
        for (int i = Math.max(from, 0); i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
