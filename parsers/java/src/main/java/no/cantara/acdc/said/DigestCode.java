package no.cantara.acdc.said;

import no.cantara.acdc.AcdcException;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.digests.Blake2sDigest;
import org.bouncycastle.crypto.digests.Blake3Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA3Digest;

import java.util.Arrays;
import java.util.Base64;
import java.util.function.Supplier;

/**
 * Digest algorithms usable for self-addressing identifiers, keyed by their one-character
 * derivation code.
 *
 * <p>Every code yields a 256-bit digest and therefore a 44-character identifier: one zero
 * lead byte is put in front of the 32 digest bytes, the 33 bytes are base64url encoded and
 * the first character (always {@code A}) is replaced by the code.
 */
public enum DigestCode {

    BLAKE3_256('E', Blake3Digest::new),
    BLAKE2B_256('F', () -> new Blake2bDigest(256)),
    BLAKE2S_256('G', () -> new Blake2sDigest(256)),
    SHA3_256('H', () -> new SHA3Digest(256)),
    SHA2_256('I', SHA256Digest::new);

    public static final int SAID_LENGTH = 44;
    public static final char PLACEHOLDER_CHAR = '#';

    private static final int DIGEST_BYTES = 32;
    private static final String PLACEHOLDER = String.valueOf(PLACEHOLDER_CHAR).repeat(SAID_LENGTH);

    private final char code;
    private final Supplier<Digest> digests;

    DigestCode(char code, Supplier<Digest> digests) {
        this.code = code;
        this.digests = digests;
    }

    public char code() {
        return code;
    }

    /** A same-length stand-in for an identifier that has not been computed yet. */
    public static String placeholder() {
        return PLACEHOLDER;
    }

    public byte[] digest(byte[] data) {
        // BouncyCastle digests are stateful, so each call gets its own instance
        Digest digest = digests.get();
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    /** Digests {@code data} and returns the encoded identifier. */
    public String derive(byte[] data) {
        String said = encode(digest(data));
        if (said.length() != SAID_LENGTH) {
            throw new IllegalStateException(this + " produced a " + said.length() + "-character identifier");
        }
        return said;
    }

    public String encode(byte[] digest) {
        if (digest.length != DIGEST_BYTES) {
            throw new IllegalStateException(this + " digest must be " + DIGEST_BYTES + " bytes, got " + digest.length);
        }
        byte[] padded = new byte[DIGEST_BYTES + 1];
        System.arraycopy(digest, 0, padded, 1, DIGEST_BYTES);
        String b64 = Base64.getUrlEncoder().withoutPadding().encodeToString(padded);
        return code + b64.substring(1);
    }

    /**
     * Looks up the algorithm for an identifier's prefix.
     *
     * @throws AcdcException {@code UNKNOWN_ALGORITHM} if the prefix is not a known code
     */
    public static DigestCode of(String said) {
        if (said == null || said.isEmpty()) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "identifier is missing");
        }
        return fromCode(said.charAt(0));
    }

    public static DigestCode fromCode(char code) {
        for (DigestCode dc : values()) {
            if (dc.code == code) {
                return dc;
            }
        }
        throw new AcdcException(AcdcException.Reason.UNKNOWN_ALGORITHM,
                "unknown digest code '" + code + "'");
    }

    /** True if {@code value} has the shape of an identifier: known code, right length, base64url body. */
    public static boolean isSaid(String value) {
        if (value == null || value.length() != SAID_LENGTH) {
            return false;
        }
        char first = value.charAt(0);
        if (Arrays.stream(values()).noneMatch(dc -> dc.code == first)) {
            return false;
        }
        for (int i = 1; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean b64 = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '_';
            if (!b64) {
                return false;
            }
        }
        return true;
    }
}
