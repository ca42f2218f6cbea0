package no.cantara.acdc.said;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Random 128-bit salts in their textual form: code {@code 0A} followed by 22 base64url
 * characters, 24 characters in all.
 */
public final class Salts {

    public static final String CODE = "0A";
    public static final int LENGTH = 24;

    private static final SecureRandom RANDOM = new SecureRandom();

    private Salts() {}

    public static String random() {
        byte[] padded = new byte[18];
        byte[] salt = new byte[16];
        RANDOM.nextBytes(salt);
        System.arraycopy(salt, 0, padded, 2, salt.length);
        String b64 = Base64.getUrlEncoder().withoutPadding().encodeToString(padded);
        return CODE + b64.substring(2);
    }

    public static boolean isSalt(String value) {
        return value != null && value.length() == LENGTH && value.startsWith(CODE);
    }
}
