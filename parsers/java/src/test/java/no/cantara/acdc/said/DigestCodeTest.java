package no.cantara.acdc.said;

import no.cantara.acdc.AcdcException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DigestCodeTest {

    private static final byte[] DATA = "hello".getBytes(StandardCharsets.UTF_8);

    @Test
    void everyCodeYieldsFixedLengthIdentifier() {
        for (DigestCode code : DigestCode.values()) {
            String said = code.derive(DATA);
            assertEquals(DigestCode.SAID_LENGTH, said.length(), code.name());
            assertEquals(code.code(), said.charAt(0));
            assertTrue(DigestCode.isSaid(said), said);
            assertSame(code, DigestCode.of(said));
        }
    }

    @Test
    void blake3MatchesReferenceVector() {
        // BLAKE3 of the empty input
        byte[] digest = DigestCode.BLAKE3_256.digest(new byte[0]);
        StringBuilder hex = new StringBuilder();
        for (byte b : digest) {
            hex.append(String.format("%02x", b));
        }
        assertEquals("af1349b9f5f9a1a6a0404dea36dcc9499bcb25c9adc112b7cc9a93cae41f3262", hex.toString());
    }

    @Test
    void sha256MatchesReferenceVector() {
        byte[] digest = DigestCode.SHA2_256.digest("abc".getBytes(StandardCharsets.US_ASCII));
        assertEquals((byte) 0xba, digest[0]);
        assertEquals((byte) 0xad, digest[31]);
    }

    @Test
    void differentAlgorithmsDiffer() {
        assertNotEquals(DigestCode.BLAKE3_256.derive(DATA).substring(1), DigestCode.SHA3_256.derive(DATA).substring(1));
    }

    @Test
    void unknownPrefixIsUnknownAlgorithm() {
        AcdcException e = assertThrows(AcdcException.class,
                () -> DigestCode.of("XHaPRLWlw9RkQxgn9BGWzgJwsQy0HtOksqAstXbxo_NB"));
        assertEquals(AcdcException.Reason.UNKNOWN_ALGORITHM, e.reason());
    }

    @Test
    void isSaidRejectsMalformedValues() {
        assertFalse(DigestCode.isSaid(null));
        assertFalse(DigestCode.isSaid("Issuer"));
        assertFalse(DigestCode.isSaid("EHaPRLWlw9RkQxgn9BGWzgJwsQy0HtOksqAstXbxo_N"));
        assertFalse(DigestCode.isSaid("EHaPRLWlw9RkQxgn9BGWzgJwsQy0HtOksqAstXbxo+NB"));
        assertFalse(DigestCode.isSaid("ZHaPRLWlw9RkQxgn9BGWzgJwsQy0HtOksqAstXbxo_NB"));
        assertTrue(DigestCode.isSaid("EHaPRLWlw9RkQxgn9BGWzgJwsQy0HtOksqAstXbxo_NB"));
    }

    @Test
    void placeholderHasIdentifierLength() {
        assertEquals(DigestCode.SAID_LENGTH, DigestCode.placeholder().length());
        assertTrue(DigestCode.placeholder().chars().allMatch(c -> c == '#'));
    }
}
