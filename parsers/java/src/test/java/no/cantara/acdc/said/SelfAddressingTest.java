package no.cantara.acdc.said;

import no.cantara.acdc.AcdcException;
import no.cantara.acdc.codec.CanonicalCodec;
import no.cantara.acdc.codec.SerializationKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SelfAddressingTest {

    private static final String SCHEMA = "EFNWOR0fQbv_J6EL0pJlvCxEpbu4bg1AurHgr_0A7LKc";
    private static final String EXPECTED =
            "{\"v\":\"ACDC10JSON0000aa_\",\"d\":\"EHaPRLWlw9RkQxgn9BGWzgJwsQy0HtOksqAstXbxo_NB\","
                    + "\"i\":\"Issuer\",\"ri\":\"\",\"s\":\"EFNWOR0fQbv_J6EL0pJlvCxEpbu4bg1AurHgr_0A7LKc\","
                    + "\"a\":{\"hello\":\"world\"}}";

    private static Map<String, Object> issuerFields() {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("v", "");
        f.put("d", "");
        f.put("i", "Issuer");
        f.put("ri", "");
        f.put("s", SCHEMA);
        f.put("a", Map.of("hello", "world"));
        return f;
    }

    @Test
    void computesExampleIdentifierByteExact() {
        SelfAddressing.Sealed sealed = SelfAddressing.compute(issuerFields(), SerializationKind.JSON, DigestCode.BLAKE3_256);
        assertEquals("EHaPRLWlw9RkQxgn9BGWzgJwsQy0HtOksqAstXbxo_NB", sealed.said());
        assertEquals(170, sealed.version().size());
        assertEquals(EXPECTED, new String(sealed.bytes(), StandardCharsets.UTF_8));
    }

    @Test
    void declaredSizeEqualsByteLengthForEveryKind() {
        for (SerializationKind kind : SerializationKind.values()) {
            SelfAddressing.Sealed sealed = SelfAddressing.compute(issuerFields(), kind, DigestCode.BLAKE3_256);
            assertEquals(sealed.bytes().length, sealed.version().size(), kind.code());
            assertEquals(sealed.said(), SelfAddressing.verify(sealed.bytes()), kind.code());
        }
    }

    @Test
    void computeDoesNotTouchCallerFields() {
        Map<String, Object> fields = issuerFields();
        SelfAddressing.compute(fields, SerializationKind.JSON, DigestCode.BLAKE3_256);
        assertEquals("", fields.get("d"));
        assertEquals("", fields.get("v"));
    }

    @Test
    void computeRequiresVersionAndDigestSlots() {
        Map<String, Object> fields = issuerFields();
        fields.remove("d");
        assertThrows(IllegalArgumentException.class,
                () -> SelfAddressing.compute(fields, SerializationKind.JSON, DigestCode.BLAKE3_256));
    }

    @Test
    void verifiesExample() {
        assertEquals("EHaPRLWlw9RkQxgn9BGWzgJwsQy0HtOksqAstXbxo_NB",
                SelfAddressing.verify(EXPECTED.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void alteredIssuerIsDigestMismatch() {
        String tampered = EXPECTED.replace("\"Issuer\"", "\"Iss0er\"");
        AcdcException e = assertThrows(AcdcException.class,
                () -> SelfAddressing.verify(tampered.getBytes(StandardCharsets.UTF_8)));
        assertEquals(AcdcException.Reason.DIGEST_MISMATCH, e.reason());
    }

    @Test
    void lengthChangeIsSizeMismatch() {
        String longer = EXPECTED.replace("\"Issuer\"", "\"Issuer2\"");
        AcdcException e = assertThrows(AcdcException.class,
                () -> SelfAddressing.verify(longer.getBytes(StandardCharsets.UTF_8)));
        assertEquals(AcdcException.Reason.SIZE_MISMATCH, e.reason());
    }

    @Test
    void unknownDigestCodeIsUnknownAlgorithm() {
        String foreign = EXPECTED.replace("\"d\":\"E", "\"d\":\"X");
        AcdcException e = assertThrows(AcdcException.class,
                () -> SelfAddressing.verify(foreign.getBytes(StandardCharsets.UTF_8)));
        assertEquals(AcdcException.Reason.UNKNOWN_ALGORITHM, e.reason());
    }

    @Test
    void everyByteOfAttributesIsCovered() {
        byte[] raw = EXPECTED.getBytes(StandardCharsets.UTF_8);
        int start = EXPECTED.indexOf("\"a\":");
        for (int i = start; i < raw.length; i++) {
            byte[] flipped = raw.clone();
            flipped[i] ^= 0x01;
            assertFalse(SelfAddressing.isValid(flipped), "flip at " + i);
        }
    }

    @Test
    void otherDigestCodesVerify() {
        for (DigestCode code : DigestCode.values()) {
            SelfAddressing.Sealed sealed = SelfAddressing.compute(issuerFields(), SerializationKind.JSON, code);
            assertEquals(code, DigestCode.of(sealed.said()));
            assertTrue(SelfAddressing.isValid(sealed.bytes()), code.name());
        }
    }

    @Test
    void blockIdentifierPrependsDigestField() {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("hello", "world");
        assertEquals("EE2QWsyNeMTE2ZWaB7Q5ZWDPcrB-p8BSWQ2zqb5zyRgS",
                SelfAddressing.computeBlock(block, SerializationKind.JSON, DigestCode.BLAKE3_256));
    }

    @Test
    void blockIdentifierIgnoresExistingDigestValue() {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put(CanonicalCodec.DIGEST, "anything");
        block.put("hello", "world");
        Map<String, Object> other = new LinkedHashMap<>(block);
        other.put(CanonicalCodec.DIGEST, "");
        assertEquals(SelfAddressing.computeBlock(block, SerializationKind.JSON, DigestCode.BLAKE3_256),
                SelfAddressing.computeBlock(other, SerializationKind.JSON, DigestCode.BLAKE3_256));
    }

    @Test
    void indexOfFindsFirstOccurrence() {
        byte[] hay = "abcabc".getBytes(StandardCharsets.US_ASCII);
        assertEquals(1, SelfAddressing.indexOf(hay, "bc".getBytes(StandardCharsets.US_ASCII), 0));
        assertEquals(4, SelfAddressing.indexOf(hay, "bc".getBytes(StandardCharsets.US_ASCII), 2));
        assertEquals(-1, SelfAddressing.indexOf(hay, "cd".getBytes(StandardCharsets.US_ASCII), 0));
    }
}
