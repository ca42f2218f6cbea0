package no.cantara.acdc.codec;

import no.cantara.acdc.AcdcException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class VersionHeaderTest {

    @Test
    void encodesFixedWidth() {
        VersionHeader h = new VersionHeader(1, 0, SerializationKind.JSON, 0xaa);
        assertEquals("ACDC10JSON0000aa_", h.encode());
        assertEquals(VersionHeader.LENGTH, h.encode().length());
    }

    @Test
    void encodesEveryKindAtSameWidth() {
        for (SerializationKind kind : SerializationKind.values()) {
            assertEquals(VersionHeader.LENGTH, VersionHeader.initial(kind).withSize(VersionHeader.MAX_SIZE).encode().length());
        }
    }

    @Test
    void parsesExampleHeader() {
        VersionHeader h = VersionHeader.parse("ACDC10JSON0000aa_");
        assertEquals(1, h.major());
        assertEquals(0, h.minor());
        assertEquals(SerializationKind.JSON, h.kind());
        assertEquals(170, h.size());
    }

    @Test
    void parsesBinaryKinds() {
        assertEquals(SerializationKind.CBOR, VersionHeader.parse("ACDC10CBOR000100_").kind());
        assertEquals(SerializationKind.MGPK, VersionHeader.parse("ACDC10MGPK000100_").kind());
    }

    @Test
    void rejectsWrongProtocolTag() {
        AcdcException e = assertThrows(AcdcException.class, () -> VersionHeader.parse("KERI10JSON0000aa_"));
        assertEquals(AcdcException.Reason.MALFORMED_HEADER, e.reason());
    }

    @Test
    void rejectsNonHexSize() {
        AcdcException e = assertThrows(AcdcException.class, () -> VersionHeader.parse("ACDC10JSON0000zz_"));
        assertEquals(AcdcException.Reason.MALFORMED_HEADER, e.reason());
    }

    @Test
    void rejectsWrongSizeWidth() {
        assertEquals(AcdcException.Reason.MALFORMED_HEADER,
                assertThrows(AcdcException.class, () -> VersionHeader.parse("ACDC10JSON00aa_")).reason());
        assertEquals(AcdcException.Reason.MALFORMED_HEADER,
                assertThrows(AcdcException.class, () -> VersionHeader.parse("ACDC10JSON0000aa")).reason());
    }

    @Test
    void unknownKindIsUnsupported() {
        AcdcException e = assertThrows(AcdcException.class, () -> VersionHeader.parse("ACDC10YAML0000aa_"));
        assertEquals(AcdcException.Reason.UNSUPPORTED_KIND, e.reason());
    }

    @Test
    void sizeBeyondSixHexDigitsOverflows() {
        AcdcException e = assertThrows(AcdcException.class,
                () -> VersionHeader.initial(SerializationKind.JSON).withSize(VersionHeader.MAX_SIZE + 1));
        assertEquals(AcdcException.Reason.HEADER_SIZE_OVERFLOW, e.reason());
    }

    @Test
    void sniffsJsonHeader() {
        byte[] raw = "{\"v\":\"ACDC10JSON0000aa_\",\"d\":\"x\"}".getBytes(StandardCharsets.UTF_8);
        assertEquals(VersionHeader.parse("ACDC10JSON0000aa_"), VersionHeader.sniff(raw));
    }

    @Test
    void sniffsHeaderBehindBinaryFraming() {
        byte[] text = "ACDC10CBOR00002a_".getBytes(StandardCharsets.US_ASCII);
        byte[] raw = new byte[3 + text.length + 4];
        raw[0] = (byte) 0xa6;
        raw[1] = 0x61;
        raw[2] = 'v';
        System.arraycopy(text, 0, raw, 3, text.length);
        assertEquals(SerializationKind.CBOR, VersionHeader.sniff(raw).kind());
    }

    @Test
    void sniffFailsWithoutHeader() {
        byte[] raw = "{\"hello\":\"world\"}".getBytes(StandardCharsets.UTF_8);
        AcdcException e = assertThrows(AcdcException.class, () -> VersionHeader.sniff(raw));
        assertEquals(AcdcException.Reason.MALFORMED_HEADER, e.reason());
    }
}
