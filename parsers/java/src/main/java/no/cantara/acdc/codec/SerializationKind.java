package no.cantara.acdc.codec;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import no.cantara.acdc.AcdcException;
import org.msgpack.jackson.dataformat.MessagePackFactory;

/**
 * The closed set of wire formats a container can be serialized in.
 *
 * <p>Each kind owns a preconfigured {@link ObjectMapper}: no indentation, map keys kept in
 * insertion order, duplicate keys rejected. Mappers are thread-safe once configured.
 *
 * <p>The MessagePack parser reports end of input as an error rather than as the end of the
 * token stream, so its mapper cannot look for trailing tokens; {@link CanonicalCodec} checks
 * MessagePack bodies for trailing bytes itself.
 */
public enum SerializationKind {

    JSON("JSON", new JsonFactory(), true),
    CBOR("CBOR", new CBORFactory(), true),
    MGPK("MGPK", new MessagePackFactory(), false);

    private final String code;
    private final ObjectMapper mapper;

    SerializationKind(String code, JsonFactory factory, boolean detectsTrailingTokens) {
        this.code = code;
        this.mapper = new ObjectMapper(factory)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, detectsTrailingTokens)
                .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
    }

    /** Four-character code used in the version header. */
    public String code() {
        return code;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Looks up a kind by its header code.
     *
     * @throws AcdcException with {@link AcdcException.Reason#UNSUPPORTED_KIND} for unknown codes
     */
    public static SerializationKind fromCode(String code) {
        for (SerializationKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new AcdcException(AcdcException.Reason.UNSUPPORTED_KIND,
                "unknown serialization kind '" + code + "'");
    }
}
