package no.cantara.acdc.model;

import no.cantara.acdc.AcdcException;
import no.cantara.acdc.codec.CanonicalCodec;
import no.cantara.acdc.codec.SerializationKind;
import no.cantara.acdc.said.Compactor;
import no.cantara.acdc.said.DigestCode;
import no.cantara.acdc.said.Salts;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds an attribute section that carries its own identifier.
 *
 * <p>Field order is {@code d}, then {@code u} (salt, private sections only), then
 * {@code i} (issuee, targeted sections only), then the attributes as added. A salted
 * section cannot be confirmed by guessing its content from its compact form.
 */
public final class AttributeBlock {

    public static final String SALT = "u";
    public static final String ISSUEE = "i";

    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private String issuee;
    private String salt;

    private AttributeBlock() {}

    public static AttributeBlock create() {
        return new AttributeBlock();
    }

    /** Targets the section at a single issuee. */
    public AttributeBlock issuee(String issueeId) {
        this.issuee = issueeId;
        return this;
    }

    /** Makes the section private with a fresh random salt. */
    public AttributeBlock salted() {
        return salt(Salts.random());
    }

    public AttributeBlock salt(String value) {
        if (!Salts.isSalt(value)) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "not a salt: '" + value + "'");
        }
        this.salt = value;
        return this;
    }

    public AttributeBlock put(String name, Object value) {
        if (CanonicalCodec.DIGEST.equals(name) || SALT.equals(name) || ISSUEE.equals(name)) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "'" + name + "' is a reserved attribute label");
        }
        attributes.put(name, value);
        return this;
    }

    public AttributeBlock putAll(Map<String, ?> values) {
        values.forEach(this::put);
        return this;
    }

    /** The section with its {@code d} filled in for the given kind and digest code. */
    public Map<String, Object> build(SerializationKind kind, DigestCode code) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put(CanonicalCodec.DIGEST, "");
        if (salt != null) {
            block.put(SALT, salt);
        }
        if (issuee != null) {
            block.put(ISSUEE, issuee);
        }
        block.putAll(attributes);
        return Compactor.saidify(block, kind, code);
    }

    public Map<String, Object> build() {
        return build(SerializationKind.JSON, DigestCode.BLAKE3_256);
    }
}
