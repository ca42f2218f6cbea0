package no.cantara.acdc.model;

import no.cantara.acdc.AcdcException;
import no.cantara.acdc.codec.CanonicalCodec;
import no.cantara.acdc.codec.SerializationKind;
import no.cantara.acdc.codec.VersionHeader;
import no.cantara.acdc.said.Compactor;
import no.cantara.acdc.said.DigestCode;
import no.cantara.acdc.said.SelfAddressing;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An Authentic Chained Data Container.
 *
 * <p>Instances are immutable. One built through {@link #builder()} is sealed: its
 * {@code version} carries the exact serialized size and {@code digest} is the
 * self-addressing identifier of that serialization. One obtained from the parser holds
 * whatever was on the wire, together with the bytes it was read from; {@link #verify()}
 * digests those bytes as received and tells whether the two still agree.
 *
 * @param version            version header, including kind and byte size
 * @param digest             self-addressing identifier ({@code d})
 * @param issuer             issuer identifier ({@code i})
 * @param registryIdentifier registry identifier ({@code ri}); empty string when there is none
 * @param schema             schema identifier ({@code s})
 * @param attributes         attribute section ({@code a}), or {@code null}
 * @param edges              edge section ({@code e}), or {@code null}
 * @param rules              rule section ({@code r}), or {@code null}
 * @param raw                the bytes this container was parsed from, or {@code null} for one
 *                           built or derived in memory
 */
public record Container(
        VersionHeader version,
        String digest,
        String issuer,
        String registryIdentifier,
        String schema,
        Block attributes,
        Block edges,
        Block rules,
        byte[] raw
) {
    public Container {
        registryIdentifier = registryIdentifier != null ? registryIdentifier : "";
        raw = raw != null ? raw.clone() : null;
    }

    public Container(VersionHeader version, String digest, String issuer, String registryIdentifier,
                     String schema, Block attributes, Block edges, Block rules) {
        this(version, digest, issuer, registryIdentifier, schema, attributes, edges, rules, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Inline attribute data.
     *
     * @throws AcdcException {@code COMPACT_ONLY} if the attribute section is compact
     */
    public Map<String, Object> attributeData() {
        return attributeData(null);
    }

    /**
     * Inline attribute data, expanding a compact section from {@code source} when needed.
     *
     * @throws AcdcException {@code COMPACT_ONLY} if compact and no source is given,
     *                       {@code EXPANSION_MISMATCH} if the source does not match
     */
    public Map<String, Object> attributeData(Map<String, ?> source) {
        return inline(CanonicalCodec.ATTRIBUTES, attributes, source);
    }

    public Map<String, Object> ruleData() {
        return inline(CanonicalCodec.RULES, rules, null);
    }

    /**
     * Edges by label, in declared order. Non-map entries (such as the section's own
     * {@code d}) are skipped.
     *
     * @throws AcdcException {@code COMPACT_ONLY} if the edge section is compact
     */
    public Map<String, EdgeRef> edgeRefs() {
        if (edges == null) {
            return Map.of();
        }
        Map<String, EdgeRef> refs = new LinkedHashMap<>();
        inline(CanonicalCodec.EDGES, edges, null).forEach((label, value) -> {
            if (value instanceof Map<?, ?> m) {
                refs.put(label, EdgeRef.fromMap(label, m));
            }
        });
        return Collections.unmodifiableMap(refs);
    }

    public SerializationKind kind() {
        return version != null ? version.kind() : SerializationKind.JSON;
    }

    public DigestCode digestCode() {
        return DigestCode.isSaid(digest) ? DigestCode.of(digest) : DigestCode.BLAKE3_256;
    }

    /** Section by wire label ({@code a}, {@code e} or {@code r}). */
    public Block section(String label) {
        return switch (label) {
            case CanonicalCodec.ATTRIBUTES -> attributes;
            case CanonicalCodec.EDGES -> edges;
            case CanonicalCodec.RULES -> rules;
            default -> throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "no section '" + label + "'");
        };
    }

    /** Fields in canonical wire order. */
    public Map<String, Object> fields() {
        return CanonicalCodec.fields(this);
    }

    /**
     * Writes the container exactly as held, without recomputing {@code v} or {@code d}.
     * A parsed container gives back the bytes it was read from.
     */
    public byte[] serialize() {
        return raw != null ? raw.clone() : CanonicalCodec.encode(this);
    }

    @Override
    public byte[] raw() {
        return raw != null ? raw.clone() : null;
    }

    /** Seals the current content in its own kind and digest code and returns the bytes. */
    public byte[] encode() {
        return encode(kind());
    }

    /** Seals the current content in {@code kind}; the identifier differs per kind. */
    public byte[] encode(SerializationKind kind) {
        return SelfAddressing.compute(fields(), kind, digestCode()).bytes();
    }

    /** Recomputes header and identifier over the current content. */
    public Container seal(SerializationKind kind, DigestCode code) {
        SelfAddressing.Sealed sealed = SelfAddressing.compute(fields(), kind, code);
        return new Container(sealed.version(), sealed.said(), issuer, registryIdentifier, schema,
                attributes, edges, rules);
    }

    public Container reseal() {
        return seal(kind(), digestCode());
    }

    /**
     * True if the stored identifier and header match the content. Never throws;
     * any integrity failure is {@code false}.
     */
    public boolean verify() {
        if (version == null || digest == null) {
            return false;
        }
        try {
            return digest.equals(SelfAddressing.verify(serialize()));
        } catch (AcdcException e) {
            return false;
        }
    }

    /** Copy with a different issuer and the old, now stale, identifier. */
    public Container withIssuer(String newIssuer) {
        return new Container(version, digest, newIssuer, registryIdentifier, schema, attributes, edges, rules);
    }

    /** Copy with one section replaced and the old identifier; call {@link #reseal()} to fix it. */
    public Container withSection(String label, Block block) {
        return switch (label) {
            case CanonicalCodec.ATTRIBUTES ->
                    new Container(version, digest, issuer, registryIdentifier, schema, block, edges, rules);
            case CanonicalCodec.EDGES ->
                    new Container(version, digest, issuer, registryIdentifier, schema, attributes, block, rules);
            case CanonicalCodec.RULES ->
                    new Container(version, digest, issuer, registryIdentifier, schema, attributes, edges, block);
            default -> throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "no section '" + label + "'");
        };
    }

    private Map<String, Object> inline(String label, Block block, Map<String, ?> source) {
        if (block == null) {
            return Map.of();
        }
        if (block instanceof Block.Inline in) {
            return in.data();
        }
        Block.Compact compact = (Block.Compact) block;
        if (source == null) {
            throw new AcdcException(AcdcException.Reason.COMPACT_ONLY,
                    "section '" + label + "' is compact (" + compact.said() + ")");
        }
        String actual = Compactor.compact(source, kind(), DigestCode.of(compact.said()));
        if (!actual.equals(compact.said())) {
            throw new AcdcException(AcdcException.Reason.EXPANSION_MISMATCH,
                    "section '" + label + "' data digests to " + actual + ", expected " + compact.said());
        }
        return new Block.Inline(new LinkedHashMap<>(source)).data();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Container other)) {
            return false;
        }
        return Objects.equals(version, other.version)
                && Objects.equals(digest, other.digest)
                && Objects.equals(issuer, other.issuer)
                && Objects.equals(registryIdentifier, other.registryIdentifier)
                && Objects.equals(schema, other.schema)
                && Objects.equals(attributes, other.attributes)
                && Objects.equals(edges, other.edges)
                && Objects.equals(rules, other.rules)
                && Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(version, digest, issuer, registryIdentifier, schema, attributes, edges, rules)
                + Arrays.hashCode(raw);
    }

    /**
     * Collects container fields and seals them on {@link #build()}.
     */
    public static final class Builder {
        private String issuer;
        private String registryIdentifier = "";
        private String schema;
        private Block attributes;
        private Map<String, Object> edges;
        private Block compactEdges;
        private Block rules;
        private SerializationKind kind = SerializationKind.JSON;
        private DigestCode digestCode = DigestCode.BLAKE3_256;

        private Builder() {}

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder registryIdentifier(String registryIdentifier) {
            this.registryIdentifier = registryIdentifier;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder attributes(Map<String, ?> inline) {
            this.attributes = Block.inline(inline);
            return this;
        }

        /** Compact attribute section; the value must be a well-formed identifier. */
        public Builder attributes(String compactSaid) {
            this.attributes = Block.compact(compactSaid);
            return this;
        }

        public Builder edge(String label, EdgeRef ref) {
            if (edges == null) {
                edges = new LinkedHashMap<>();
            }
            edges.put(label, ref.toMap());
            compactEdges = null;
            return this;
        }

        public Builder edges(Map<String, EdgeRef> refs) {
            refs.forEach(this::edge);
            return this;
        }

        public Builder edges(String compactSaid) {
            this.compactEdges = Block.compact(compactSaid);
            this.edges = null;
            return this;
        }

        public Builder rules(Map<String, ?> inline) {
            this.rules = Block.inline(inline);
            return this;
        }

        public Builder rules(String compactSaid) {
            this.rules = Block.compact(compactSaid);
            return this;
        }

        public Builder kind(SerializationKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder digestCode(DigestCode digestCode) {
            this.digestCode = digestCode;
            return this;
        }

        /**
         * Validates and seals the container.
         *
         * @throws AcdcException {@code INVALID_FIELD} if issuer, schema or attributes are missing
         */
        public Container build() {
            if (issuer == null || issuer.isEmpty()) {
                throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "'i' (issuer) is required");
            }
            if (schema == null || schema.isEmpty()) {
                throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "'s' (schema) is required");
            }
            if (attributes == null) {
                throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "'a' (attributes) is required");
            }
            Block edgeBlock = compactEdges != null ? compactEdges : edges != null ? Block.inline(edges) : null;
            Container draft = new Container(null, null, issuer, registryIdentifier, schema,
                    attributes, edgeBlock, rules);
            return draft.seal(kind, digestCode);
        }
    }
}
