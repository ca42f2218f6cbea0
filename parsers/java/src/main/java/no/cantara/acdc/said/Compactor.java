package no.cantara.acdc.said;

import no.cantara.acdc.AcdcException;
import no.cantara.acdc.codec.CanonicalCodec;
import no.cantara.acdc.codec.SerializationKind;
import no.cantara.acdc.model.Block;
import no.cantara.acdc.model.Container;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Switches container sections between their inline and compact forms.
 *
 * <p>A section's compact form is the identifier of the section seen as a standalone
 * document. Expanding checks the disclosed data against that identifier, so a section can
 * only be swapped for the data it was computed from. Containers are resealed after every
 * switch since their own identifier covers whichever form each section is in.
 */
public final class Compactor {

    private static final Set<String> SECTIONS =
            Set.of(CanonicalCodec.ATTRIBUTES, CanonicalCodec.EDGES, CanonicalCodec.RULES);

    private Compactor() {}

    /** Identifier of {@code block} in the given kind. */
    public static String compact(Map<String, ?> block, SerializationKind kind, DigestCode code) {
        return SelfAddressing.computeBlock(block, kind, code);
    }

    public static String compact(Map<String, ?> block) {
        return compact(block, SerializationKind.JSON, DigestCode.BLAKE3_256);
    }

    /** Copy of {@code block} with its {@code d} set to its own identifier, {@code d} first if it was absent. */
    public static Map<String, Object> saidify(Map<String, ?> block, SerializationKind kind, DigestCode code) {
        LinkedHashMap<String, Object> work = SelfAddressing.withPlaceholder(block);
        work.put(CanonicalCodec.DIGEST, compact(block, kind, code));
        return work;
    }

    /**
     * Replaces an inline section with its identifier and reseals the container.
     * Compacting an already compact section returns the container unchanged.
     */
    public static Container compact(Container container, String label) {
        Block block = requireSection(container, label);
        if (block instanceof Block.Compact) {
            return container;
        }
        Map<String, Object> data = ((Block.Inline) block).data();
        String said = compact(data, container.kind(), container.digestCode());
        return container.withSection(label, new Block.Compact(said)).reseal();
    }

    /**
     * Discloses a compact section and reseals the container.
     *
     * @throws AcdcException {@code EXPANSION_MISMATCH} if {@code fullData} does not digest to the
     *                       stored identifier, {@code INVALID_FIELD} if the section is not compact
     */
    public static Container expand(Container container, String label, Map<String, ?> fullData) {
        Block block = requireSection(container, label);
        if (!(block instanceof Block.Compact compact)) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "section '" + label + "' is already inline");
        }
        String actual = compact(fullData, container.kind(), DigestCode.of(compact.said()));
        if (!actual.equals(compact.said())) {
            throw new AcdcException(AcdcException.Reason.EXPANSION_MISMATCH,
                    "section '" + label + "' data digests to " + actual + ", expected " + compact.said());
        }
        return container.withSection(label, new Block.Inline(new LinkedHashMap<>(fullData))).reseal();
    }

    private static Block requireSection(Container container, String label) {
        if (!SECTIONS.contains(label)) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "'" + label + "' is not a compactable section");
        }
        Block block = container.section(label);
        if (block == null) {
            throw new AcdcException(AcdcException.Reason.INVALID_FIELD, "container has no section '" + label + "'");
        }
        return block;
    }
}
