package no.cantara.acdc;

import no.cantara.acdc.AcdcException.Reason;
import no.cantara.acdc.model.Block;
import no.cantara.acdc.model.Container;
import no.cantara.acdc.model.EdgeOperator;
import no.cantara.acdc.model.EdgeRef;
import no.cantara.acdc.said.SelfAddressing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

/**
 * Validates a container together with everything it references through its edges.
 *
 * <p>Each edge target is fetched through the caller's {@link Resolver}, verified against
 * its own bytes, checked against the edge's schema constraint and then validated the same
 * way, recursively. Sibling edges combine by operator: all {@code AND} edges must
 * validate, at least one {@code OR} edge must (when there are any), and no {@code NOT}
 * edge may. Evaluation stops at the first failing {@code AND} edge and at the first
 * succeeding {@code OR} edge.
 *
 * <p>By default a resolved container must carry the identifier it was requested by,
 * which makes cycles impossible to build. A validator created with {@code matchTargets}
 * off accepts any verifiable container from the resolver (for registries keyed by
 * something other than the identifier) and relies on the path check alone.
 *
 * <p>With an {@link Executor}, the root's edges of one operator group are resolved and
 * checked in parallel; each branch carries its own copy of the path it was reached by.
 * Deeper levels run on the worker that reached them, so no pooled task ever waits on
 * another and a bounded pool cannot starve.
 */
public class ChainValidator {

    private static final Logger log = LoggerFactory.getLogger(ChainValidator.class);

    /**
     * Supplies serialized containers by identifier. Blocking, retries and caching are up
     * to the implementation; an empty result or an exception counts as not found.
     */
    @FunctionalInterface
    public interface Resolver {
        Optional<byte[]> resolve(String identifier);
    }

    /**
     * Immutable result of validating a chain.
     *
     * @param reason  first failure, or {@code null} when the chain is valid
     * @param message human-readable description of the failure, including the edge path
     */
    public record ValidationResult(Reason reason, String message) {

        private static final ValidationResult OK = new ValidationResult(null, null);

        public static ValidationResult ok() { return OK; }

        public static ValidationResult failure(Reason reason, String message) {
            return new ValidationResult(reason, message);
        }

        public boolean isValid() { return reason == null; }
    }

    private final Resolver resolver;
    private final Executor executor;
    private final boolean matchTargets;

    public ChainValidator(Resolver resolver) {
        this(resolver, null, true);
    }

    public ChainValidator(Resolver resolver, Executor executor) {
        this(resolver, executor, true);
    }

    /**
     * @param resolver     source of referenced containers
     * @param executor     runs the root's sibling edge checks in parallel, or {@code null} to run them in order
     * @param matchTargets whether a resolved container's identifier must equal the edge target
     */
    public ChainValidator(Resolver resolver, Executor executor, boolean matchTargets) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver is required");
        }
        this.resolver = resolver;
        this.executor = executor;
        this.matchTargets = matchTargets;
    }

    public static ValidationResult validate(Container root, Resolver resolver) {
        return new ChainValidator(resolver).validate(root);
    }

    public ValidationResult validate(Container root) {
        try {
            SelfAddressing.verify(root.serialize());
        } catch (AcdcException e) {
            log.debug("root container {} failed verification: {}", root.digest(), e.getMessage());
            return ValidationResult.failure(e.reason(), "root: " + e.getMessage());
        }
        Set<String> path = new LinkedHashSet<>();
        path.add(root.digest());
        return validateEdges(root, path, executor != null);
    }

    private ValidationResult validateEdges(Container container, Set<String> path, boolean parallel) {
        Block edges = container.edges();
        if (edges == null) {
            return ValidationResult.ok();
        }
        if (edges instanceof Block.Compact compact) {
            return ValidationResult.failure(Reason.COMPACT_ONLY,
                    container.digest() + ": edge section is compact (" + compact.said() + ")");
        }
        Map<String, EdgeRef> refs;
        try {
            refs = container.edgeRefs();
        } catch (AcdcException e) {
            return ValidationResult.failure(e.reason(), container.digest() + ": " + e.getMessage());
        }

        List<Map.Entry<String, EdgeRef>> and = group(refs, EdgeOperator.AND);
        List<Map.Entry<String, EdgeRef>> or = group(refs, EdgeOperator.OR);
        List<Map.Entry<String, EdgeRef>> not = group(refs, EdgeOperator.NOT);

        // AND: stop at the first failure
        ValidationResult failed = firstMatch(and, path, parallel, r -> !r.isValid());
        if (failed != null) {
            return failed;
        }

        // OR: stop at the first success
        if (!or.isEmpty()) {
            List<ValidationResult> seen = new ArrayList<>();
            ValidationResult passed = firstMatch(or, path, parallel, r -> {
                seen.add(r);
                return r.isValid() || r.reason() == Reason.CYCLE_DETECTED;
            });
            if (passed == null) {
                return seen.get(0);
            }
            if (!passed.isValid()) {
                return passed;
            }
        }

        // NOT: a target that validates breaks the chain; a cycle is never a pass
        for (Map.Entry<String, EdgeRef> e : not) {
            ValidationResult r = validateEdge(e.getKey(), e.getValue(), path);
            if (r.reason() == Reason.CYCLE_DETECTED) {
                return r;
            }
            if (r.isValid()) {
                return ValidationResult.failure(Reason.NOT_EDGE_SATISFIED,
                        "edge '" + e.getKey() + "' -> " + e.getValue().target() + " validates but is negated");
            }
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateEdge(String label, EdgeRef ref, Set<String> path) {
        String target = ref.target();
        String where = "edge '" + label + "' -> " + target;
        if (path.contains(target)) {
            return ValidationResult.failure(Reason.CYCLE_DETECTED, where + " closes a cycle via " + path);
        }

        Optional<byte[]> raw;
        try {
            raw = resolver.resolve(target);
        } catch (RuntimeException e) {
            log.debug("resolver failed for {}", target, e);
            return ValidationResult.failure(Reason.NOT_FOUND, where + ": resolver failed: " + e.getMessage());
        }
        if (raw == null || raw.isEmpty()) {
            return ValidationResult.failure(Reason.NOT_FOUND, where + ": not found");
        }

        Container child;
        try {
            String said = SelfAddressing.verify(raw.get());
            if (matchTargets && !said.equals(target)) {
                return ValidationResult.failure(Reason.DIGEST_MISMATCH,
                        where + ": resolver returned container " + said);
            }
            if (!said.equals(target) && path.contains(said)) {
                return ValidationResult.failure(Reason.CYCLE_DETECTED,
                        where + " resolves to " + said + ", already on path " + path);
            }
            child = AcdcParser.parse(raw.get());
        } catch (AcdcException e) {
            log.debug("{} failed verification: {}", where, e.getMessage());
            return ValidationResult.failure(e.reason(), where + ": " + e.getMessage());
        }

        if (ref.schema() != null && !ref.schema().equals(child.schema())) {
            return ValidationResult.failure(Reason.SCHEMA_CONSTRAINT_FAILED,
                    where + ": schema " + child.schema() + " is not the required " + ref.schema());
        }

        Set<String> branch = new LinkedHashSet<>(path);
        branch.add(target);
        branch.add(child.digest());
        return validateEdges(child, branch, false);
    }

    /**
     * Evaluates edges until one result satisfies {@code stop}; returns that result, or
     * {@code null} if none did.
     */
    private ValidationResult firstMatch(List<Map.Entry<String, EdgeRef>> edges, Set<String> path,
                                        boolean parallel, Predicate<ValidationResult> stop) {
        if (!parallel || edges.size() < 2) {
            for (Map.Entry<String, EdgeRef> e : edges) {
                ValidationResult r = validateEdge(e.getKey(), e.getValue(), path);
                if (stop.test(r)) {
                    return r;
                }
            }
            return null;
        }
        List<CompletableFuture<ValidationResult>> futures = new ArrayList<>();
        for (Map.Entry<String, EdgeRef> e : edges) {
            futures.add(CompletableFuture.supplyAsync(() -> validateEdge(e.getKey(), e.getValue(), path), executor));
        }
        try {
            for (CompletableFuture<ValidationResult> f : futures) {
                ValidationResult r = f.join();
                if (stop.test(r)) {
                    return r;
                }
            }
            return null;
        } finally {
            futures.forEach(f -> f.cancel(false));
        }
    }

    private static List<Map.Entry<String, EdgeRef>> group(Map<String, EdgeRef> refs, EdgeOperator op) {
        return refs.entrySet().stream()
                .filter(e -> e.getValue().effectiveOperator() == op)
                .toList();
    }
}
