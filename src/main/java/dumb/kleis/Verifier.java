package dumb.kleis;

import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.kleis.solver.Backend;
import dumb.kleis.solver.Capabilities;
import dumb.kleis.solver.Satisfiability;
import dumb.kleis.solver.z3.Z3Backend;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Checks propositions against the axioms of the structures they mention. Structures are
 * loaded on demand by a {@link Loader} and stay loaded for the verifier's lifetime, so
 * repeated checks reuse the background instead of rebuilding it.
 * <p>
 * Not thread-safe: one verifier serves one caller at a time.
 */
public class Verifier implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Verifier.class);

    private final Registry registry;
    private final Config config;
    private final @Nullable Backend backend;
    private final @Nullable Loader loader;

    /** Background fact count at the last consistency check, -1 before the first. */
    private int checkedAt = -1;
    private boolean inconsistent;

    public Verifier(Registry registry) throws VerificationException {
        this(registry, Config.load());
    }

    public Verifier(Registry registry, Config config) throws VerificationException {
        this(registry, config, config.enabled() ? Z3Backend.create(registry, config) : null);
    }

    public Verifier(Registry registry, Config config, @Nullable Backend backend) {
        this.registry = requireNonNull(registry);
        this.config = requireNonNull(config);
        if (config.enabled() && backend == null) throw new IllegalArgumentException("Enabled verifier needs a backend");
        this.backend = config.enabled() ? backend : null;
        this.loader = this.backend != null ? new Loader(registry, this.backend) : null;
    }

    /**
     * Loads what {@code proposition} depends on, then checks it. Universally quantified
     * variables at the top are treated as free, so an {@link VerificationResult.Invalid}
     * names values for them.
     */
    public VerificationResult verifyAxiom(Expr proposition) throws VerificationException {
        if (backend == null) return VerificationResult.DISABLED;

        loader.ensureLoaded(proposition);
        if (inconsistentBackground()) return VerificationResult.INCONSISTENT;

        var r = backend.verify(proposition);
        logger.debug("{} -> {}", proposition.toSexp(), r);
        return r;
    }

    /** Whether {@code a = b} holds for every assignment, given the loaded axioms. */
    public boolean areEquivalent(Expr a, Expr b) throws VerificationException {
        if (backend == null) return false;
        loader.ensureLoaded(a);
        loader.ensureLoaded(b);
        return backend.equivalent(a, b);
    }

    /** Example satisfying {@code e} together with the loaded axioms, if there is one. */
    public Satisfiability checkSatisfiability(Expr e) throws VerificationException {
        if (backend == null) return new Satisfiability.Unknown("verification disabled");
        loader.ensureLoaded(e);
        return backend.satisfiable(e);
    }

    public Expr simplify(Expr e) throws VerificationException {
        if (backend == null) return e;
        loader.ensureLoaded(e);
        return backend.simplify(e);
    }

    /**
     * Asserts a defining axiom {@code ∀ params. f(params) = body} for every top-level
     * function of the program. All or nothing: when one fails, none is asserted.
     */
    public void loadProgramFunctions(Program program) throws VerificationException {
        loadFunctions(program.functions());
    }

    /** {@link #loadProgramFunctions} for the functions registered in the registry. */
    public void loadRegisteredFunctions() throws VerificationException {
        loadFunctions(List.copyOf(registry.functions()));
    }

    private void loadFunctions(List<Decl.FunctionDef> functions) throws VerificationException {
        if (backend == null || functions.isEmpty()) return;
        for (var f : functions) loader.ensureLoaded(f.body());
        try {
            for (var f : functions) backend.define(f);
        } catch (VerificationException | RuntimeException e) {
            backend.rollback();
            throw e;
        }
        backend.commit();
        logger.info("Loaded {} function definitions", functions.size());
    }

    /** Loads a structure and its dependencies without checking anything. */
    public void load(String structure) throws VerificationException {
        if (loader != null) loader.ensureLoaded(structure);
    }

    /** Structures the proposition would load. */
    public Set<String> dependencies(Expr proposition) {
        return loader != null ? loader.dependencies(proposition) : Set.of();
    }

    private boolean inconsistentBackground() {
        if (!config.checkConsistency()) return false;
        var facts = backend.facts();
        if (facts != checkedAt) {
            checkedAt = facts;
            var s = backend.consistency();
            inconsistent = s instanceof Satisfiability.Unsatisfiable;
            if (inconsistent) logger.warn("Background axioms are inconsistent ({} facts, loaded {})", facts, loader.loadOrder());
            else if (s instanceof Satisfiability.Unknown u) logger.debug("Consistency undecided: {}", u.reason());
        }
        return inconsistent;
    }

    public Stats stats() {
        return backend == null ? new Stats(0, 0) : new Stats(loader.loaded().size(), backend.declaredOperations().size());
    }

    public Snapshot snapshot() {
        if (backend == null) return new Snapshot(List.of(), 0, List.of(), List.of());
        return new Snapshot(
                loader.loaded().stream().sorted().toList(),
                backend.facts(),
                backend.declaredOperations().stream().sorted().toList(),
                backend.warnings());
    }

    public List<String> warnings() {
        return backend == null ? List.of() : backend.warnings();
    }

    public @Nullable Capabilities capabilities() {
        return backend == null ? null : backend.capabilities();
    }

    public Registry registry() {
        return registry;
    }

    public Config config() {
        return config;
    }

    /** Forgets every loaded structure and background fact; the registry is kept. */
    public void reset() {
        if (backend == null) return;
        backend.reset();
        loader.reset();
        checkedAt = -1;
        inconsistent = false;
        logger.debug("Verifier reset");
    }

    @Override
    public void close() {
        if (backend != null) backend.close();
    }

    public record Stats(@JsonProperty("loadedStructures") int loadedStructures,
                        @JsonProperty("declaredOperations") int declaredOperations) {
    }

    public record Snapshot(@JsonProperty("loadedStructures") List<String> loadedStructures,
                           @JsonProperty("backgroundFacts") int backgroundFacts,
                           @JsonProperty("declaredOperations") List<String> declaredOperations,
                           @JsonProperty("warnings") List<String> warnings) {
        public Snapshot {
            loadedStructures = List.copyOf(loadedStructures);
            declaredOperations = List.copyOf(declaredOperations);
            warnings = List.copyOf(warnings);
        }
    }
}
