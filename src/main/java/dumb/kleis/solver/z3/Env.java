package dumb.kleis.solver.z3;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Name bindings for one translation. Binding returns a new environment, so a
 * {@code let} or quantifier never leaks into its siblings. Free names, created the first
 * time an unbound object is met, are shared by every environment derived from one root.
 */
final class Env {

    private final Map<String, Term> bound;
    private final Map<String, Term> free;

    private Env(Map<String, Term> bound, Map<String, Term> free) {
        this.bound = bound;
        this.free = free;
    }

    static Env root() {
        return new Env(Map.of(), new LinkedHashMap<>());
    }

    Env bind(String name, Term value) {
        var m = new HashMap<>(bound);
        m.put(name, value);
        return new Env(m, free);
    }

    Optional<Term> lookup(String name) {
        var t = bound.get(name);
        return t != null ? Optional.of(t) : Optional.ofNullable(free.get(name));
    }

    Term free(String name, Supplier<Term> create) {
        return free.computeIfAbsent(name, k -> create.get());
    }

    /** Free names in order of first appearance. */
    Map<String, Term> freeNames() {
        return Collections.unmodifiableMap(free);
    }
}
