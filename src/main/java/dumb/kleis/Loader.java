package dumb.kleis;

import dumb.kleis.Decl.Member;
import dumb.kleis.Decl.StructureRef;
import dumb.kleis.solver.Backend;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static dumb.kleis.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * Loads the axioms a proposition depends on, and nothing else. A structure is loaded at
 * most once per lifetime: its elements become solver constants, its axioms (nested ones
 * included) background facts, and its parent, its {@code over} field and the
 * constraints of its implements blocks are loaded with it.
 * <p>
 * A load is all or nothing. When any part fails, the structures it marked are unmarked
 * and the facts it queued are discarded.
 */
public class Loader {

    private final Registry registry;
    private final Backend backend;
    private final Set<String> loaded = new LinkedHashSet<>();

    public Loader(Registry registry, Backend backend) {
        this.registry = requireNonNull(registry);
        this.backend = requireNonNull(backend);
    }

    /**
     * Structures owning an operation or element named anywhere in {@code e}: operation
     * heads and free object names, through quantifier guards and bodies, conditionals,
     * let bindings, match arms and lists. Names bound by a quantifier, a let or a match
     * pattern are not looked up inside their scope.
     */
    public Set<String> dependencies(Expr e) {
        var deps = new LinkedHashSet<String>();
        collect(e, Set.of(), deps);
        return deps;
    }

    private void collect(Expr e, Set<String> bound, Set<String> deps) {
        if (e instanceof Expr.Obj o) {
            if (!bound.contains(o.name())) deps.addAll(registry.getOperationOwners(o.name()));
        } else if (e instanceof Expr.Quant q) {
            var inner = with(bound, q.vars().stream().map(Expr.QuantVar::name));
            if (q.where() != null) collect(q.where(), inner, deps);
            collect(q.body(), inner, deps);
        } else if (e instanceof Expr.Let l) {
            collect(l.value(), bound, deps);
            collect(l.body(), with(bound, Stream.of(l.name())), deps);
        } else if (e instanceof Expr.Match m) {
            collect(m.scrutinee(), bound, deps);
            for (var c : m.cases()) collect(c.body(), with(bound, c.pattern().variables()), deps);
        } else {
            if (e instanceof Expr.Op o) deps.addAll(registry.getOperationOwners(o.name()));
            for (var c : e.children()) collect(c, bound, deps);
        }
    }

    private static Set<String> with(Set<String> bound, Stream<String> names) {
        var s = new HashSet<>(bound);
        names.forEach(s::add);
        return s;
    }

    /** Loads every structure {@code e} depends on; returns how many were newly loaded. */
    public int ensureLoaded(Expr e) throws VerificationException {
        return ensureLoaded(dependencies(e));
    }

    public int ensureLoaded(String structure) throws VerificationException {
        return ensureLoaded(List.of(structure));
    }

    public int ensureLoaded(Collection<String> structures) throws VerificationException {
        var added = new ArrayList<String>();
        try {
            for (var s : structures) load(s, null, added);
            var facts = backend.commit();
            if (!added.isEmpty()) debug("Loaded " + added + " (" + facts + " facts)");
            return added.size();
        } catch (VerificationException | RuntimeException e) {
            added.forEach(loaded::remove);
            backend.rollback();
            Log.warning("Load of " + structures + " rolled back: " + e.getMessage());
            throw e;
        }
    }

    private void load(String name, @Nullable String referrer, List<String> added) throws VerificationException {
        if (loaded.contains(name)) return;

        var def = registry.get(name).orElseThrow(() -> VerificationException.unresolved(referrer == null
                ? "Structure '" + name + "' is not registered"
                : "Structure '" + name + "' referenced by '" + referrer + "' is not registered"));

        loaded.add(name);
        added.add(name);
        debug("Loading structure " + name);

        members(def.name(), def.members());

        if (def.extendsClause() != null) follow(def.extendsClause(), name, "extends", added);
        if (def.overClause() != null) follow(def.overClause(), name, "over", added);
        for (var ref : registry.getWhereConstraints(name)) follow(ref, name, "where", added);
    }

    private void follow(StructureRef ref, String from, String edge, List<String> added) throws VerificationException {
        debug(from + " " + edge + " " + ref.structureName());
        load(ref.structureName(), from, added);
    }

    /** Elements first, so axioms can refer to them; then axioms and definitions, nested structures in order. */
    private void members(String owner, List<Member> members) throws VerificationException {
        for (var m : members) {
            if (m instanceof Member.Element el) backend.declareElement(el.name(), el.type());
            else if (m instanceof Member.Operation op && op.nullary()) backend.declareElement(op.name(), op.signature());
        }
        for (var m : members) {
            if (m instanceof Member.Axiom a) backend.assume(owner + "." + a.name(), a.proposition());
            else if (m instanceof Member.Define d) backend.define(d.function());
            else if (m instanceof Member.Nested n) members(owner + "." + n.name(), n.members());
        }
    }

    public boolean isLoaded(String structure) {
        return loaded.contains(structure);
    }

    /** Loaded structure names in load order. */
    public Set<String> loaded() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(loaded));
    }

    public List<String> loadOrder() {
        return List.copyOf(loaded);
    }

    public void reset() {
        loaded.clear();
    }
}
