package dumb.kleis;

import dumb.kleis.Decl.DataDef;
import dumb.kleis.Decl.FunctionDef;
import dumb.kleis.Decl.ImplementsDef;
import dumb.kleis.Decl.Member;
import dumb.kleis.Decl.OperationDecl;
import dumb.kleis.Decl.StructureDef;
import dumb.kleis.Decl.StructureRef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static dumb.kleis.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * Catalog of structures, implements blocks, data types, top-level operations and
 * functions. Populated before verification and only read afterwards; readers may then
 * share one instance.
 */
public class Registry {

    private final Map<String, StructureDef> structures = new LinkedHashMap<>();
    private final Map<String, List<ImplementsDef>> implementations = new LinkedHashMap<>();
    private final Map<String, TypeExpr> operations = new LinkedHashMap<>();
    private final Map<String, FunctionDef> functions = new LinkedHashMap<>();
    private final Map<String, DataDef> dataTypes = new LinkedHashMap<>();

    /** operation or element name → structures declaring it */
    private final Map<String, Set<String>> owners = new HashMap<>();
    /** constructor name → data type */
    private final Map<String, String> constructors = new HashMap<>();

    public void register(StructureDef def) throws VerificationException {
        var n = requireNonNull(def).name();
        if (structures.containsKey(n))
            throw VerificationException.registration("Structure '" + n + "' is already registered");

        structures.put(n, def);
        def.allMembers().forEach(m -> memberName(m).ifPresent(op -> owners.computeIfAbsent(op, k -> new LinkedHashSet<>()).add(n)));
        debug("Registered structure: " + n);
    }

    public void registerImplements(ImplementsDef impl) {
        implementations.computeIfAbsent(requireNonNull(impl).structureName(), k -> new ArrayList<>()).add(impl);
    }

    public void registerOperation(OperationDecl op) {
        operations.put(op.name(), op.signature());
    }

    public void registerFunction(FunctionDef f) {
        functions.put(f.name(), f);
    }

    public void registerDataType(DataDef d) throws VerificationException {
        if (dataTypes.containsKey(d.name()))
            throw VerificationException.registration("Data type '" + d.name() + "' is already registered");
        for (var v : d.variants()) {
            var prev = constructors.get(v.name());
            if (prev != null)
                throw VerificationException.registration("Constructor '" + v.name() + "' already belongs to data type '" + prev + "'");
        }
        dataTypes.put(d.name(), d);
        d.variants().forEach(v -> constructors.put(v.name(), d.name()));
    }

    /** Registers every declaration of the program, in order. */
    public void register(Program program) throws VerificationException {
        for (var d : program.decls()) {
            if (d instanceof StructureDef s) register(s);
            else if (d instanceof ImplementsDef i) registerImplements(i);
            else if (d instanceof FunctionDef f) registerFunction(f);
            else if (d instanceof DataDef dd) registerDataType(dd);
            else if (d instanceof OperationDecl o) registerOperation(o);
        }
    }

    public Optional<StructureDef> get(String name) {
        return Optional.ofNullable(structures.get(name));
    }

    public boolean has(String name) {
        return structures.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(structures.keySet());
    }

    public int size() {
        return structures.size();
    }

    /** Direct axiom members of a structure, in declaration order; empty for unknown names. */
    public List<Member.Axiom> getAxioms(String structure) {
        var s = structures.get(structure);
        return s == null ? List.of() : s.members().stream()
                .filter(Member.Axiom.class::isInstance).map(Member.Axiom.class::cast).toList();
    }

    public boolean hasAxiom(String structure, String axiom) {
        return getAxioms(structure).stream().anyMatch(a -> a.name().equals(axiom));
    }

    /** Operation member names of a structure, nested structures included. */
    public List<String> getOperations(String structure) {
        var s = structures.get(structure);
        return s == null ? List.of() : s.allMembers()
                .filter(Member.Operation.class::isInstance).map(m -> ((Member.Operation) m).name()).toList();
    }

    /**
     * Structures declaring {@code op} as an operation, element or derived function, at any
     * nesting depth. Empty when no structure owns it.
     */
    public Set<String> getOperationOwners(String op) {
        var o = owners.get(op);
        return o == null ? Set.of() : Set.copyOf(o);
    }

    /** Where-constraints of every implements block for {@code structure}, in registration order. */
    public List<StructureRef> getWhereConstraints(String structure) {
        return implementsOf(structure).stream().flatMap(i -> i.whereClause().stream()).toList();
    }

    public List<ImplementsDef> implementsOf(String structure) {
        return List.copyOf(implementations.getOrDefault(structure, List.of()));
    }

    /** Names of structures that declare at least one axiom (nested ones included). */
    public List<String> structuresWithAxioms() {
        return structures.values().stream()
                .filter(s -> s.allMembers().anyMatch(Member.Axiom.class::isInstance))
                .map(StructureDef::name).toList();
    }

    /**
     * Declared signature of an operation or element: structure members first, in
     * registration order, then top-level operation declarations.
     */
    public Optional<TypeExpr> getOperationSignature(String op) {
        for (var s : structures.values()) {
            var sig = s.allMembers().map(m -> signature(m, op)).flatMap(Optional::stream).findFirst();
            if (sig.isPresent()) return sig;
        }
        return Optional.ofNullable(operations.get(op));
    }

    public Optional<FunctionDef> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Collection<FunctionDef> functions() {
        return List.copyOf(functions.values());
    }

    public Optional<DataDef> dataType(String name) {
        return Optional.ofNullable(dataTypes.get(name));
    }

    public Collection<DataDef> dataTypes() {
        return List.copyOf(dataTypes.values());
    }

    /** Data type declaring the given constructor. */
    public Optional<DataDef> constructorOwner(String constructor) {
        var d = constructors.get(constructor);
        return d == null ? Optional.empty() : Optional.of(dataTypes.get(d));
    }

    /** Drops a structure and its implements blocks. */
    public boolean remove(String structure) {
        var s = structures.remove(structure);
        if (s == null) return false;
        implementations.remove(structure);
        owners.values().forEach(o -> o.remove(structure));
        owners.values().removeIf(Set::isEmpty);
        return true;
    }

    public void clear() {
        structures.clear();
        implementations.clear();
        operations.clear();
        functions.clear();
        dataTypes.clear();
        owners.clear();
        constructors.clear();
    }

    private static Optional<String> memberName(Member m) {
        if (m instanceof Member.Operation o) return Optional.of(o.name());
        if (m instanceof Member.Element e) return Optional.of(e.name());
        if (m instanceof Member.Define d) return Optional.of(d.function().name());
        return Optional.empty();
    }

    private static Optional<TypeExpr> signature(Member m, String op) {
        if (m instanceof Member.Operation o && o.name().equals(op)) return Optional.of(o.signature());
        if (m instanceof Member.Element e && e.name().equals(op)) return Optional.of(e.type());
        return Optional.empty();
    }
}
