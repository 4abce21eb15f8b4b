package dumb.kleis.solver.z3;

import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Constructor;
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import dumb.kleis.Decl.DataDef;
import dumb.kleis.VerificationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dumb.kleis.Log.debug;

/**
 * Solver datatypes declared from registered {@link DataDef}s. All data types are declared
 * together, so they may refer to each other and to themselves.
 */
final class Z3DataSorts implements DataSorts {

    private final Map<String, DatatypeSort<?>> sorts = new LinkedHashMap<>();
    private final Map<String, Ctor> ctors = new HashMap<>();

    private record Ctor(FuncDecl<?> make, FuncDecl<BoolSort> tester, FuncDecl<?>[] fields) {
    }

    private Z3DataSorts() {
    }

    static DataSorts of(Context ctx, Collection<DataDef> defs) throws VerificationException {
        if (defs.isEmpty()) return NONE;

        var list = List.copyOf(defs);
        var index = new HashMap<String, Integer>();
        for (var i = 0; i < list.size(); i++) index.put(list.get(i).name(), i);

        @SuppressWarnings("unchecked")
        Constructor<Object>[][] cs = new Constructor[list.size()][];
        for (var i = 0; i < list.size(); i++) {
            var def = list.get(i);
            cs[i] = constructors(ctx, def, index);
        }

        var names = list.stream().map(DataDef::name).toArray(String[]::new);
        var declared = ctx.mkDatatypeSorts(names, cs);

        var d = new Z3DataSorts();
        for (var i = 0; i < declared.length; i++) {
            var sort = declared[i];
            d.sorts.put(names[i], sort);
            var makes = sort.getConstructors();
            var testers = sort.getRecognizers();
            var accessors = sort.getAccessors();
            for (var j = 0; j < makes.length; j++)
                d.ctors.put(makes[j].getName().toString(), new Ctor(makes[j], testers[j], accessors[j]));
        }
        debug("Declared data types: " + d.sorts.keySet());
        return d;
    }

    @SuppressWarnings("unchecked")
    private static Constructor<Object>[] constructors(Context ctx, DataDef def, Map<String, Integer> index) throws VerificationException {
        var out = new ArrayList<Constructor<Object>>();
        for (var v : def.variants()) {
            var n = v.fields().size();
            var fieldNames = new String[n];
            var fieldSorts = new Sort[n];
            var refs = new int[n];
            for (var k = 0; k < n; k++) {
                var f = v.fields().get(k);
                fieldNames[k] = v.name() + "_" + f.name();
                var head = f.type().head();
                var self = index.get(head);
                if (self != null) {
                    refs[k] = self;
                } else {
                    fieldSorts[k] = fieldSort(ctx, def, head);
                }
            }
            out.add(ctx.mkConstructor(v.name(), "is-" + v.name(), fieldNames, fieldSorts, refs));
        }
        return out.toArray(new Constructor[0]);
    }

    private static Sort fieldSort(Context ctx, DataDef def, String type) throws VerificationException {
        var k = Sorts.builtin(type).orElse(Term.Kind.INT);
        return switch (k) {
            case BOOL -> ctx.getBoolSort();
            case REAL -> ctx.getRealSort();
            case COMPLEX -> throw VerificationException.translation("Complex field in data type '" + def.name() + "' is not supported");
            default -> ctx.getIntSort();
        };
    }

    @Override
    public Optional<DatatypeSort<?>> sort(String dataType) {
        return Optional.ofNullable(sorts.get(dataType));
    }

    @Override
    public boolean isConstructor(String name) {
        return ctors.containsKey(name);
    }

    @Override
    public int arity(String constructor) {
        var c = ctors.get(constructor);
        return c == null ? -1 : c.fields.length;
    }

    @Override
    public Expr<?> construct(String constructor, List<Expr<?>> args) throws VerificationException {
        var c = ctor(constructor);
        if (args.size() != c.fields.length)
            throw VerificationException.translation("Constructor '" + constructor + "' expects " + c.fields.length + " arguments, got " + args.size());
        return c.make.apply(args.toArray(new Expr<?>[0]));
    }

    @Override
    public Expr<BoolSort> test(String constructor, Expr<?> value) throws VerificationException {
        return ctor(constructor).tester.apply(value);
    }

    @Override
    public Expr<?> field(String constructor, int index, Expr<?> value) throws VerificationException {
        var c = ctor(constructor);
        if (index < 0 || index >= c.fields.length)
            throw VerificationException.translation("Constructor '" + constructor + "' has no field " + index);
        return c.fields[index].apply(value);
    }

    private Ctor ctor(String name) throws VerificationException {
        var c = ctors.get(name);
        if (c == null)
            throw VerificationException.translation("Constructor pattern '" + name + "' refers to an undeclared data type");
        return c;
    }
}
