package dumb.kleis.solver.z3;

import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Z3Exception;
import dumb.kleis.Decl.FunctionDef;
import dumb.kleis.Expr.Cond;
import dumb.kleis.Expr.Const;
import dumb.kleis.Expr.Let;
import dumb.kleis.Expr.Lst;
import dumb.kleis.Expr.Match;
import dumb.kleis.Expr.Obj;
import dumb.kleis.Expr.Op;
import dumb.kleis.Expr.Quant;
import dumb.kleis.Expr.Quantifier;
import dumb.kleis.Log;
import dumb.kleis.Pattern;
import dumb.kleis.Registry;
import dumb.kleis.TypeExpr;
import dumb.kleis.VerificationException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.kleis.solver.z3.Operator.Builtin.EQUALS;

/**
 * Turns expression trees into solver terms. Builtin operators get their native
 * encoding; everything else becomes an uninterpreted function typed from the registry
 * when a signature is declared there.
 */
final class Translator {

    private static final java.util.regex.Pattern INTEGER = java.util.regex.Pattern.compile("\\d+");
    private static final java.util.regex.Pattern DECIMAL = java.util.regex.Pattern.compile("\\d+\\.\\d+");
    private static final java.util.regex.Pattern RATIO = java.util.regex.Pattern.compile("(\\d+)/(\\d+)");

    private final Context ctx;
    private final Registry registry;
    private final DataSorts data;
    private final Sorts sorts;
    private final Functions functions;

    private final Complexes complexes;
    private final Arithmetic arithmetic;
    private final Booleans booleans;
    private final Comparisons comparisons;
    private final Rationals rationals;

    /** Elements and nullary operations: one constant each for the solver's lifetime. */
    private final Map<String, Term> constants = new HashMap<>();
    private final Map<String, Defined> defined = new HashMap<>();
    /** Constants and definitions added since the last commit. */
    private final List<String> stagedConstants = new ArrayList<>();
    private final List<String> stagedDefinitions = new ArrayList<>();
    private final Set<String> warnings = new LinkedHashSet<>();

    /** Suffix counter for fresh constant names; never reset, so names stay unique per solver context. */
    private long fresh;

    private record Defined(FuncDecl<Sort> decl, List<Sorts.Carrier> params) {
    }

    /** Translated proposition and the constants whose model values make a witness. */
    record Prop(Expr<BoolSort> formula, Map<String, Term> witnesses) {
    }

    private record Arm(@Nullable Expr<BoolSort> test, Env env) {
    }

    Translator(Context ctx, Registry registry, DataSorts data, int maxPowerExpansion) {
        this.ctx = ctx;
        this.registry = registry;
        this.data = data;
        this.sorts = new Sorts(ctx, data, this::warn);
        this.functions = new Functions(ctx);
        this.complexes = new Complexes(ctx, functions);
        this.arithmetic = new Arithmetic(ctx, functions, complexes, maxPowerExpansion);
        this.booleans = new Booleans(ctx, functions);
        this.comparisons = new Comparisons(ctx, functions, complexes);
        this.rationals = new Rationals(ctx, functions);
    }

    /** Closed proposition, as asserted for a background axiom. */
    Expr<BoolSort> proposition(dumb.kleis.Expr e) throws VerificationException {
        try {
            return bool(translate(e, Env.root()), "Axiom");
        } catch (Z3Exception x) {
            throw failed(e, x);
        }
    }

    /**
     * Goal with its leading universal quantifiers opened: their variables become free
     * constants, so a countermodel names their values.
     */
    Prop goal(dumb.kleis.Expr e) throws VerificationException {
        return opened(e, Quantifier.FORALL);
    }

    /** Like {@link #goal} for leading existentials; a model then is an instance. */
    Prop instance(dumb.kleis.Expr e) throws VerificationException {
        return opened(e, Quantifier.EXISTS);
    }

    Term term(dumb.kleis.Expr e) throws VerificationException {
        try {
            return translate(e, Env.root());
        } catch (Z3Exception x) {
            throw failed(e, x);
        }
    }

    /** {@code a = b} with free names shared between both sides. */
    Expr<BoolSort> equation(dumb.kleis.Expr a, dumb.kleis.Expr b) throws VerificationException {
        try {
            var env = Env.root();
            return comparisons.equal(translate(a, env), translate(b, env), EQUALS);
        } catch (Z3Exception x) {
            throw failed(dumb.kleis.Expr.op("equals", a, b), x);
        }
    }

    private Prop opened(dumb.kleis.Expr e, Quantifier kind) throws VerificationException {
        try {
            var env = Env.root();
            var witnesses = new LinkedHashMap<String, Term>();
            var guards = new ArrayList<Expr<BoolSort>>();
            var cur = e;
            while (cur instanceof Quant q && q.kind() == kind) {
                for (var v : q.vars()) {
                    var t = freshConstant(v.name(), sorts.of(v.type()));
                    env = env.bind(v.name(), t);
                    witnesses.put(v.name(), t);
                }
                if (q.where() != null) guards.add(bool(translate(q.where(), env), "Where clause"));
                cur = q.body();
            }
            var body = bool(translate(cur, env), "Proposition");
            Expr<BoolSort> formula;
            if (guards.isEmpty()) formula = body;
            else {
                var guard = guards.size() == 1 ? guards.get(0) : ctx.mkAnd(array(guards));
                formula = kind == Quantifier.FORALL ? ctx.mkImplies(guard, body) : ctx.mkAnd(guard, body);
            }
            env.freeNames().forEach(witnesses::putIfAbsent);
            return new Prop(formula, Collections.unmodifiableMap(witnesses));
        } catch (Z3Exception x) {
            throw failed(e, x);
        }
    }

    /** Persistent constant for an element or nullary operation of the given type. */
    Term declareConstant(String name, TypeExpr type) {
        var c = constants.get(name);
        if (c != null) return c;
        var carrier = sorts.of(type);
        var t = carrier.complex()
                ? new Term.Complex(ctx.mkRealConst(name + ".re"), ctx.mkRealConst(name + ".im"))
                : Term.of(ctx.mkConst(name, carrier.sort()));
        constants.put(name, t);
        stagedConstants.add(name);
        return t;
    }

    /**
     * Declares the function and returns its defining axiom
     * {@code ∀ params. f(params) = body}. The result sort is the body's sort.
     */
    Expr<BoolSort> define(FunctionDef f) throws VerificationException {
        try {
            var carriers = parameterCarriers(f);
            var env = Env.root();
            var bound = new ArrayList<Expr<?>>();
            for (var i = 0; i < carriers.size(); i++) {
                var t = freshConstant(f.params().get(i).name(), carriers.get(i));
                env = env.bind(f.params().get(i).name(), t);
                bound.addAll(components(t));
            }
            var body = translate(f.body(), env);
            if (!(body instanceof Term.Value v))
                throw VerificationException.translation("Function '" + f.name() + "' has a complex result; declare it as two real functions");

            var domain = bound.stream().map(Expr::getSort).toArray(Sort[]::new);
            var decl = functions.declare(f.name(), domain, v.expr().getSort());
            if (defined.put(f.name(), new Defined(decl, carriers)) == null) stagedDefinitions.add(f.name());

            var args = bound.toArray(new Expr<?>[0]);
            Expr<BoolSort> eq = ctx.mkEq(decl.apply(args), v.any());
            return args.length == 0 ? eq : ctx.mkForall(args, eq, 1, null, null, null, null);
        } catch (Z3Exception x) {
            throw failed(f.body(), x);
        }
    }

    private List<Sorts.Carrier> parameterCarriers(FunctionDef f) {
        var sig = registry.getOperationSignature(f.name());
        if (sig.isPresent() && sig.get() instanceof TypeExpr.Function fn && fn.arguments().size() == f.params().size())
            return sorts.params(fn);
        return f.params().stream().map(p -> sorts.of(p.type())).toList();
    }

    Term translate(dumb.kleis.Expr e, Env env) throws VerificationException {
        if (e instanceof Const c) return literal(c.value());
        if (e instanceof Obj o) return object(o.name(), env);
        if (e instanceof Op o) return operation(o, env);
        if (e instanceof Quant q) return Term.of(quantified(q, env));
        if (e instanceof Cond c) return ite(bool(translate(c.test(), env), "If condition"), translate(c.then(), env), translate(c.otherwise(), env));
        if (e instanceof Let l) return translate(l.body(), env.bind(l.name(), translate(l.value(), env)));
        if (e instanceof Match m) return match(m, env);
        if (e instanceof Lst l) return list(l, env);
        throw new IllegalStateException("Unhandled expression: " + e);
    }

    private Term literal(String v) throws VerificationException {
        if (v.equals("true")) return Term.of(ctx.mkTrue());
        if (v.equals("false")) return Term.of(ctx.mkFalse());

        var negative = v.startsWith("-");
        var digits = negative ? v.substring(1) : v;
        Term magnitude;
        if (INTEGER.matcher(digits).matches()) {
            magnitude = Term.of(ctx.mkInt(digits));
        } else if (DECIMAL.matcher(digits).matches()) {
            magnitude = Term.of(ctx.mkReal(digits));
        } else {
            var r = RATIO.matcher(digits);
            if (!r.matches()) throw VerificationException.translation("Unsupported literal '" + v + "'");
            if (r.group(2).chars().allMatch(ch -> ch == '0'))
                throw VerificationException.translation("Zero denominator in literal '" + v + "'");
            magnitude = Term.of(ctx.mkReal(digits));
        }
        return negative ? Term.of(ctx.mkUnaryMinus(((Term.Value) magnitude).arith())) : magnitude;
    }

    private Term object(String name, Env env) throws VerificationException {
        var bound = env.lookup(name);
        if (bound.isPresent()) return bound.get();

        var c = constants.get(name);
        if (c != null) return c;

        if (data.isConstructor(name)) {
            if (data.arity(name) != 0)
                throw VerificationException.translation("Constructor '" + name + "' needs " + data.arity(name) + " arguments");
            return Term.of(data.construct(name, List.of()));
        }

        var sig = registry.getOperationSignature(name);
        if (sig.isPresent() && !(sig.get() instanceof TypeExpr.Function f && !f.arguments().isEmpty()))
            return declareConstant(name, sig.get());

        switch (name) {
            case "i":
                return complexes.unit();
            case "true":
            case "false":
                return literal(name);
            default:
                return env.free(name, () -> freshConstant(name, sorts.carrier(Term.Kind.INT)));
        }
    }

    private Term operation(Op o, Env env) throws VerificationException {
        var args = new ArrayList<Term>(o.arity());
        for (var a : o.args()) args.add(translate(a, env));

        var op = Operator.resolve(o.name(), o.arity());
        if (op instanceof Operator.Builtin b) {
            if (!b.accepts(args.size()))
                throw VerificationException.translation("'" + o.name() + "' expects " + arity(b) + " arguments, got " + args.size());
            return switch (b.category) {
                case ARITHMETIC -> args.stream().allMatch(a -> a.numeric() || a.complex())
                        ? arithmetic.apply(b, args)
                        : opaque(b.symbol(), args);
                case BOOLEAN -> booleans.apply(b, args);
                case COMPARISON -> comparisons.apply(b, args);
                case COMPLEX -> complexes.apply(b, args);
                case RATIONAL -> rationals.apply(b, args);
            };
        }
        return application((Operator.Uninterpreted) op, args, env);
    }

    /**
     * Arithmetic over operands with no numeric reading, such as data values: an
     * uninterpreted function of the canonical name, returning the range the registry
     * declares for it or Int.
     */
    private Term opaque(String name, List<Term> args) {
        var flat = new ArrayList<Expr<?>>();
        for (var a : args) flat.addAll(components(a));
        Sort range = ctx.getIntSort();
        var sig = registry.getOperationSignature(name);
        if (sig.isPresent() && sig.get() instanceof TypeExpr.Function f && f.arguments().size() == args.size()) {
            var result = sorts.of(f.result());
            if (!result.complex()) range = result.sort();
        }
        return Term.of(functions.apply(name, range, flat.toArray(new Expr<?>[0])));
    }

    private static String arity(Operator.Builtin b) {
        if (b.minArity == b.maxArity) return Integer.toString(b.minArity);
        return b.maxArity == Integer.MAX_VALUE ? "at least " + b.minArity : b.minArity + " to " + b.maxArity;
    }

    private Term application(Operator.Uninterpreted u, List<Term> args, Env env) throws VerificationException {
        var name = u.name();
        if (data.isConstructor(name)) {
            var flat = new ArrayList<Expr<?>>();
            for (var a : args) {
                if (!(a instanceof Term.Value v))
                    throw VerificationException.translation("Constructor '" + name + "' cannot take a complex argument");
                flat.add(v.expr());
            }
            return Term.of(data.construct(name, flat));
        }

        var d = defined.get(name);
        if (d != null) {
            if (d.params().size() != args.size())
                throw VerificationException.translation("Function '" + name + "' takes " + d.params().size() + " arguments, got " + args.size());
            return Term.of(d.decl().apply(coerce(name, args, d.params())));
        }

        if (args.isEmpty()) return object(name, env);

        var sig = registry.getOperationSignature(name);
        if (sig.isPresent() && sig.get() instanceof TypeExpr.Function f) {
            if (f.arguments().size() != args.size())
                throw VerificationException.translation("Operation '" + name + "' is declared with " + f.arguments().size() + " parameters but applied to " + args.size());
            var flat = coerce(name, args, sorts.params(f));
            var result = sorts.of(f.result());
            if (result.complex())
                return new Term.Complex(real(functions.apply(name + ".re", ctx.getRealSort(), flat)), real(functions.apply(name + ".im", ctx.getRealSort(), flat)));
            return Term.of(functions.apply(name, result.sort(), flat));
        }

        warn("No signature for operation '" + name + "', result defaults to Int");
        var flat = new ArrayList<Expr<?>>();
        for (var a : args) flat.addAll(components(a));
        return Term.of(functions.apply(name, ctx.getIntSort(), flat.toArray(new Expr<?>[0])));
    }

    /** Arguments matched to parameter carriers: Int widens to Real, complex splits in two. */
    private Expr<?>[] coerce(String name, List<Term> args, List<Sorts.Carrier> params) throws VerificationException {
        var out = new ArrayList<Expr<?>>();
        for (var i = 0; i < args.size(); i++) {
            var t = args.get(i);
            var p = params.get(i);
            if (p.complex()) {
                out.addAll(components(lift(t, name)));
            } else if (t instanceof Term.Value v && p.kind() == Term.Kind.REAL && t.kind() == Term.Kind.INT) {
                out.add(ctx.mkInt2Real(v.integer()));
            } else if (t instanceof Term.Value v && v.expr().getSort().equals(p.sort())) {
                out.add(v.expr());
            } else {
                throw VerificationException.translation("Argument " + (i + 1) + " of '" + name + "' is " + t.kind() + ", expected " + p.kind());
            }
        }
        return out.toArray(new Expr<?>[0]);
    }

    private Expr<BoolSort> quantified(Quant q, Env env) throws VerificationException {
        var bound = new ArrayList<Expr<?>>();
        var inner = env;
        for (var v : q.vars()) {
            var t = freshConstant(v.name(), sorts.of(v.type()));
            inner = inner.bind(v.name(), t);
            bound.addAll(components(t));
        }
        var body = bool(translate(q.body(), inner), "Quantifier body");
        var guard = q.where() == null ? null : bool(translate(q.where(), inner), "Where clause");
        if (bound.isEmpty())
            return guard == null ? body : q.kind() == Quantifier.FORALL ? ctx.mkImplies(guard, body) : ctx.mkAnd(guard, body);

        var vars = bound.toArray(new Expr<?>[0]);
        return q.kind() == Quantifier.FORALL
                ? ctx.mkForall(vars, guard == null ? body : ctx.mkImplies(guard, body), 1, null, null, null, null)
                : ctx.mkExists(vars, guard == null ? body : ctx.mkAnd(guard, body), 1, null, null, null, null);
    }

    /** Cases fold right to left into nested if-then-else; the last case is the fall-through. */
    private Term match(Match m, Env env) throws VerificationException {
        var s = translate(m.scrutinee(), env);
        Term result = null;
        for (var i = m.cases().size() - 1; i >= 0; i--) {
            var c = m.cases().get(i);
            var arm = arm(c.pattern(), s, env);
            var body = translate(c.body(), arm.env());
            result = result == null || arm.test() == null ? body : ite(arm.test(), body, result);
        }
        return result;
    }

    private Arm arm(Pattern p, Term s, Env env) throws VerificationException {
        if (p instanceof Pattern.Wildcard) return new Arm(null, env);
        if (p instanceof Pattern.Variable v) {
            if (data.isConstructor(v.name())) return constructorArm(new Pattern.Constructor(v.name(), List.of()), s, env);
            return new Arm(null, env.bind(v.name(), s));
        }
        if (p instanceof Pattern.Constant c) return new Arm(comparisons.equal(s, literal(c.value()), EQUALS), env);
        return constructorArm((Pattern.Constructor) p, s, env);
    }

    private Arm constructorArm(Pattern.Constructor k, Term s, Env env) throws VerificationException {
        if (!data.isConstructor(k.name()))
            throw VerificationException.translation("Constructor pattern '" + k.name() + "' refers to an undeclared data type");
        if (!(s instanceof Term.Value v) || s.kind() != Term.Kind.DATA)
            throw VerificationException.translation("Constructor pattern '" + k.toSexp() + "' cannot match " + s.kind() + " value " + s);
        if (data.arity(k.name()) != k.args().size())
            throw VerificationException.translation("Constructor pattern '" + k.toSexp() + "' expects " + data.arity(k.name()) + " fields");

        var test = data.test(k.name(), v.expr());
        var inner = env;
        for (var i = 0; i < k.args().size(); i++) {
            var field = Term.of(data.field(k.name(), i, v.expr()));
            var sub = arm(k.args().get(i), field, inner);
            inner = sub.env();
            if (sub.test() != null) test = ctx.mkAnd(test, sub.test());
        }
        return new Arm(test, inner);
    }

    private Term list(Lst l, Env env) throws VerificationException {
        Expr<?> acc = functions.apply("nil", ctx.getIntSort());
        for (var i = l.elements().size() - 1; i >= 0; i--) {
            var parts = new ArrayList<>(components(translate(l.elements().get(i), env)));
            parts.add(acc);
            acc = functions.apply("cons", ctx.getIntSort(), parts.toArray(new Expr<?>[0]));
        }
        return Term.of(acc);
    }

    private Term ite(Expr<BoolSort> test, Term a, Term b) throws VerificationException {
        if (a.complex() || b.complex()) {
            var x = lift(a, "if");
            var y = lift(b, "if");
            return new Term.Complex(ctx.mkITE(test, x.re(), y.re()), ctx.mkITE(test, x.im(), y.im()));
        }
        var va = (Term.Value) a;
        var vb = (Term.Value) b;
        if (a.numeric() && b.numeric() && a.kind() != b.kind()) {
            va = widen(va);
            vb = widen(vb);
        }
        if (!va.expr().getSort().equals(vb.expr().getSort()))
            throw VerificationException.translation("Branches have different sorts: " + a.kind() + " and " + b.kind());
        return Term.of(ctx.mkITE(test, va.any(), vb.any()));
    }

    private Term.Value widen(Term.Value v) {
        return v.kind() == Term.Kind.INT ? new Term.Value(ctx.mkInt2Real(v.integer())) : v;
    }

    private Term.Complex lift(Term t, String where) throws VerificationException {
        if (t instanceof Term.Complex c) return c;
        var v = (Term.Value) t;
        if (t.kind() == Term.Kind.INT) return new Term.Complex(ctx.mkInt2Real(v.integer()), ctx.mkReal(0));
        if (t.kind() == Term.Kind.REAL) return new Term.Complex(real(v.expr()), ctx.mkReal(0));
        throw VerificationException.translation("Cannot use " + t.kind() + " value " + t + " as a complex number in '" + where + "'");
    }

    private Term freshConstant(String name, Sorts.Carrier carrier) {
        var id = fresh++;
        if (carrier.complex())
            return new Term.Complex(ctx.mkRealConst(name + ".re!" + id), ctx.mkRealConst(name + ".im!" + id));
        return Term.of(ctx.mkConst(name + "!" + id, carrier.sort()));
    }

    private static List<Expr<?>> components(Term t) {
        return t instanceof Term.Complex c ? List.of(c.re(), c.im()) : List.of(((Term.Value) t).expr());
    }

    private static Expr<BoolSort> bool(Term t, String what) throws VerificationException {
        if (t instanceof Term.Value v && t.kind() == Term.Kind.BOOL) return v.bool();
        throw VerificationException.translation(what + " must be Bool, got " + t.kind() + " (" + t + ")");
    }

    @SuppressWarnings("unchecked")
    private static Expr<RealSort> real(Expr<?> e) {
        return (Expr<RealSort>) e;
    }

    @SuppressWarnings("unchecked")
    private static Expr<BoolSort>[] array(List<Expr<BoolSort>> l) {
        return l.toArray(new Expr[0]);
    }

    private static VerificationException failed(Object what, Z3Exception x) {
        var text = what instanceof dumb.kleis.Expr e ? e.toSexp() : String.valueOf(what);
        return new VerificationException(VerificationException.Kind.TRANSLATION, "Solver rejected " + text + ": " + x.getMessage(), x);
    }

    private void warn(String message) {
        if (warnings.add(message)) Log.warning(message);
    }

    List<String> warnings() {
        return List.copyOf(warnings);
    }

    Set<String> declaredOperations() {
        return functions.names();
    }

    /** Keeps everything declared since the last commit. */
    void commit() {
        stagedConstants.clear();
        stagedDefinitions.clear();
        functions.commit();
    }

    /** Forgets the constants, definitions and declarations made since the last commit. */
    void rollback() {
        stagedConstants.forEach(constants::remove);
        stagedDefinitions.forEach(defined::remove);
        functions.rollback();
        commit();
    }

    /** Forgets constants, definitions and declarations; the fresh-name counter keeps counting. */
    void reset() {
        constants.clear();
        defined.clear();
        functions.clear();
        warnings.clear();
        commit();
    }
}
