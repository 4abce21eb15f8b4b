package dumb.kleis.solver.z3;

import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import dumb.kleis.Config;
import dumb.kleis.Decl.FunctionDef;
import dumb.kleis.Registry;
import dumb.kleis.TypeExpr;
import dumb.kleis.VerificationException;
import dumb.kleis.VerificationResult;
import dumb.kleis.solver.Backend;
import dumb.kleis.solver.Capabilities;
import dumb.kleis.solver.Satisfiability;
import dumb.kleis.solver.Witness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/** Z3 behind the {@link Backend} seam: one context and one incremental solver. */
public final class Z3Backend implements Backend {

    private static final Logger logger = LoggerFactory.getLogger(Z3Backend.class);

    private final Config config;
    private final Capabilities capabilities;
    private final Context ctx;
    private final Solver solver;
    private final Translator translator;

    private final List<Expr<BoolSort>> pending = new ArrayList<>();
    private int facts;

    private Z3Backend(Config config, Capabilities capabilities, Context ctx, Translator translator) {
        this.config = config;
        this.capabilities = capabilities;
        this.ctx = ctx;
        this.translator = translator;
        this.solver = ctx.mkSolver();
        configure();
    }

    public static Z3Backend create(Registry registry, Config config) throws VerificationException {
        requireNonNull(registry);
        requireNonNull(config);

        Capabilities caps;
        try {
            caps = Capabilities.load(config.capabilities());
        } catch (IOException e) {
            throw VerificationException.unavailable("Cannot read capability declaration '" + config.capabilities() + "'", e);
        }

        Context ctx;
        try {
            ctx = new Context(Map.of("model", "true"));
        } catch (LinkageError | Z3Exception e) {
            throw VerificationException.unavailable("Z3 could not be initialized: " + e.getMessage(), e);
        }

        try {
            var data = Z3DataSorts.of(ctx, registry.dataTypes());
            var backend = new Z3Backend(config, caps, ctx, new Translator(ctx, registry, data, config.maxPowerExpansion()));
            logger.info("Z3 backend ready: timeout {} ms, {} data types", config.timeoutMs(), registry.dataTypes().size());
            return backend;
        } catch (VerificationException | RuntimeException e) {
            ctx.close();
            throw e;
        }
    }

    private void configure() {
        var p = ctx.mkParams();
        p.add("timeout", config.timeoutMs());
        solver.setParameters(p);
    }

    @Override
    public String name() {
        return capabilities.solver().name();
    }

    @Override
    public Capabilities capabilities() {
        return capabilities;
    }

    @Override
    public void declareElement(String name, TypeExpr type) {
        translator.declareConstant(name, type);
    }

    @Override
    public void assume(String label, dumb.kleis.Expr proposition) throws VerificationException {
        pending.add(translator.proposition(proposition));
        logger.debug("Queued axiom {}", label);
    }

    @Override
    public void define(FunctionDef function) throws VerificationException {
        pending.add(translator.define(function));
        logger.debug("Queued definition of {}", function.name());
    }

    @Override
    public int commit() {
        var n = pending.size();
        for (var f : pending) solver.add(f);
        pending.clear();
        translator.commit();
        facts += n;
        return n;
    }

    @Override
    public void rollback() {
        if (!pending.isEmpty()) logger.debug("Discarding {} pending facts", pending.size());
        pending.clear();
        translator.rollback();
    }

    @Override
    public Satisfiability consistency() {
        return switch (check()) {
            case SATISFIABLE -> new Satisfiability.Satisfiable(new Witness(List.of(), solver.getModel().toString()));
            case UNSATISFIABLE -> new Satisfiability.Unsatisfiable();
            case UNKNOWN -> new Satisfiability.Unknown(reason());
        };
    }

    @Override
    public VerificationResult verify(dumb.kleis.Expr goal) throws VerificationException {
        var prop = translator.goal(goal);
        // declarations made for a query are kept; only a failed load drops its own
        translator.commit();
        solver.push();
        try {
            solver.add(ctx.mkNot(prop.formula()));
            var status = check();
            return switch (status) {
                case UNSATISFIABLE -> VerificationResult.VALID;
                case SATISFIABLE -> new VerificationResult.Invalid(Witnesses.of(solver.getModel(), prop.witnesses()));
                case UNKNOWN -> new VerificationResult.Unknown(reason());
            };
        } finally {
            solver.pop();
        }
    }

    @Override
    public boolean equivalent(dumb.kleis.Expr a, dumb.kleis.Expr b) throws VerificationException {
        var eq = translator.equation(a, b);
        translator.commit();
        solver.push();
        try {
            solver.add(ctx.mkNot(eq));
            var status = check();
            if (status == Status.UNKNOWN) logger.debug("Equivalence of {} and {} undecided: {}", a.toSexp(), b.toSexp(), reason());
            return status == Status.UNSATISFIABLE;
        } finally {
            solver.pop();
        }
    }

    @Override
    public Satisfiability satisfiable(dumb.kleis.Expr e) throws VerificationException {
        var prop = translator.instance(e);
        translator.commit();
        solver.push();
        try {
            solver.add(prop.formula());
            return switch (check()) {
                case SATISFIABLE -> new Satisfiability.Satisfiable(Witnesses.of(solver.getModel(), prop.witnesses()));
                case UNSATISFIABLE -> new Satisfiability.Unsatisfiable();
                case UNKNOWN -> new Satisfiability.Unknown(reason());
            };
        } finally {
            solver.pop();
        }
    }

    @Override
    public dumb.kleis.Expr simplify(dumb.kleis.Expr e) throws VerificationException {
        var t = translator.term(e);
        translator.commit();
        if (t instanceof Term.Complex c) {
            return dumb.kleis.Expr.op("complex", literal(c.re().simplify()), literal(c.im().simplify()));
        }
        return literal(((Term.Value) t).expr().simplify());
    }

    private static dumb.kleis.Expr literal(Expr<?> e) {
        if (e.isNumeral() || e.isTrue() || e.isFalse()) {
            var v = Witnesses.value(e);
            if (!v.contains(".") || v.matches("-?\\d+\\.\\d+")) return new dumb.kleis.Expr.Const(v);
        }
        return new dumb.kleis.Expr.Obj(e.toString());
    }

    private Status check() {
        try {
            return solver.check();
        } catch (Z3Exception e) {
            logger.warn("Solver check failed: {}", e.getMessage());
            return Status.UNKNOWN;
        }
    }

    private String reason() {
        try {
            var r = solver.getReasonUnknown();
            return r == null || r.isBlank() ? "unknown" : r;
        } catch (Z3Exception e) {
            return e.getMessage();
        }
    }

    @Override
    public int facts() {
        return facts;
    }

    @Override
    public Set<String> declaredOperations() {
        return translator.declaredOperations();
    }

    @Override
    public List<String> warnings() {
        return translator.warnings();
    }

    @Override
    public void reset() {
        solver.reset();
        configure();
        translator.reset();
        pending.clear();
        facts = 0;
    }

    @Override
    public void close() {
        ctx.close();
    }
}
