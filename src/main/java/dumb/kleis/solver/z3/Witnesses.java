package dumb.kleis.solver.z3;

import com.microsoft.z3.AlgebraicNum;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.RatNum;
import dumb.kleis.solver.Witness;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Map;

/** Renders model values of named constants. */
final class Witnesses {

    private Witnesses() {
    }

    static Witness of(Model model, Map<String, Term> named) {
        var bindings = new ArrayList<Witness.Binding>(named.size());
        named.forEach((name, term) -> bindings.add(new Witness.Binding(name, render(model, term))));
        return new Witness(bindings, model.toString());
    }

    static String render(Model model, Term t) {
        if (t instanceof Term.Complex c) {
            var re = value(model.eval(c.re(), true));
            var im = value(model.eval(c.im(), true));
            return re + " + " + im + "i";
        }
        return value(model.eval(((Term.Value) t).expr(), true));
    }

    static String value(Expr<?> e) {
        if (e instanceof IntNum n) return n.getBigInteger().toString();
        if (e instanceof RatNum r) {
            var den = r.getBigIntDenominator();
            return den.equals(BigInteger.ONE) ? r.getBigIntNumerator().toString() : r.getBigIntNumerator() + "/" + den;
        }
        if (e instanceof AlgebraicNum a) return a.toDecimal(10);
        if (e.isTrue()) return "true";
        if (e.isFalse()) return "false";
        return e.toString();
    }
}
