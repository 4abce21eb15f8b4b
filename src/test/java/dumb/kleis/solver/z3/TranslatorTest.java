package dumb.kleis.solver.z3;

import com.microsoft.z3.Context;
import com.microsoft.z3.Status;
import dumb.kleis.Expr;
import dumb.kleis.ProgramReader;
import dumb.kleis.Registry;
import dumb.kleis.SexpParser.ParseException;
import dumb.kleis.VerificationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranslatorTest {

    private Context ctx;
    private Translator translator;

    @BeforeEach
    void setUp() throws Exception {
        ctx = new Context(Map.of("model", "true"));
        var registry = ProgramReader.program("""
                (operation norm (-> Real Real))
                (structure Metric (X)
                  (operation dist (-> X X ℝ))
                  (operation wave (-> ℝ ℂ))
                  (element pivot ℤ))
                """).registry();
        translator = new Translator(ctx, registry, DataSorts.NONE, 16);
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private Term term(String text) throws ParseException, VerificationException {
        return translator.term(ProgramReader.expr(text));
    }

    private boolean holds(String proposition) throws ParseException, VerificationException {
        var s = ctx.mkSolver();
        s.add(ctx.mkNot(translator.proposition(ProgramReader.expr(proposition))));
        return s.check() == Status.UNSATISFIABLE;
    }

    private static VerificationException.Kind failure(Executable e) {
        return assertThrows(VerificationException.class, e::run).kind();
    }

    @FunctionalInterface
    private interface Executable {
        void run() throws Exception;
    }

    @Test
    void literalKinds() throws Exception {
        assertEquals(Term.Kind.INT, term("3").kind());
        assertEquals(Term.Kind.INT, term("-3").kind());
        assertEquals(Term.Kind.REAL, term("2.5").kind());
        assertEquals(Term.Kind.REAL, term("1/2").kind());
        assertEquals(Term.Kind.BOOL, term("true").kind());
        assertTrue(holds("(equals 1/2 0.5)"));
        assertTrue(holds("(less_than -3 0)"));
    }

    @Test
    void unsupportedLiterals() {
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> translator.term(new Expr.Const("0x10"))));
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> translator.term(new Expr.Const("1/0"))));
    }

    @Test
    void integersWidenAgainstReals() throws Exception {
        assertEquals(Term.Kind.REAL, term("(plus 1 2.5)").kind());
        assertEquals(Term.Kind.INT, term("(plus 1 2)").kind());
        assertEquals(Term.Kind.REAL, term("(divide 1 2)").kind());
        assertTrue(holds("(equals (divide 1 2) 0.5)"));
    }

    @Test
    void builtinArityIsChecked() {
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> term("(plus 1)")));
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> term("(not true false)")));
    }

    @Test
    void sortErrors() {
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> term("(and 1 true)")));
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> term("(equals true 1)")));
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> translator.proposition(ProgramReader.expr("(plus 1 2)"))));
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> term("(if 1 2 3)")));
    }

    @Test
    void registrySignaturesTypeApplications() throws Exception {
        assertEquals(Term.Kind.REAL, term("(norm 1)").kind());
        assertEquals(Term.Kind.REAL, term("(dist a b)").kind());
        assertEquals(Term.Kind.COMPLEX, term("(wave 0.5)").kind());
        assertEquals(Term.Kind.INT, term("pivot").kind());
        assertTrue(translator.warnings().stream().noneMatch(w -> w.contains("norm")));
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> term("(norm 1 2)")));
    }

    @Test
    void nullaryOperationsArePersistentConstants() throws Exception {
        assertTrue(holds("(equals pivot pivot)"));
        var a = (Term.Value) term("pivot");
        var b = (Term.Value) term("pivot");
        assertEquals(a.expr(), b.expr());
    }

    @Test
    void untypedApplicationsWarnAndDefaultToInt() throws Exception {
        assertEquals(Term.Kind.INT, term("(mystery 1.5 true)").kind());
        assertTrue(translator.warnings().stream().anyMatch(w -> w.contains("mystery")));
        assertTrue(translator.declaredOperations().contains("mystery"));
    }

    @Test
    void goalOpensLeadingUniversals() throws Exception {
        var p = translator.goal(ProgramReader.expr("(forall ((x Int) (y ℝ)) (forall ((z Int)) (greater_than (plus x y z) w)))"));
        assertEquals(List.of("x", "y", "z", "w"), List.copyOf(p.witnesses().keySet()));
        assertEquals(Term.Kind.REAL, p.witnesses().get("y").kind());
    }

    @Test
    void instanceOpensLeadingExistentials() throws Exception {
        var p = translator.instance(ProgramReader.expr("(exists ((n Int)) (where (greater_than n 0)) (equals (times n n) 49))"));
        var s = ctx.mkSolver();
        s.add(p.formula());
        assertEquals(Status.SATISFIABLE, s.check());
        assertEquals("7", Witnesses.value(s.getModel().eval(((Term.Value) p.witnesses().get("n")).expr(), true)));
    }

    @Test
    void equationSharesFreeNames() throws Exception {
        var s = ctx.mkSolver();
        s.add(ctx.mkNot(translator.equation(ProgramReader.expr("(plus x y)"), ProgramReader.expr("(plus y x)"))));
        assertEquals(Status.UNSATISFIABLE, s.check());
    }

    @Test
    void nestedQuantifiersStayClosed() throws Exception {
        assertTrue(holds("(forall ((x Int)) (exists ((y Int)) (greater_than y x)))"));
        assertFalse(holds("(exists ((y Int)) (forall ((x Int)) (greater_than y x)))"));
    }

    @Test
    void powerExpandsSmallExponents() throws Exception {
        assertTrue(holds("(forall ((x Int)) (equals (power x 3) (times x x x)))"));
        assertTrue(holds("(equals (power 2 0) 1)"));
        assertFalse(translator.declaredOperations().contains("power"));
        term("(power x n)");
        assertTrue(translator.declaredOperations().contains("power"));
    }

    @Test
    void complexArithmetic() throws Exception {
        var c = assertInstanceOf(Term.Complex.class, term("(times i i)"));
        assertEquals("-1", Witnesses.value(c.re().simplify()));
        assertEquals("0", Witnesses.value(c.im().simplify()));
        assertTrue(holds("(equals (re (complex 3 4)) 3)"));
        assertTrue(holds("(equals (abs_squared (complex 3 4)) 25)"));
        assertTrue(holds("(equals (complex_div (complex 2 2) (complex 1 1)) 2)"));
        assertTrue(holds("(equals (conj i) (negate i))"));
    }

    @Test
    void conditionalsAndLet() throws Exception {
        assertTrue(holds("(forall ((x Int)) (greater_than (if (less_than x 0) (negate x) (plus x 1)) 0))"));
        assertTrue(holds("(let y 2 (equals (times y y) 4))"));
        assertEquals(Term.Kind.REAL, term("(if true 1 2.5)").kind());
    }

    @Test
    void matchOverLiterals() throws Exception {
        assertTrue(holds("(forall ((x Int)) (where (equals x 1)) (equals (match x (0 10) (1 20) (_ 30)) 20))"));
        assertEquals(VerificationException.Kind.TRANSLATION, failure(() -> term("(match 1 ((Foo a) a) (_ 0))")));
    }

    @Test
    void definitionsAreUsable() throws Exception {
        var f = (dumb.kleis.Decl.FunctionDef) ProgramReader.program("(define inc (x) (plus x 1))").decls().get(0);
        var s = ctx.mkSolver();
        s.add(translator.define(f));
        s.add(ctx.mkNot(translator.proposition(ProgramReader.expr("(equals (inc 41) 42)"))));
        assertEquals(Status.UNSATISFIABLE, s.check());
        assertTrue(translator.declaredOperations().contains("inc"));
    }

    @Test
    void resetForgetsDeclarations() throws Exception {
        term("(mystery 1)");
        translator.reset();
        assertTrue(translator.declaredOperations().isEmpty());
        assertTrue(translator.warnings().isEmpty());
    }
}
