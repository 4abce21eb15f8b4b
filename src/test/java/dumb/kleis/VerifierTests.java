package dumb.kleis;

import dumb.kleis.VerificationException.Kind;
import dumb.kleis.solver.Satisfiability;
import dumb.kleis.solver.Witness;
import dumb.kleis.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VerifierTests extends AbstractTest {

    private static final String ALGEBRA = """
            (structure Semigroup (S)
              (operation mul (-> S S S))
              (axiom assoc (forall ((a S) (b S) (c S)) (equals (mul (mul a b) c) (mul a (mul b c))))))

            (structure Monoid (M)
              (extends Semigroup M)
              (element e M)
              (axiom left_id (forall ((a M)) (equals (mul e a) a)))
              (axiom right_id (forall ((a M)) (equals (mul a e) a))))

            (structure Group (G)
              (extends Monoid G)
              (operation inv (-> G G))
              (axiom left_inv (forall ((a G)) (equals (mul (inv a) a) e))))

            (structure AbelianGroup (A)
              (extends Group A)
              (axiom comm (forall ((a A) (b A)) (equals (mul a b) (mul b a)))))

            (structure Lattice (L)
              (operation meet (-> L L L))
              (axiom meet_comm (forall ((a L) (b L)) (equals (meet a b) (meet b a)))))
            """;

    private static final String MODULES = """
            (structure Ring (R)
              (operation radd (-> R R R))
              (element rzero R)
              (axiom radd_zero (forall ((a R)) (equals (radd a rzero) a))))

            (structure Module (M R)
              (operation scale (-> R M M))
              (axiom scale_id (forall ((m M)) (equals (scale rzero m) (scale rzero m)))))

            (implements Module (Vec Int) (where (Ring Int)))
            """;

    @ParameterizedTest
    @ValueSource(strings = {
            "(forall ((x Int) (y Int)) (equals (plus x y) (plus y x)))",
            "(forall ((x Int) (y Int) (z Int)) (equals (plus (plus x y) z) (plus x (plus y z))))",
            "(forall ((x Int) (y Int) (z Int)) (equals (times x (plus y z)) (plus (times x y) (times x z))))",
            "(forall ((x ℝ) (y ℝ)) (equals (times x y) (times y x)))",
            "(forall ((x Int)) (where (greater_than x 0)) (greater_than (plus x x) x))",
            "(forall ((x Int)) (equals (power x 2) (times x x)))",
            "(forall ((x Int)) (let y (plus x 1) (greater_than y x)))",
            "(exists ((y Int)) (equals (plus y 1) 5))",
            "(equals (abs (negate 7)) 7)",
            "(equals (abs (negate 2.5)) 2.5)",
            "(forall ((x ℝ)) (geq (abs x) 0))",
            "(forall ((x ℝ)) (where (less_than x 0)) (equals (abs x) (negate x)))",
            "(implies (and true (not false)) (or false true))"
    })
    void arithmeticLawsAreValid(String goal) throws VerificationException {
        verifier("");
        assertValid(goal);
    }

    @Test
    void falseClaimHasCounterexample() throws VerificationException {
        verifier("");
        var w = assertInvalid("(forall ((x Int)) (equals (plus x 1) x))");
        assertTrue(w.value("x").isPresent(), w::toString);
        assertFalse(w.raw().isBlank());
    }

    @Test
    void abstractCarrierGetsCounterexample() throws VerificationException {
        verifier("");
        var w = assertInvalid("(forall ((x M)) (equals (plus x 1) x))");
        assertEquals(List.of("x"), w.bindings().stream().map(Witness.Binding::name).toList());
        assertTrue(verifier.warnings().stream().anyMatch(m -> m.contains("'M'")), () -> verifier.warnings().toString());
    }

    @Test
    void counterexampleNamesFreeObjects() throws VerificationException {
        verifier("");
        var w = assertInvalid("(greater_than n 10)");
        var n = Long.parseLong(w.value("n").orElseThrow());
        assertTrue(n <= 10, w::toString);
    }

    @Test
    void repeatedVerificationLoadsOnce() throws VerificationException {
        verifier(ALGEBRA);
        var goal = "(forall ((x G)) (equals (mul (inv x) x) e))";
        assertValid(goal);
        var first = verifier.stats();
        var facts = verifier.snapshot().backgroundFacts();
        assertValid(goal);
        assertEquals(first, verifier.stats());
        assertEquals(facts, verifier.snapshot().backgroundFacts());
    }

    @Test
    void extendsChainLoadsAncestors() throws VerificationException {
        verifier(ALGEBRA);
        assertValid("(forall ((x G)) (equals (inv x) (inv x)))");
        assertEquals(List.of("Group", "Monoid", "Semigroup"), verifier.snapshot().loadedStructures());
    }

    @Test
    void semigroupGoalLeavesDescendantsUnloaded() throws VerificationException {
        verifier(ALGEBRA);
        assertValid("(forall ((a S) (b S) (c S)) (equals (mul a (mul b c)) (mul (mul a b) c)))");
        assertEquals(List.of("Semigroup"), verifier.snapshot().loadedStructures());
        assertTrue(verifier.stats().loadedStructures() >= 1);

        verifier.load("AbelianGroup");
        assertEquals(List.of("AbelianGroup", "Group", "Monoid", "Semigroup"), verifier.snapshot().loadedStructures());
        assertValid("(forall ((a A) (b A)) (equals (mul a b) (mul b a)))");
    }

    @Test
    void parentAxiomsAreUsable() throws VerificationException {
        verifier(ALGEBRA);
        assertValid("(forall ((x G)) (equals (mul e (inv x)) (inv x)))");
    }

    @Test
    void unrelatedStructureStaysUnloaded() throws VerificationException {
        verifier(ALGEBRA);
        assertValid("(forall ((a L) (b L)) (equals (meet a b) (meet b a)))");
        assertEquals(List.of("Lattice"), verifier.snapshot().loadedStructures());
        assertEquals(1, verifier.stats().loadedStructures());
    }

    @Test
    void whereClauseLoadsConstraint() throws VerificationException {
        verifier(MODULES);
        assertValid("(forall ((m Int)) (equals (scale 0 m) (scale 0 m)))");
        assertTrue(verifier.snapshot().loadedStructures().containsAll(Set.of("Module", "Ring")));
    }

    @Test
    void unresolvedWhereClauseRollsBack() throws VerificationException {
        verifier("""
                (structure Module (M) (operation scale (-> M M)) (axiom a (forall ((m M)) (equals (scale m) (scale m)))))
                (implements Module (Int) (where (Missing Int)))
                """);
        var e = assertFails(Kind.UNRESOLVED_REFERENCE, "(equals (scale 1) (scale 1))");
        assertTrue(e.getMessage().contains("Missing"), e::getMessage);
        assertEquals(0, verifier.stats().loadedStructures());
        assertEquals(0, verifier.snapshot().backgroundFacts());
    }

    @Test
    void failingAxiomLeavesVerifierUsable() throws VerificationException {
        verifier("""
                (structure Broken (T) (operation f (-> Int Int)) (axiom not_a_proposition (plus (f 1) 2)))
                (structure Fine (T) (operation g (-> Int Int)) (axiom g_id (forall ((x Int)) (equals (g x) x))))
                """);
        assertFails(Kind.TRANSLATION, "(equals (f 1) (f 1))");
        assertEquals(0, verifier.stats().loadedStructures());
        assertValid("(equals (g 5) 5)");
        assertEquals(List.of("Fine"), verifier.snapshot().loadedStructures());
    }

    @Test
    void contradictoryAxiomsAreReported() throws VerificationException {
        verifier("""
                (structure Bad (T)
                  (operation f (-> Int Int))
                  (axiom one (equals (f 0) 1))
                  (axiom two (equals (f 0) 2)))
                """);
        assertEquals(VerificationResult.INCONSISTENT, verify("(equals (f 0) (f 0))"));
    }

    @Test
    void nestedStructureAxiomsAreLoaded() throws VerificationException {
        verifier("""
                (structure Ring (R)
                  (nested additive (AbelianGroup R)
                    (operation addop (-> R R R))
                    (element zro R)
                    (axiom add_zero (forall ((a R)) (equals (addop a zro) a)))))
                """);
        assertValid("(forall ((x R)) (equals (addop (addop x zro) zro) x))");
        assertEquals(Set.of("Ring"), Set.copyOf(verifier.snapshot().loadedStructures()));
    }

    @Test
    void matchWithWildcard() throws VerificationException {
        verifier("");
        assertValid("(equals (match 5 (0 1) (_ 2)) 2)");
        assertValid("(forall ((x Int)) (equals (match x (0 1) (n (plus n 1))) (if (equals x 0) 1 (plus x 1))))");
    }

    @Test
    void matchFallsThroughToWildcard() throws VerificationException {
        verifier("");
        assertValid("(equals (match 999 (0 100) (1 200) (_ 300)) 300)");
    }

    @Test
    void matchFallsThroughToLastCase() throws VerificationException {
        verifier("");
        assertValid("(forall ((x Int)) (implies (not (equals x 0)) (equals (match x (0 10) (1 20)) 20)))");
    }

    @Test
    void matchOnDataConstructors() throws VerificationException {
        verifier("(data Opt () None (Some (value Int)))");
        assertValid("(forall ((n Int)) (equals (match (Some n) (None 0) ((Some v) v)) n))");
        assertValid("(not (equals None (Some 1)))");
    }

    @Test
    void undeclaredConstructorPatternFails() throws VerificationException {
        verifier("");
        assertFails(Kind.TRANSLATION, "(equals (match 1 ((Foo x) x) (_ 0)) 0)");
    }

    @Test
    void complexNumbers() throws VerificationException {
        verifier("");
        assertValid("(equals (times i i) (complex -1 0))");
        assertValid("(equals (complex_mul i i) (negate 1))");
        assertValid("(forall ((z ℂ)) (equals (times z (conj z)) (complex (abs_squared z) 0)))");
        assertValid("(forall ((z Complex) (w Complex)) (equals (plus z w) (plus w z)))");
    }

    @Test
    void rationals() throws VerificationException {
        verifier("");
        assertValid("(equals (rational_add (rational 1 2) (rational 1 3)) (rational 5 6))");
        assertValid("(equals (plus 1/2 0.5) 1)");
        assertValid("(forall ((q ℚ)) (where (rational_gt q 0)) (rational_gt (rational_inv q) 0))");
    }

    @Test
    void integerDivision() throws VerificationException {
        verifier("");
        assertValid("(equals (int_div 7 2) 3)");
        assertValid("(equals (mod 7 2) 1)");
        assertValid("(equals (floor 2.5) 2)");
        assertValid("(equals (ceil 2.5) 3)");
    }

    @Test
    void sqrtIsUninterpreted() throws VerificationException {
        verifier("");
        assertInvalid("(equals (sqrt 4) 2)");
        assertValid("(forall ((x ℝ)) (equals (sqrt x) (sqrt x)))");
        assertTrue(verifier.snapshot().declaredOperations().contains("sqrt"));
    }

    @Test
    void arithmeticOnDataValuesIsUninterpreted() throws VerificationException {
        verifier("(data Color () Red Green)");
        assertValid("(forall ((a Color) (b Color)) (equals (plus a b) (plus a b)))");
        assertInvalid("(forall ((a Color) (b Color)) (equals (plus a b) (plus b a)))");
        assertTrue(verifier.snapshot().declaredOperations().contains("plus"));
    }

    @Test
    void arithmeticOnDataValuesUsesDeclaredAxioms() throws VerificationException {
        verifier("""
                (data Color () Red Green)
                (structure Palette (C)
                  (operation plus (-> Color Color Color))
                  (axiom mix_comm (forall ((a Color) (b Color)) (equals (plus a b) (plus b a))))
                  (axiom mix_red (forall ((a Color)) (equals (plus Red a) Red))))
                """);
        assertValid("(forall ((a Color) (b Color)) (equals (plus a b) (plus b a)))");
        assertValid("(equals (plus Green Red) Red)");
        assertTrue(verifier.snapshot().loadedStructures().contains("Palette"));
    }

    @Test
    void booleanOperatorOnIntegersFails() throws VerificationException {
        verifier("");
        assertFails(Kind.TRANSLATION, "(and 1 2)");
    }

    @Test
    void nonBooleanGoalFails() throws VerificationException {
        verifier("");
        assertFails(Kind.TRANSLATION, "(plus 1 2)");
    }

    @Test
    void programFunctionsAreDefined() throws VerificationException {
        verifier("");
        verifier.loadProgramFunctions(program("""
                (define double (x) (plus x x))
                (define sign ((x Int)) (if (less_than x 0) -1 (if (equals x 0) 0 1)))
                """));
        assertValid("(forall ((n Int)) (equals (double n) (times 2 n)))");
        assertValid("(equals (sign -5) -1)");
        assertValid("(equals (sign (double 3)) 1)");
        assertTrue(verifier.snapshot().declaredOperations().containsAll(Set.of("double", "sign")));
    }

    @Test
    void failedFunctionLoadForgetsItsDefinitions() throws VerificationException {
        verifier("");
        var bad = program("""
                (define good (x) (plus x 1))
                (define bad (x) (and x 1))
                """);
        var e = assertThrows(VerificationException.class, () -> verifier.loadProgramFunctions(bad));
        assertEquals(Kind.TRANSLATION, e.kind());
        assertFalse(verifier.snapshot().declaredOperations().contains("good"), () -> verifier.snapshot().toString());
        assertEquals(0, verifier.stats().declaredOperations());
        assertEquals(0, verifier.snapshot().backgroundFacts());

        verifier.loadProgramFunctions(program("(define good (x) (plus x 1))"));
        assertValid("(equals (good 1) 2)");
    }

    @Test
    void registeredFunctionsLoadStructuresTheyUse() throws VerificationException {
        verifier(ALGEBRA + "\n(define square (x) (mul x x))");
        verifier.loadRegisteredFunctions();
        assertTrue(verifier.snapshot().loadedStructures().contains("Semigroup"));
        assertValid("(forall ((a Int)) (equals (square a) (mul a a)))");
    }

    @Test
    void equivalence() throws VerificationException {
        verifier("");
        assertTrue(verifier.areEquivalent(expr("(plus x y)"), expr("(plus y x)")));
        assertTrue(verifier.areEquivalent(expr("(times 2 x)"), expr("(plus x x)")));
        assertFalse(verifier.areEquivalent(expr("(plus x 1)"), expr("x")));
    }

    @Test
    void satisfiabilityGivesExample() throws VerificationException {
        verifier("");
        var s = assertInstanceOf(Satisfiability.Satisfiable.class, verifier.checkSatisfiability(expr("(equals (plus x 1) 3)")));
        assertEquals("2", s.example().value("x").orElseThrow());
        assertInstanceOf(Satisfiability.Unsatisfiable.class, verifier.checkSatisfiability(expr("(and (greater_than x 1) (less_than x 0))")));
    }

    @Test
    void simplifyFoldsGroundTerms() throws VerificationException {
        verifier("");
        assertEquals(new Expr.Const("7"), verifier.simplify(expr("(plus 1 (times 2 3))")));
        assertEquals(new Expr.Const("true"), verifier.simplify(expr("(less_than 1 2)")));
        assertEquals(new Expr.Const("-3"), verifier.simplify(expr("(minus 2 5)")));
    }

    @Test
    void disabledVerifier() throws VerificationException {
        verifier("", TEST_CONFIG.withEnabled(false));
        assertEquals(VerificationResult.DISABLED, verify("(equals 1 2)"));
        assertEquals(new Verifier.Stats(0, 0), verifier.stats());
    }

    @Test
    void resetForgetsLoadedStructures() throws VerificationException {
        verifier(ALGEBRA);
        assertValid("(forall ((x G)) (equals (mul (inv x) x) e))");
        assertEquals(3, verifier.stats().loadedStructures());
        verifier.reset();
        assertEquals(0, verifier.stats().loadedStructures());
        assertEquals(0, verifier.snapshot().backgroundFacts());
        assertValid("(forall ((x G)) (equals (mul (inv x) x) e))");
        assertEquals(3, verifier.stats().loadedStructures());
    }

    @Test
    void untypedOperationsWarn() throws VerificationException {
        verifier("");
        assertInvalid("(equals (mystery 1) 2)");
        assertTrue(verifier.warnings().stream().anyMatch(w -> w.contains("mystery")), () -> verifier.warnings().toString());
    }

    @Test
    void snapshotSerializes() throws VerificationException {
        verifier(ALGEBRA);
        assertValid("(forall ((x G)) (equals (inv x) (inv x)))");
        var json = Json.str(verifier.snapshot());
        assertTrue(json.contains("\"loadedStructures\""), json);
        assertTrue(json.contains("Semigroup"), json);
        assertTrue(Json.str(VerificationResult.VALID).contains("valid"));
    }

    @Test
    void capabilitiesAreExposed() throws VerificationException {
        verifier("");
        var caps = verifier.capabilities();
        assertNotNull(caps);
        assertTrue(caps.hasOperation("plus"));
        assertTrue(caps.capabilities().features().quantifiers());
    }
}
