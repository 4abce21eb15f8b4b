package dumb.kleis;

import dumb.kleis.SexpParser.ParseException;
import dumb.kleis.solver.Witness;
import org.junit.jupiter.api.AfterEach;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    /** Shorter timeout than the default so undecidable background checks give up quickly. */
    protected static final Config TEST_CONFIG = new Config().withTimeoutMs(3000);

    protected Registry registry;
    protected Verifier verifier;

    @AfterEach
    void tearDown() {
        if (verifier != null) verifier.close();
        verifier = null;
    }

    protected Verifier verifier(String program) throws VerificationException {
        return verifier(program, TEST_CONFIG);
    }

    protected Verifier verifier(String program, Config config) throws VerificationException {
        if (verifier != null) verifier.close();
        registry = program(program).registry();
        verifier = new Verifier(registry, config);
        return verifier;
    }

    protected static Program program(String text) {
        try {
            return ProgramReader.program(text);
        } catch (ParseException e) {
            return fail("Failed to parse program:\n" + text + "\n" + e.getMessage());
        }
    }

    protected static Expr expr(String text) {
        try {
            return ProgramReader.expr(text);
        } catch (ParseException e) {
            return fail("Failed to parse expression:\n" + text + "\n" + e.getMessage());
        }
    }

    protected VerificationResult verify(String goal) throws VerificationException {
        return verifier.verifyAxiom(expr(goal));
    }

    protected void assertValid(String goal) throws VerificationException {
        var r = verify(goal);
        assertEquals(VerificationResult.VALID, r, () -> "Expected " + goal + " to be valid, got " + r);
    }

    protected Witness assertInvalid(String goal) throws VerificationException {
        var r = verify(goal);
        return assertInstanceOf(VerificationResult.Invalid.class, r, () -> "Expected " + goal + " to be invalid, got " + r).counterexample();
    }

    protected VerificationException assertFails(VerificationException.Kind kind, String goal) {
        var e = assertThrows(VerificationException.class, () -> verify(goal));
        assertEquals(kind, e.kind(), e::getMessage);
        return e;
    }
}
