package dumb.kleis.solver;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.kleis.util.Json;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapabilitiesTest {

    @Test
    void z3Declaration() throws Exception {
        var c = Capabilities.load("z3");
        assertEquals("Z3", c.solver().name());
        assertEquals("smt", c.solver().type());
        assertTrue(c.hasTheory("Int"));
        assertTrue(c.hasTheory("Datatypes"));
        assertFalse(c.hasTheory("Strings"));

        var f = c.capabilities().features();
        assertTrue(f.quantifiers());
        assertTrue(f.uninterpretedFunctions());
        assertFalse(f.proofGeneration());
        assertEquals(10_000, c.capabilities().performance().maxAxioms());
    }

    @Test
    void nativeAndUninterpretedOperations() throws Exception {
        var c = Capabilities.load("z3");
        assertTrue(c.nativeOperations().contains("plus"));
        assertTrue(c.nativeOperations().contains("complex_mul"));
        assertFalse(c.nativeOperations().contains("sqrt"));
        assertTrue(c.allOperations().contains("sqrt"));

        var sqrt = c.operation("sqrt").orElseThrow();
        assertFalse(sqrt.nativeSupport());
        assertNotNull(sqrt.reason());
        assertEquals(1, sqrt.arity());
        assertTrue(c.operation("frobnicate").isEmpty());
    }

    @Test
    void missingDeclaration() {
        assertThrows(FileNotFoundException.class, () -> Capabilities.load("nonexistent"));
    }

    @Test
    void absentSectionsTakeDefaults() throws JsonProcessingException {
        var c = Json.obj("""
                {"solver": {"name": "Toy", "version": "0", "type": "smt", "description": "toy"},
                 "capabilities": {"operations": {"plus": {"arity": 2, "theory": "Int", "native": true}}}}
                """, Capabilities.class);
        assertEquals(Capabilities.Performance.DEFAULT_TIMEOUT_MS, c.capabilities().performance().timeoutMs());
        assertFalse(c.capabilities().features().quantifiers());
        assertTrue(c.capabilities().theories().isEmpty());
        assertEquals(List.of("plus"), c.nativeOperations());
    }
}
