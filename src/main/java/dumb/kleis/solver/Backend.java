package dumb.kleis.solver;

import dumb.kleis.Decl.FunctionDef;
import dumb.kleis.Expr;
import dumb.kleis.TypeExpr;
import dumb.kleis.VerificationException;
import dumb.kleis.VerificationResult;

import java.util.List;
import java.util.Set;

/**
 * Solver seam of the verifier. A backend keeps a set of background facts; facts handed
 * to {@link #assume} or {@link #define} stay pending until {@link #commit()}, and
 * {@link #rollback()} discards them together with the constants and functions they
 * declared. Checks run in a scope that is popped afterwards, so
 * they never change the background.
 */
public interface Backend extends AutoCloseable {

    String name();

    Capabilities capabilities();

    /** Persistent constant for an element or identity of a structure. */
    void declareElement(String name, TypeExpr type) throws VerificationException;

    void assume(String label, Expr proposition) throws VerificationException;

    /** Declares the function and queues its defining axiom. */
    void define(FunctionDef function) throws VerificationException;

    /** Asserts the pending facts; returns how many there were. */
    int commit();

    void rollback();

    /** Satisfiability of the committed background alone. */
    Satisfiability consistency();

    VerificationResult verify(Expr goal) throws VerificationException;

    boolean equivalent(Expr a, Expr b) throws VerificationException;

    Satisfiability satisfiable(Expr e) throws VerificationException;

    /** Solver-simplified form of a ground expression. */
    Expr simplify(Expr e) throws VerificationException;

    /** Number of committed background facts. */
    int facts();

    Set<String> declaredOperations();

    List<String> warnings();

    /** Drops every background fact and declaration. */
    void reset();

    @Override
    void close();
}
