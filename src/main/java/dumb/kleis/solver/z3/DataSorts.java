package dumb.kleis.solver.z3;

import com.microsoft.z3.BoolSort;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import dumb.kleis.VerificationException;

import java.util.List;
import java.util.Optional;

/**
 * Algebraic data types visible to the translator: their sorts, constructors, testers
 * and field accessors.
 */
interface DataSorts {

    DataSorts NONE = new DataSorts() {
        @Override
        public Optional<DatatypeSort<?>> sort(String dataType) {
            return Optional.empty();
        }

        @Override
        public boolean isConstructor(String name) {
            return false;
        }

        @Override
        public int arity(String constructor) {
            return -1;
        }

        @Override
        public Expr<?> construct(String constructor, List<Expr<?>> args) throws VerificationException {
            throw VerificationException.translation("Undeclared constructor '" + constructor + "'");
        }

        @Override
        public Expr<BoolSort> test(String constructor, Expr<?> value) throws VerificationException {
            throw VerificationException.translation("Constructor pattern '" + constructor + "' refers to an undeclared data type");
        }

        @Override
        public Expr<?> field(String constructor, int index, Expr<?> value) throws VerificationException {
            throw VerificationException.translation("Constructor pattern '" + constructor + "' refers to an undeclared data type");
        }
    };

    Optional<DatatypeSort<?>> sort(String dataType);

    boolean isConstructor(String name);

    /** Number of fields of a constructor, or -1 when it is unknown. */
    int arity(String constructor);

    Expr<?> construct(String constructor, List<Expr<?>> args) throws VerificationException;

    /** {@code value} was built by {@code constructor}. */
    Expr<BoolSort> test(String constructor, Expr<?> value) throws VerificationException;

    /** Field {@code index} of a value built by {@code constructor}. */
    Expr<?> field(String constructor, int index, Expr<?> value) throws VerificationException;
}
