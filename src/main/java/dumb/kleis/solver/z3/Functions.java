package dumb.kleis.solver.z3;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Uninterpreted function declarations, one per name and signature. Declarations made
 * since the last {@link #commit()} are dropped by {@link #rollback()}.
 */
final class Functions {

    private final Context ctx;
    private final Map<String, FuncDecl<Sort>> decls = new HashMap<>();
    private final Set<String> names = new LinkedHashSet<>();
    private final List<String> stagedKeys = new ArrayList<>();
    private final List<String> stagedNames = new ArrayList<>();

    Functions(Context ctx) {
        this.ctx = ctx;
    }

    FuncDecl<Sort> declare(String name, Sort[] domain, Sort range) {
        var key = name + Arrays.toString(domain) + "->" + range;
        return decls.computeIfAbsent(key, k -> {
            stagedKeys.add(k);
            if (names.add(name)) stagedNames.add(name);
            return ctx.mkFuncDecl(name, domain, range);
        });
    }

    Expr<Sort> apply(String name, Sort range, Expr<?>... args) {
        var domain = Arrays.stream(args).map(Expr::getSort).toArray(Sort[]::new);
        return declare(name, domain, range).apply(args);
    }

    Set<String> names() {
        return Set.copyOf(names);
    }

    void commit() {
        stagedKeys.clear();
        stagedNames.clear();
    }

    void rollback() {
        stagedKeys.forEach(decls::remove);
        stagedNames.forEach(names::remove);
        commit();
    }

    void clear() {
        decls.clear();
        names.clear();
        commit();
    }
}
