package dumb.kleis;

import dumb.kleis.Decl.DataDef;
import dumb.kleis.Decl.FunctionDef;
import dumb.kleis.Decl.ImplementsDef;
import dumb.kleis.Decl.StructureDef;

import java.util.List;

/** Parsed program: declarations in source order. */
public record Program(List<Decl> decls) {

    public Program {
        decls = List.copyOf(decls);
    }

    public List<StructureDef> structures() {
        return only(StructureDef.class);
    }

    public List<ImplementsDef> implementations() {
        return only(ImplementsDef.class);
    }

    public List<FunctionDef> functions() {
        return only(FunctionDef.class);
    }

    public List<DataDef> dataTypes() {
        return only(DataDef.class);
    }

    private <D extends Decl> List<D> only(Class<D> type) {
        return decls.stream().filter(type::isInstance).map(type::cast).toList();
    }

    /** New registry holding every declaration of this program. */
    public Registry registry() throws VerificationException {
        var r = new Registry();
        r.register(this);
        return r;
    }
}
