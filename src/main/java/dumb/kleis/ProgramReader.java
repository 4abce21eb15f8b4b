package dumb.kleis;

import dumb.kleis.Decl.DataDef;
import dumb.kleis.Decl.Field;
import dumb.kleis.Decl.FunctionDef;
import dumb.kleis.Decl.ImplMember;
import dumb.kleis.Decl.ImplementsDef;
import dumb.kleis.Decl.Member;
import dumb.kleis.Decl.OperationDecl;
import dumb.kleis.Decl.Param;
import dumb.kleis.Decl.StructureDef;
import dumb.kleis.Decl.StructureRef;
import dumb.kleis.Decl.TypeParam;
import dumb.kleis.Decl.Variant;
import dumb.kleis.SexpParser.ParseException;
import dumb.kleis.Sexp.Atom;
import dumb.kleis.Sexp.Lst;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds expressions, types, patterns and declarations from s-expressions.
 * <pre>
 * (structure Monoid (M)
 *   (operation op (-> M M M))
 *   (element e M)
 *   (axiom identity (forall ((x M)) (equals (op x e) x))))
 * </pre>
 */
public final class ProgramReader {

    private static final java.util.regex.Pattern NUMBER = java.util.regex.Pattern.compile("-?\\d+(\\.\\d+)?|-?\\d+/\\d+");

    private ProgramReader() {
    }

    public static Program program(String text) throws ParseException {
        var decls = new ArrayList<Decl>();
        for (var s : SexpParser.parse(text)) decls.add(decl(s));
        return new Program(decls);
    }

    /** Exactly one expression. */
    public static Expr expr(String text) throws ParseException {
        var items = SexpParser.parse(text);
        if (items.size() != 1)
            throw new ParseException("Expected one expression, found " + items.size() + " in: " + text);
        return expr(items.get(0));
    }

    public static Expr expr(Sexp s) throws ParseException {
        if (s instanceof Atom a) {
            if (a.quoted()) throw error(s, "String literals are not expressions");
            return literal(a.value()) ? new Expr.Const(a.value()) : new Expr.Obj(a.value());
        }
        var l = (Lst) s;
        var head = l.op().orElseThrow(() -> error(s, "Expression must start with an operator name"));
        switch (head) {
            case "forall":
                return quantifier(l, Expr.Quantifier.FORALL);
            case "exists":
                return quantifier(l, Expr.Quantifier.EXISTS);
            case "if":
                arity(l, 4);
                return new Expr.Cond(expr(l.get(1)), expr(l.get(2)), expr(l.get(3)));
            case "let":
                arity(l, 4);
                return new Expr.Let(symbol(l.get(1)), expr(l.get(2)), expr(l.get(3)));
            case "match":
                return match(l);
            case "list":
                return new Expr.Lst(exprs(l.tail()));
            default:
                return new Expr.Op(head, exprs(l.tail()));
        }
    }

    private static List<Expr> exprs(List<Sexp> items) throws ParseException {
        var out = new ArrayList<Expr>(items.size());
        for (var i : items) out.add(expr(i));
        return out;
    }

    static boolean literal(String v) {
        return v.equals("true") || v.equals("false") || NUMBER.matcher(v).matches();
    }

    /** {@code (forall ((x T) y) [(where guard)] body)} */
    private static Expr quantifier(Lst l, Expr.Quantifier kind) throws ParseException {
        if (l.size() != 3 && l.size() != 4) throw error(l, kind.symbol + " takes variables, an optional where clause and a body");
        var vars = new ArrayList<Expr.QuantVar>();
        if (l.get(1) instanceof Lst vs) {
            for (var v : vs.items()) {
                if (v instanceof Lst typed) {
                    arity(typed, 2);
                    vars.add(Expr.QuantVar.of(symbol(typed.get(0)), typeName(typed.get(1))));
                } else {
                    vars.add(Expr.QuantVar.of(symbol(v)));
                }
            }
        } else {
            vars.add(Expr.QuantVar.of(symbol(l.get(1))));
        }
        Expr where = null;
        if (l.size() == 4) {
            if (!(l.get(2) instanceof Lst w) || !w.op().filter("where"::equals).isPresent() || w.size() != 2)
                throw error(l.get(2), "Expected (where guard)");
            where = expr(w.get(1));
        }
        return new Expr.Quant(kind, vars, where, expr(l.get(l.size() - 1)));
    }

    private static Expr match(Lst l) throws ParseException {
        if (l.size() < 3) throw error(l, "match needs a scrutinee and at least one case");
        var cases = new ArrayList<Expr.Case>();
        for (var c : l.items().subList(2, l.size())) {
            if (!(c instanceof Lst arm) || arm.size() != 2) throw error(c, "Expected (pattern body)");
            cases.add(new Expr.Case(pattern(arm.get(0)), expr(arm.get(1))));
        }
        return new Expr.Match(expr(l.get(1)), cases);
    }

    public static Pattern pattern(Sexp s) throws ParseException {
        if (s instanceof Atom a) {
            if (a.value().equals("_")) return Pattern.ANY;
            if (a.quoted() || literal(a.value())) return new Pattern.Constant(a.value());
            return new Pattern.Variable(a.value());
        }
        var l = (Lst) s;
        var name = l.op().orElseThrow(() -> error(s, "Constructor pattern must start with a constructor name"));
        var args = new ArrayList<Pattern>();
        for (var p : l.tail()) args.add(pattern(p));
        return new Pattern.Constructor(name, args);
    }

    public static TypeExpr type(Sexp s) throws ParseException {
        if (s instanceof Atom a) return TypeExpr.named(a.value());
        var l = (Lst) s;
        var head = l.op().orElseThrow(() -> error(s, "Type must start with a name"));
        var args = new ArrayList<TypeExpr>();
        for (var t : l.tail()) args.add(type(t));
        switch (head) {
            case "->":
                if (args.isEmpty()) throw error(s, "Function type needs a result");
                return new TypeExpr.Function(args.subList(0, args.size() - 1), args.get(args.size() - 1));
            case "*":
                return new TypeExpr.Product(args);
            default:
                return new TypeExpr.Parametric(head, args);
        }
    }

    /** Annotation text of a quantified variable or parameter. */
    private static String typeName(Sexp s) throws ParseException {
        return s instanceof Atom a ? a.value() : type(s).head();
    }

    public static Decl decl(Sexp s) throws ParseException {
        if (!(s instanceof Lst l)) throw error(s, "Expected a declaration");
        var head = l.op().orElseThrow(() -> error(s, "Declaration must start with a keyword"));
        switch (head) {
            case "structure":
                return structure(l);
            case "implements":
                return implementation(l);
            case "define":
                return function(l);
            case "data":
                return data(l);
            case "operation":
                arity(l, 3);
                return new OperationDecl(symbol(l.get(1)), type(l.get(2)));
            default:
                throw error(s, "Unknown declaration '" + head + "'");
        }
    }

    private static StructureDef structure(Lst l) throws ParseException {
        if (l.size() < 3) throw error(l, "structure needs a name and a parameter list");
        var name = symbol(l.get(1));
        var params = typeParams(l.get(2));
        StructureRef parent = null, over = null;
        var members = new ArrayList<Member>();
        for (var m : l.items().subList(3, l.size())) {
            var ml = list(m);
            var kw = ml.op().orElse("");
            if (kw.equals("extends")) parent = ref(ml.tail());
            else if (kw.equals("over")) over = ref(ml.tail());
            else members.add(member(ml));
        }
        return new StructureDef(name, params, members, parent, over);
    }

    private static Member member(Lst m) throws ParseException {
        var kw = m.op().orElseThrow(() -> error(m, "Member must start with a keyword"));
        switch (kw) {
            case "operation":
                arity(m, 3);
                return new Member.Operation(symbol(m.get(1)), type(m.get(2)));
            case "element":
                arity(m, 3);
                return new Member.Element(symbol(m.get(1)), type(m.get(2)));
            case "axiom":
                arity(m, 3);
                return new Member.Axiom(symbol(m.get(1)), expr(m.get(2)));
            case "define":
                return new Member.Define(function(m));
            case "nested":
                if (m.size() < 3) throw error(m, "nested needs a name and a type");
                var members = new ArrayList<Member>();
                for (var n : m.items().subList(3, m.size())) members.add(member(list(n)));
                return new Member.Nested(symbol(m.get(1)), type(m.get(2)), members);
            default:
                throw error(m, "Unknown structure member '" + kw + "'");
        }
    }

    private static StructureRef ref(List<Sexp> items) throws ParseException {
        if (items.isEmpty()) throw new ParseException("Missing structure name");
        var args = new ArrayList<TypeExpr>();
        for (var t : items.subList(1, items.size())) args.add(type(t));
        return new StructureRef(symbol(items.get(0)), args);
    }

    private static ImplementsDef implementation(Lst l) throws ParseException {
        if (l.size() < 3) throw error(l, "implements needs a structure name and type arguments");
        var args = new ArrayList<TypeExpr>();
        for (var t : list(l.get(2)).items()) args.add(type(t));
        var where = new ArrayList<StructureRef>();
        var members = new ArrayList<ImplMember>();
        for (var c : l.items().subList(3, l.size())) {
            var cl = list(c);
            var kw = cl.op().orElse("");
            switch (kw) {
                case "where":
                    for (var w : cl.tail()) where.add(ref(list(w).items()));
                    break;
                case "element":
                    arity(cl, 3);
                    members.add(new ImplMember.ElementBinding(symbol(cl.get(1)), expr(cl.get(2))));
                    break;
                case "operation":
                    if (cl.size() == 3)
                        members.add(new ImplMember.OperationBinding(symbol(cl.get(1)), symbol(cl.get(2)), List.of(), null));
                    else if (cl.size() == 4)
                        members.add(new ImplMember.OperationBinding(symbol(cl.get(1)), null, params(cl.get(2)), expr(cl.get(3))));
                    else throw error(cl, "Expected (operation name builtin) or (operation name (params) body)");
                    break;
                default:
                    throw error(cl, "Unknown implements clause '" + kw + "'");
            }
        }
        return new ImplementsDef(symbol(l.get(1)), args, members, where);
    }

    /** {@code (define f (x (y Real)) body)} */
    private static FunctionDef function(Lst l) throws ParseException {
        arity(l, 4);
        return new FunctionDef(symbol(l.get(1)), params(l.get(2)), expr(l.get(3)));
    }

    private static List<Param> params(Sexp s) throws ParseException {
        var out = new ArrayList<Param>();
        for (var p : list(s).items()) {
            if (p instanceof Lst typed) {
                arity(typed, 2);
                out.add(new Param(symbol(typed.get(0)), typeName(typed.get(1))));
            } else {
                out.add(Param.of(symbol(p)));
            }
        }
        return out;
    }

    private static DataDef data(Lst l) throws ParseException {
        if (l.size() < 4) throw error(l, "data needs a name, a parameter list and at least one variant");
        var variants = new ArrayList<Variant>();
        for (var v : l.items().subList(3, l.size())) {
            if (v instanceof Atom a) {
                variants.add(new Variant(a.value(), List.of()));
                continue;
            }
            var vl = (Lst) v;
            var fields = new ArrayList<Field>();
            var k = 0;
            for (var f : vl.tail()) {
                if (f instanceof Lst fl && fl.size() == 2 && fl.get(0) instanceof Atom)
                    fields.add(new Field(symbol(fl.get(0)), type(fl.get(1))));
                else
                    fields.add(new Field("_" + k, type(f)));
                k++;
            }
            variants.add(new Variant(symbol(vl.get(0)), fields));
        }
        return new DataDef(symbol(l.get(1)), typeParams(l.get(2)), variants);
    }

    private static List<TypeParam> typeParams(Sexp s) throws ParseException {
        var out = new ArrayList<TypeParam>();
        for (var p : list(s).items()) {
            if (p instanceof Lst kinded) {
                arity(kinded, 2);
                out.add(new TypeParam(symbol(kinded.get(0)), symbol(kinded.get(1))));
            } else {
                out.add(TypeParam.of(symbol(p)));
            }
        }
        return out;
    }

    private static Lst list(Sexp s) throws ParseException {
        if (s instanceof Lst l) return l;
        throw error(s, "Expected a list, found '" + s.toSexp() + "'");
    }

    private static String symbol(Sexp s) throws ParseException {
        if (s instanceof Atom a && !a.quoted()) return a.value();
        throw error(s, "Expected a name, found '" + s.toSexp() + "'");
    }

    private static void arity(Lst l, int size) throws ParseException {
        if (l.size() != size)
            throw error(l, "'" + l.op().orElse("?") + "' expects " + (size - 1) + " arguments, found " + (l.size() - 1));
    }

    private static ParseException error(Sexp at, String message) {
        return new ParseException(message, at.line(), -1, at.toSexp());
    }
}
