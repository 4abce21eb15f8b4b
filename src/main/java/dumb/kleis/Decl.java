package dumb.kleis;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/** Top-level declarations of a program. */
sealed public interface Decl permits Decl.StructureDef, Decl.ImplementsDef, Decl.FunctionDef, Decl.DataDef, Decl.OperationDecl {

    String name();

    record TypeParam(String name, @Nullable String kind) {
        public TypeParam {
            requireNonNull(name);
        }

        public static TypeParam of(String name) {
            return new TypeParam(name, null);
        }
    }

    /** Reference to a structure applied to type arguments: {@code Ring(R)}. */
    record StructureRef(String structureName, List<TypeExpr> typeArgs) {
        public StructureRef {
            requireNonNull(structureName);
            typeArgs = List.copyOf(typeArgs);
        }

        public static StructureRef of(String structureName, TypeExpr... typeArgs) {
            return new StructureRef(structureName, List.of(typeArgs));
        }
    }

    sealed interface Member permits Member.Operation, Member.Element, Member.Axiom, Member.Nested, Member.Define {

        record Operation(String name, TypeExpr signature) implements Member {
            public Operation {
                requireNonNull(name);
                requireNonNull(signature);
            }

            /** Operations whose signature is not a function type denote constants. */
            public boolean nullary() {
                return !(signature instanceof TypeExpr.Function f) || f.arguments().isEmpty();
            }
        }

        record Element(String name, TypeExpr type) implements Member {
            public Element {
                requireNonNull(name);
                requireNonNull(type);
            }
        }

        record Axiom(String name, Expr proposition) implements Member {
            public Axiom {
                requireNonNull(name);
                requireNonNull(proposition);
            }
        }

        record Nested(String name, TypeExpr type, List<Member> members) implements Member {
            public Nested {
                requireNonNull(name);
                requireNonNull(type);
                members = List.copyOf(members);
            }
        }

        record Define(FunctionDef function) implements Member {
            public Define {
                requireNonNull(function);
            }
        }
    }

    record StructureDef(String name,
                        List<TypeParam> typeParams,
                        List<Member> members,
                        @Nullable StructureRef extendsClause,
                        @Nullable StructureRef overClause) implements Decl {
        public StructureDef {
            requireNonNull(name);
            typeParams = List.copyOf(typeParams);
            members = List.copyOf(members);
        }

        public StructureDef(String name, List<TypeParam> typeParams, List<Member> members) {
            this(name, typeParams, members, null, null);
        }

        public Optional<StructureRef> parent() {
            return Optional.ofNullable(extendsClause);
        }

        public Optional<StructureRef> over() {
            return Optional.ofNullable(overClause);
        }

        /** Every member, nested structure members included, depth first. */
        public Stream<Member> allMembers() {
            return members.stream().flatMap(StructureDef::flatten);
        }

        private static Stream<Member> flatten(Member m) {
            return m instanceof Member.Nested n
                    ? Stream.concat(Stream.of(m), n.members().stream().flatMap(StructureDef::flatten))
                    : Stream.of(m);
        }
    }

    sealed interface ImplMember permits ImplMember.ElementBinding, ImplMember.OperationBinding {

        record ElementBinding(String name, Expr value) implements ImplMember {
            public ElementBinding {
                requireNonNull(name);
                requireNonNull(value);
            }
        }

        /** Binds an operation either to a builtin by name or to an inline body. */
        record OperationBinding(String name, @Nullable String builtin, List<Param> params, @Nullable Expr body) implements ImplMember {
            public OperationBinding {
                requireNonNull(name);
                params = List.copyOf(params);
                if ((builtin == null) == (body == null))
                    throw new IllegalArgumentException("Operation binding '" + name + "' needs exactly one of builtin or body");
            }
        }
    }

    record ImplementsDef(String structureName,
                         List<TypeExpr> typeArgs,
                         List<ImplMember> members,
                         List<StructureRef> whereClause) implements Decl {
        public ImplementsDef {
            requireNonNull(structureName);
            typeArgs = List.copyOf(typeArgs);
            members = List.copyOf(members);
            whereClause = List.copyOf(whereClause);
        }

        @Override
        public String name() {
            return structureName;
        }
    }

    record Param(String name, @Nullable String type) {
        public Param {
            requireNonNull(name);
        }

        public static Param of(String name) {
            return new Param(name, null);
        }
    }

    record FunctionDef(String name, List<Param> params, Expr body) implements Decl {
        public FunctionDef {
            requireNonNull(name);
            params = List.copyOf(params);
            requireNonNull(body);
        }
    }

    record Field(String name, TypeExpr type) {
        public Field {
            requireNonNull(name);
            requireNonNull(type);
        }
    }

    record Variant(String name, List<Field> fields) {
        public Variant {
            requireNonNull(name);
            fields = List.copyOf(fields);
        }
    }

    record DataDef(String name, List<TypeParam> typeParams, List<Variant> variants) implements Decl {
        public DataDef {
            requireNonNull(name);
            typeParams = List.copyOf(typeParams);
            variants = List.copyOf(variants);
            if (variants.isEmpty()) throw new IllegalArgumentException("Data type '" + name + "' has no variants");
        }

        public Optional<Variant> variant(String constructor) {
            return variants.stream().filter(v -> v.name().equals(constructor)).findFirst();
        }
    }

    record OperationDecl(String name, TypeExpr signature) implements Decl {
        public OperationDecl {
            requireNonNull(name);
            requireNonNull(signature);
        }
    }
}
