package info.isaksson.erland.swanmodel.parse;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.expr.Expression;
import info.isaksson.erland.swanmodel.types.AliasType;
import info.isaksson.erland.swanmodel.types.ArrayType;
import info.isaksson.erland.swanmodel.types.EnumTypeDefinition;
import info.isaksson.erland.swanmodel.types.ExprTypeDefinition;
import info.isaksson.erland.swanmodel.types.GroupTypeExpression;
import info.isaksson.erland.swanmodel.types.GroupTypeItem;
import info.isaksson.erland.swanmodel.types.GroupTypeList;
import info.isaksson.erland.swanmodel.types.PredefinedType;
import info.isaksson.erland.swanmodel.types.PredefinedTypeName;
import info.isaksson.erland.swanmodel.types.ProtectedTypeExpr;
import info.isaksson.erland.swanmodel.types.SizedType;
import info.isaksson.erland.swanmodel.types.StructField;
import info.isaksson.erland.swanmodel.types.StructType;
import info.isaksson.erland.swanmodel.types.TypeDefinition;
import info.isaksson.erland.swanmodel.types.TypeExpression;
import info.isaksson.erland.swanmodel.types.TypeGroupType;
import info.isaksson.erland.swanmodel.types.TypeVariable;
import info.isaksson.erland.swanmodel.types.VariantComponent;
import info.isaksson.erland.swanmodel.types.VariantTypeDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Type expressions, type definitions and group types. */
final class TypeParser {

    private final UnitParser unit;
    private final ParseContext ctx;

    TypeParser(UnitParser unit) {
        this.unit = unit;
        this.ctx = unit.context();
    }

    TypeExpression typeExpression() throws SwanSyntaxException {
        int s = ctx.peek().start();
        ctx.enter();
        try {
            TypeExpression type = baseType();
            while (ctx.acceptSymbol("^")) {
                Expression size = unit.expressions().size();
                type = new ArrayType(ctx.span(s), type, size);
            }
            return type;
        } finally {
            ctx.leave();
        }
    }

    private TypeExpression baseType() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Token t = ctx.peek();
        if (t.is(TokenKind.MARKUP)) {
            ctx.next();
            return new ProtectedTypeExpr(ctx.span(s), ctx.markup(t));
        }
        if (t.is(TokenKind.NAME)) {
            ctx.next();
            return new TypeVariable(ctx.span(s), Identifier.of(t.text()));
        }
        if (t.isWord("signed") || t.isWord("unsigned")) {
            ctx.next();
            ctx.expectSymbol("<<");
            Expression size = unit.expressions().expression();
            ctx.expectSymbol(">>");
            return new SizedType(ctx.span(s), t.text().equals("signed"), size);
        }
        if (t.isSymbol("{")) {
            ctx.next();
            List<StructField> fields = fields();
            ctx.expectSymbol("}");
            return new StructType(ctx.span(s), fields);
        }
        Optional<PredefinedTypeName> predefined = t.is(TokenKind.IDENT)
                ? PredefinedTypeName.fromKeyword(t.text()) : Optional.empty();
        if (predefined.isPresent()) {
            ctx.next();
            return new PredefinedType(ctx.span(s), predefined.get());
        }
        return new AliasType(ctx.span(s), ctx.path());
    }

    private List<StructField> fields() throws SwanSyntaxException {
        List<StructField> fields = new ArrayList<>();
        do {
            int s = ctx.peek().start();
            Identifier id = ctx.identifier();
            ctx.expectSymbol(":");
            TypeExpression type = typeExpression();
            fields.add(new StructField(ctx.span(s), id, type));
        } while (ctx.acceptSymbol(","));
        return fields;
    }

    /** Right hand side of {@code type T = ...}: an enumeration, a variant or a type expression. */
    TypeDefinition typeDefinition() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.acceptWord("enum")) {
            ctx.expectSymbol("{");
            List<Identifier> tags = new ArrayList<>();
            if (!ctx.atSymbol("}")) {
                do {
                    tags.add(ctx.identifier());
                } while (ctx.acceptSymbol(","));
            }
            ctx.expectSymbol("}");
            return new EnumTypeDefinition(ctx.span(s), tags);
        }
        if (ctx.atIdentifier() && ctx.peek(1).isSymbol("{")) {
            List<VariantComponent> components = new ArrayList<>();
            do {
                components.add(variantComponent());
            } while (ctx.acceptSymbol("|"));
            return new VariantTypeDefinition(ctx.span(s), components);
        }
        TypeExpression type = typeExpression();
        return new ExprTypeDefinition(ctx.span(s), type);
    }

    private VariantComponent variantComponent() throws SwanSyntaxException {
        int s = ctx.peek().start();
        Identifier tag = ctx.identifier();
        int bs = ctx.expectSymbol("{").start();
        TypeExpression type = null;
        if (ctx.atIdentifier() && ctx.peek(1).isSymbol(":")) {
            List<StructField> fields = fields();
            ctx.expectSymbol("}");
            type = new StructType(ctx.span(bs), fields);
        } else if (!ctx.acceptSymbol("}")) {
            type = typeExpression();
            ctx.expectSymbol("}");
        }
        return new VariantComponent(ctx.span(s), tag, type);
    }

    GroupTypeExpression groupType() throws SwanSyntaxException {
        int s = ctx.peek().start();
        if (ctx.acceptSymbol("(")) {
            List<GroupTypeItem> items = new ArrayList<>();
            boolean named = false;
            if (!ctx.atSymbol(")")) {
                do {
                    int is = ctx.peek().start();
                    Identifier label = null;
                    if (ctx.atIdentifier() && ctx.peek(1).isSymbol(":")) {
                        label = ctx.identifier();
                        ctx.next();
                        named = true;
                    } else if (named) {
                        throw ctx.error("positional group item after a named one");
                    }
                    GroupTypeExpression type;
                    ctx.enter();
                    try {
                        type = groupType();
                    } finally {
                        ctx.leave();
                    }
                    items.add(new GroupTypeItem(ctx.span(is), label, type));
                } while (ctx.acceptSymbol(","));
            }
            ctx.expectSymbol(")");
            return new GroupTypeList(ctx.span(s), items);
        }
        TypeExpression type = typeExpression();
        return new TypeGroupType(ctx.span(s), type);
    }
}
