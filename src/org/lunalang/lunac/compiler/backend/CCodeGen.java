
package org.lunalang.lunac.compiler.backend;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;

public class CCodeGen implements CodeGen {

    public static final String DEFAULT_INDENT = "    ";

    private static final String LOCAL = "local";
    private static final String MUTABLE = "var";
    // only ascending inclusive loops for now
    private static final String FOR_COMPARATOR = "le";

    private final Traverser traverser;
    private final Map<String, CType> primitiveTypes;
    private final Map<String, BuiltIns.Materializer> materializers;
    private final Map<String, BuiltInCalls.Specializer> specializers;
    private final String indent;

    public CCodeGen() {
        this(DEFAULT_INDENT);
    }

    public CCodeGen(String indent) {
        this.traverser = new Traverser();
        this.primitiveTypes = PrimitiveTypes.C_TYPES;
        this.materializers = BuiltIns.materializers();
        this.specializers = BuiltInCalls.specializers();
        this.indent = indent;
        this.addLiterals();
        this.addExpressions();
        this.addStatements();
        this.addDeclarations();
        this.addOperators();
    }


    /**
     * Replaces the handler for the given node type.
     */
    public Optional<Traverser.Handler> register(
        AstNode.Type type, Traverser.Handler handler
    ) {
        return this.traverser.register(type, handler);
    }


    public void registerBuiltInCall(
        String name, BuiltInCalls.Specializer specializer
    ) {
        this.specializers.put(name, specializer);
    }


    public void registerBuiltIn(
        String name, BuiltIns.Materializer materializer
    ) {
        this.materializers.put(name, materializer);
    }


    @Override
    public String generate(AstNode root) throws ErrorException {
        root.check(
            root.type == AstNode.Type.BLOCK,
            "The root of a program must be a block"
        );
        GeneratorContext context = new GeneratorContext(
            this.traverser, this.primitiveTypes, this.materializers,
            this.indent
        );
        context.traverse(root, context.main());
        return context.assemble();
    }


    private void addLiterals() {
        this.traverser.register(AstNode.Type.NUMBER, (ctx, node, out, s) -> {
            AstNode.NumberLiteral data = node.getValue();
            String value = NumericLiterals.spelling(node);
            if(data.suffix().isEmpty()) {
                out.add(value);
                return;
            }
            String typeName = NumericLiterals.canonicalType(node);
            CType type = ctx.getCType(node, typeName);
            out.add("((", type.spelling(), ") ", value, ")");
        });
        this.traverser.register(AstNode.Type.STRING, (ctx, node, out, s) -> {
            AstNode.StringLiteral data = node.getValue();
            node.check(
                data.suffix().isEmpty(),
                "String literal suffixes are not supported yet"
            );
            ctx.addBuiltIn(node, BuiltIns.STRING);
            String name = ctx.uniqueName("__luna_string_literal_", node);
            if(ctx.declareGlobal(name, node)) {
                int length = data.value()
                    .getBytes(StandardCharsets.UTF_8).length;
                Sink declarations = ctx.declarations();
                declarations.addIndentLn(
                    "static const struct { uintptr_t len, res; char data[",
                    length + 1, "]; }"
                );
                declarations
                    .addIndent("  ", name, " = {", length, ", ", length, ", ")
                    .addDoubleQuoted(data.value())
                    .addLn("};");
            }
            out.add("((", BuiltIns.STRING, "*) &", name, ")");
        });
        this.traverser.register(AstNode.Type.BOOLEAN, (ctx, node, out, s) -> {
            AstNode.BooleanLiteral data = node.getValue();
            ctx.addInclude("<stdbool.h>");
            out.add(data.value()? "true" : "false");
        });
    }


    private void addExpressions() {
        this.traverser.register(AstNode.Type.ID, (ctx, node, out, s) -> {
            AstNode.Name data = node.getValue();
            out.add(data.name());
        });
        this.traverser.register(AstNode.Type.PAREN, (ctx, node, out, s) -> {
            AstNode.Paren data = node.getValue();
            out.add("(", data.value(), ")");
        });
        this.traverser.register(AstNode.Type.TYPE, (ctx, node, out, s) -> {
            AstNode.Name data = node.getValue();
            out.add(ctx.getCType(node, data.name()).spelling());
        });
        this.traverser.register(AstNode.Type.TYPED_ID, (ctx, node, out, s) -> {
            AstNode.TypedId data = node.getValue();
            if(data.type().isPresent()) {
                out.add(data.type().get(), " ", data.name());
            } else {
                out.add(data.name());
            }
        });
        this.traverser.register(AstNode.Type.DOT_INDEX, (ctx, node, out, s) -> {
            AstNode.DotIndex data = node.getValue();
            out.add(data.accessed(), ".", data.name());
        });
        this.traverser.register(
            AstNode.Type.ARRAY_INDEX, (ctx, node, out, s) -> {
                AstNode.ArrayIndex data = node.getValue();
                out.add(data.accessed(), "[", data.index(), "]");
            }
        );
        this.traverser.register(AstNode.Type.CALL, (ctx, node, out, s) -> {
            AstNode.Call data = node.getValue();
            if(data.isStatement()) {
                out.addIndent();
            }
            BuiltInCalls.Specializer builtIn = null;
            if(data.called().type == AstNode.Type.ID) {
                AstNode.Name called = data.called().getValue();
                builtIn = this.specializers.get(called.name());
            }
            if(builtIn != null) {
                builtIn.generate(ctx, node, out);
            } else {
                out.add(data.called(), "(", data.arguments(), ")");
            }
            if(data.isStatement()) {
                out.addLn(";");
            }
        });
        this.traverser.register(
            AstNode.Type.METHOD_CALL, (ctx, node, out, s) -> {
                AstNode.MethodCall data = node.getValue();
                if(data.isStatement()) {
                    out.addIndent();
                }
                out.add(data.called(), ".", data.name(), "(", data.called());
                if(!data.arguments().isEmpty()) {
                    out.add(", ", data.arguments());
                }
                out.add(")");
                if(data.isStatement()) {
                    out.addLn(";");
                }
            }
        );
    }


    private void addStatements() {
        this.traverser.register(AstNode.Type.BLOCK, this::generateBlock);
        this.traverser.register(AstNode.Type.RETURN, this::generateReturn);
        this.traverser.register(AstNode.Type.IF, (ctx, node, out, s) -> {
            AstNode.If data = node.getValue();
            node.check(
                !data.branches().isEmpty(),
                "If statements must have at least one branch"
            );
            for(int branchI = 0; branchI < data.branches().size(); branchI += 1) {
                AstNode.IfBranch branch = data.branches().get(branchI);
                out.addIndentLn(
                    branchI == 0? "if(" : "} else if(",
                    branch.condition(), ") {"
                );
                out.add(branch.body());
            }
            if(data.elseBody().isPresent()) {
                out.addIndentLn("} else {");
                out.add(data.elseBody().get());
            }
            out.addIndentLn("}");
        });
        this.traverser.register(AstNode.Type.SWITCH, (ctx, node, out, s) -> {
            AstNode.Switch data = node.getValue();
            node.check(
                !data.cases().isEmpty(),
                "Switch statements must have at least one case"
            );
            out.addIndentLn("switch(", data.value(), ") {");
            out.incIndent();
            for(AstNode.SwitchCase switchCase: data.cases()) {
                out.addIndentLn("case ", switchCase.value(), ": {");
                this.emitSwitchArm(switchCase.body(), out);
            }
            if(data.elseBody().isPresent()) {
                out.addIndentLn("default: {");
                this.emitSwitchArm(data.elseBody().get(), out);
            }
            out.decIndent();
            out.addIndentLn("}");
        });
        this.traverser.register(AstNode.Type.DO, (ctx, node, out, s) -> {
            AstNode.Do data = node.getValue();
            out.addIndentLn("{");
            out.add(data.body());
            out.addIndentLn("}");
        });
        this.traverser.register(AstNode.Type.WHILE, (ctx, node, out, s) -> {
            AstNode.While data = node.getValue();
            out.addIndentLn("while(", data.condition(), ") {");
            out.add(data.body());
            out.addIndentLn("}");
        });
        this.traverser.register(AstNode.Type.REPEAT, (ctx, node, out, s) -> {
            AstNode.Repeat data = node.getValue();
            out.addIndentLn("do {");
            out.add(data.body());
            out.addIndentLn("} while(!(", data.condition(), "));");
        });
        this.traverser.register(AstNode.Type.FOR_NUM, this::generateNumericFor);
        this.traverser.register(AstNode.Type.BREAK, (ctx, node, out, s) -> {
            out.addIndentLn("break;");
        });
        this.traverser.register(AstNode.Type.CONTINUE, (ctx, node, out, s) -> {
            out.addIndentLn("continue;");
        });
        this.traverser.register(AstNode.Type.LABEL, (ctx, node, out, s) -> {
            AstNode.Name data = node.getValue();
            out.addIndentLn(data.name(), ":");
        });
        this.traverser.register(AstNode.Type.GOTO, (ctx, node, out, s) -> {
            AstNode.Name data = node.getValue();
            out.addIndentLn("goto ", data.name(), ";");
        });
        this.traverser.register(AstNode.Type.ASSIGN, (ctx, node, out, s) -> {
            AstNode.Assignment data = node.getValue();
            node.check(
                data.targets().size() == data.values().size(),
                "Assigned variable and value counts differ"
            );
            out.addIndent();
            for(int varI = 0; varI < data.targets().size(); varI += 1) {
                if(varI > 0) {
                    out.add(" ");
                }
                out.add(
                    data.targets().get(varI), " = ", data.values().get(varI),
                    ";"
                );
            }
            out.addLn();
        });
    }


    private void emitSwitchArm(AstNode body, Sink out) throws ErrorException {
        out.add(body);
        out.incIndent();
        out.addIndentLn("break;");
        out.decIndent();
        out.addIndentLn("}");
    }


    private void generateBlock(
        GeneratorContext context, AstNode node, Sink out,
        Optional<GeneratorContext.Scope> scope
    ) throws ErrorException {
        AstNode.Block data = node.getValue();
        boolean isTop = scope.isEmpty();
        if(isTop) {
            out.addIndentLn("int main() {");
        }
        out.incIndent();
        GeneratorContext.Scope inner = context.pushScope();
        for(AstNode statement: data.statements()) {
            context.traverse(statement, out);
        }
        if(inner.isMain() && !inner.hasReturn()) {
            // main() must always return an integer
            out.addIndentLn("return 0;");
        }
        context.popScope();
        out.decIndent();
        if(isTop) {
            out.addIndentLn("}");
        }
    }


    private void generateReturn(
        GeneratorContext context, AstNode node, Sink out,
        Optional<GeneratorContext.Scope> scope
    ) throws ErrorException {
        AstNode.Return data = node.getValue();
        node.check(
            data.values().size() <= 1,
            "Multiple return values are not supported yet"
        );
        node.check(scope.isPresent(), "Return statement outside of a block");
        scope.get().markReturn();
        out.addIndent("return");
        if(!data.values().isEmpty()) {
            out.addLn(" ", data.values().get(0), ";");
            return;
        }
        if(context.isInMainFunction()) {
            out.add(" 0");
        }
        out.addLn(";");
    }


    private void generateNumericFor(
        GeneratorContext context, AstNode node, Sink out,
        Optional<GeneratorContext.Scope> scope
    ) throws ErrorException {
        AstNode.NumericFor data = node.getValue();
        node.check(
            FOR_COMPARATOR.equals(data.comparator()),
            "For loop comparator '" + data.comparator()
                + "' is not supported yet"
        );
        node.check(
            data.variable().type == AstNode.Type.TYPED_ID,
            "The variable of a for loop must be an identifier"
        );
        AstNode.TypedId variable = data.variable().getValue();
        String name = variable.name();
        out.addIndent(
            "for(", data.variable(), " = ", data.begin(), "; ",
            name, " <= ", data.end(), "; "
        );
        if(data.step().isPresent()) {
            out.add(name, " += ", data.step().get());
        } else {
            out.add("++", name);
        }
        out.addLn(") {");
        out.add(data.body());
        out.addIndentLn("}");
    }


    private void addDeclarations() {
        this.traverser.register(AstNode.Type.VAR_DECL, (ctx, node, out, s) -> {
            AstNode.VariableDeclaration data = node.getValue();
            node.check(
                data.scope().equals(LOCAL),
                "Global variables are not supported yet"
            );
            node.check(
                data.mutability().equals(MUTABLE),
                "Variable mutability '" + data.mutability()
                    + "' is not supported yet"
            );
            node.check(
                data.values().isEmpty()
                    || data.values().get().size() == data.variables().size(),
                "Declared variable and value counts differ"
            );
            out.addIndent();
            for(int varI = 0; varI < data.variables().size(); varI += 1) {
                if(varI > 0) {
                    out.add(" ");
                }
                out.add(data.variables().get(varI));
                if(data.values().isPresent()) {
                    out.add(" = ", data.values().get().get(varI));
                }
                out.add(";");
            }
            out.addLn();
        });
        this.traverser.register(AstNode.Type.FUNC_ARG, (ctx, node, out, s) -> {
            AstNode.FunctionArgument data = node.getValue();
            node.check(
                data.mutability().isEmpty()
                    || data.mutability().get().equals(MUTABLE),
                "Argument mutability '" + data.mutability().orElse("")
                    + "' is not supported yet"
            );
            out.add(data.type(), " ", data.name());
        });
        this.traverser.register(
            AstNode.Type.FUNC_DEF, this::generateFunctionDefinition
        );
    }


    private void generateFunctionDefinition(
        GeneratorContext context, AstNode node, Sink out,
        Optional<GeneratorContext.Scope> scope
    ) throws ErrorException {
        AstNode.FunctionDefinition data = node.getValue();
        node.check(
            data.returnTypes().size() <= 1,
            "Multiple return values are not supported yet"
        );
        node.check(
            data.scope().equals(LOCAL),
            "Global functions are not supported yet"
        );
        Sink heading = context.newSink();
        List<AstNode> returnTypes = data.returnTypes();
        if(returnTypes.isEmpty()) {
            heading.add("void ");
        } else {
            AstNode returnType = returnTypes.get(0);
            returnType.check(
                returnType.type == AstNode.Type.TYPE,
                "Function return types must be type names"
            );
            heading.add(returnType, " ");
        }
        heading.add(data.name(), "(");
        if(data.arguments().isEmpty()) {
            heading.add("void");
        } else {
            heading.add(data.arguments());
        }
        heading.add(")");
        context.declarations().addIndentLn(heading.generate(), ";");
        // rendered separately so that nested definitions do not interleave
        Sink definition = context.newSink();
        definition.addLn(heading.generate(), " {");
        context.enterFunction();
        definition.add(data.body());
        context.exitFunction();
        definition.addLn("}");
        context.definitions().add(definition.generate());
    }


    private void addOperators() {
        this.traverser.register(AstNode.Type.UNARY_OP, (ctx, node, out, s) -> {
            AstNode.UnaryOp data = node.getValue();
            String op = Operators.unary(node, data.operator());
            boolean surround = Operators.needsParentheses(ctx);
            if(surround) { out.add("("); }
            out.add(op, data.value());
            if(surround) { out.add(")"); }
        });
        this.traverser.register(AstNode.Type.BINARY_OP, (ctx, node, out, s) -> {
            AstNode.BinaryOp data = node.getValue();
            String op = Operators.binary(node, data.operator());
            boolean surround = Operators.needsParentheses(ctx);
            if(surround) { out.add("("); }
            out.add(data.left(), " ", op, " ", data.right());
            if(surround) { out.add(")"); }
        });
        this.traverser.register(
            AstNode.Type.TERNARY_OP, (ctx, node, out, s) -> {
                AstNode.TernaryOp data = node.getValue();
                Operators.checkTernary(node, data.operator());
                boolean surround = Operators.needsParentheses(ctx);
                if(surround) { out.add("("); }
                out.add(
                    data.middle(), " ? ", data.left(), " : ", data.right()
                );
                if(surround) { out.add(")"); }
            }
        );
    }

}
