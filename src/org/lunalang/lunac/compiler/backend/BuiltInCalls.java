
package org.lunalang.lunac.compiler.backend;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.lunalang.lunac.compiler.Error;
import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;

/**
 * Calls of built-in functions whose C code depends on the types of the
 * arguments at the call site. Each such call gets its own helper function.
 */
public class BuiltInCalls {

    private BuiltInCalls() {}

    @FunctionalInterface
    public static interface Specializer {
        void generate(GeneratorContext context, AstNode call, Sink out)
            throws ErrorException;
    }

    public static Map<String, Specializer> specializers() {
        Map<String, Specializer> specializers = new HashMap<>();
        specializers.put("print", BuiltInCalls::generatePrint);
        return specializers;
    }


    private static ErrorException unsupportedArgument(
        AstNode call, AstNode argument, String builtInName
    ) {
        return new ErrorException(new Error(
            "Only string and number literals are supported in '"
                + builtInName + "'",
            Error.Marking.error(argument.source, "this is not a literal"),
            Error.Marking.info(call.source, "in this call")
        ));
    }


    private static void emitHeading(
        GeneratorContext context, String name, List<AstNode> arguments,
        Sink out
    ) throws ErrorException {
        out.add("static void ", name, "(");
        for(int argI = 0; argI < arguments.size(); argI += 1) {
            AstNode argument = arguments.get(argI);
            if(argI > 0) {
                out.add(", ");
            }
            if(argument.type == AstNode.Type.STRING) {
                out.add("const ", BuiltIns.STRING, "* a", argI + 1);
            } else {
                String typeName = NumericLiterals.canonicalType(argument);
                CType type = context.getCType(argument, typeName);
                out.add("const ", type.spelling(), " a", argI + 1);
            }
        }
        if(arguments.isEmpty()) {
            out.add("void");
        }
        out.add(")");
    }


    private static void generatePrint(
        GeneratorContext context, AstNode call, Sink out
    ) throws ErrorException {
        AstNode.Call data = call.getValue();
        List<AstNode> arguments = data.arguments();
        String name = context.uniqueName("__luna_print_", call);
        for(AstNode argument: arguments) {
            if(argument.type != AstNode.Type.STRING
                    && argument.type != AstNode.Type.NUMBER) {
                throw BuiltInCalls.unsupportedArgument(call, argument, "print");
            }
        }
        if(!context.declareGlobal(name, call)) {
            out.add(name, "(", arguments, ")");
            return;
        }
        context.addBuiltIn(call, BuiltIns.STRING);
        context.addInclude("<stdio.h>");
        Sink declarations = context.declarations();
        declarations.addIndent();
        BuiltInCalls.emitHeading(context, name, arguments, declarations);
        declarations.addLn(";");
        Sink definitions = context.definitions();
        definitions.addIndent();
        BuiltInCalls.emitHeading(context, name, arguments, definitions);
        definitions.addLn(" {");
        definitions.incIndent();
        for(int argI = 0; argI < arguments.size(); argI += 1) {
            AstNode argument = arguments.get(argI);
            int argN = argI + 1;
            if(argI > 0) {
                definitions.addIndentLn("fwrite(\"\\t\", 1, 1, stdout);");
            }
            if(argument.type == AstNode.Type.STRING) {
                definitions.addIndentLn(
                    "fwrite(a", argN, "->data, a", argN, "->len, 1, stdout);"
                );
            } else {
                String typeName = NumericLiterals.canonicalType(argument);
                String format = NumericLiterals.PRINTF_FORMATS.get(typeName);
                if(format == null) {
                    throw call.error(
                        "Type '" + typeName + "' has no print format"
                    );
                }
                definitions.addIndentLn(
                    "fprintf(stdout, \"", format, "\", a", argN, ");"
                );
            }
        }
        definitions.addIndentLn("fwrite(\"\\n\", 1, 1, stdout);");
        definitions.addIndentLn("fflush(stdout);");
        definitions.decIndent();
        definitions.addIndentLn("}");
        // string literals render as pointers to the string record already
        out.add(name, "(", arguments, ")");
    }

}
