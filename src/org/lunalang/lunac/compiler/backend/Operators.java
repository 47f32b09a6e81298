
package org.lunalang.lunac.compiler.backend;

import java.util.Map;

import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;

public class Operators {

    private Operators() {}

    // 'len' and 'tostring' have no C counterpart yet
    public static final Map<String, String> UNARY = Map.of(
        "not",   "!",
        "neg",   "-",
        "bnot",  "~",
        "ref",   "&",
        "deref", "*"
    );

    // 'idiv', 'pow' and 'concat' have no C counterpart yet
    public static final Map<String, String> BINARY = Map.ofEntries(
        Map.entry("or",   "||"),
        Map.entry("and",  "&&"),
        Map.entry("ne",   "!="),
        Map.entry("eq",   "=="),
        Map.entry("le",   "<="),
        Map.entry("ge",   ">="),
        Map.entry("lt",   "<"),
        Map.entry("gt",   ">"),
        Map.entry("bor",  "|"),
        Map.entry("bxor", "^"),
        Map.entry("band", "&"),
        Map.entry("shl",  "<<"),
        Map.entry("shr",  ">>"),
        Map.entry("add",  "+"),
        Map.entry("sub",  "-"),
        Map.entry("mul",  "*"),
        Map.entry("div",  "/"),
        Map.entry("mod",  "%")
    );

    public static final String TERNARY_IF = "if";


    public static String unary(AstNode node, String name)
            throws ErrorException {
        String op = UNARY.get(name);
        if(op == null) {
            throw node.error("Unary operator '" + name + "' not found");
        }
        return op;
    }


    public static String binary(AstNode node, String name)
            throws ErrorException {
        String op = BINARY.get(name);
        if(op == null) {
            throw node.error("Binary operator '" + name + "' not found");
        }
        return op;
    }


    public static void checkTernary(AstNode node, String name)
            throws ErrorException {
        node.check(
            TERNARY_IF.equals(name),
            "Ternary operator '" + name + "' not found"
        );
    }


    /**
     * Operator expressions directly inside other operator expressions are
     * parenthesized, all others are not.
     */
    public static boolean needsParentheses(GeneratorContext context) {
        return context.parentNode()
            .map(AstNode::isOperator)
            .orElse(false);
    }

}
