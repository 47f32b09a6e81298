
package org.lunalang.lunac.compiler.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.function.Function;

import org.junit.jupiter.api.Test;
import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;
import org.lunalang.lunac.compiler.frontend.Nodes;

class OperatorsTest {

    private static final String ASSIGNED = "    x = ";

    private static String lower(Function<Nodes, AstNode> expression)
            throws ErrorException {
        Nodes n = new Nodes();
        AstNode value = expression.apply(n);
        AstNode variable = n.typedId("x");
        String output = new CCodeGen().generate(
            n.block(n.local(variable, value))
        );
        for(String line: output.split("\n")) {
            if(line.startsWith(ASSIGNED)) {
                return line.substring(ASSIGNED.length(), line.length() - 1);
            }
        }
        throw new AssertionError("no assignment was generated");
    }

    @Test
    void topLevelOperatorsAreBare() throws ErrorException {
        assertEquals("a + b", lower(n -> n.binary("add", n.id("a"), n.id("b"))));
        assertEquals("!done", lower(n -> n.unary("not", n.id("done"))));
        assertEquals("c ? 1 : 2", lower(
            n -> n.ternary(n.integer("1"), n.id("c"), n.integer("2"))
        ));
    }

    @Test
    void nestedOperatorsAreParenthesized() throws ErrorException {
        assertEquals("1 + (2 * 3)", lower(n -> n.binary(
            "add", n.integer("1"),
            n.binary("mul", n.integer("2"), n.integer("3"))
        )));
        assertEquals("-(1 + 2)", lower(n -> n.unary(
            "neg", n.binary("add", n.integer("1"), n.integer("2"))
        )));
        assertEquals("(c ? 1 : 2) + 3", lower(n -> n.binary(
            "add",
            n.ternary(n.integer("1"), n.id("c"), n.integer("2")),
            n.integer("3")
        )));
        assertEquals("(a < b) && (!c)", lower(n -> n.binary(
            "and",
            n.binary("lt", n.id("a"), n.id("b")),
            n.unary("not", n.id("c"))
        )));
    }

    @Test
    void otherParentsDoNotParenthesize() throws ErrorException {
        assertEquals("(1 + 2)", lower(n -> n.paren(
            n.binary("add", n.integer("1"), n.integer("2"))
        )));
        assertEquals("f(a + b)", lower(n -> n.callExpr(
            "f", n.binary("add", n.id("a"), n.id("b"))
        )));
        assertEquals("v[i + 1]", lower(n -> n.arrayIndex(
            n.id("v"), n.binary("add", n.id("i"), n.integer("1"))
        )));
    }

    @Test
    void everyBinaryOperatorIsMapped() throws ErrorException {
        for(String name: Operators.BINARY.keySet()) {
            String expected = "a " + Operators.BINARY.get(name) + " b";
            assertEquals(expected, lower(
                n -> n.binary(name, n.id("a"), n.id("b"))
            ));
        }
    }

    @Test
    void unsupportedOperatorsAreReported() {
        ErrorException binary = assertThrows(ErrorException.class, () -> lower(
            n -> n.binary("pow", n.integer("2"), n.integer("3"))
        ));
        assertEquals("Binary operator 'pow' not found", binary.error.message());
        ErrorException unary = assertThrows(ErrorException.class, () -> lower(
            n -> n.unary("len", n.id("t"))
        ));
        assertEquals("Unary operator 'len' not found", unary.error.message());
        ErrorException ternary = assertThrows(ErrorException.class, () -> lower(
            n -> n.ternary("unless", n.id("a"), n.id("c"), n.id("b"))
        ));
        assertEquals(
            "Ternary operator 'unless' not found", ternary.error.message()
        );
    }

}
