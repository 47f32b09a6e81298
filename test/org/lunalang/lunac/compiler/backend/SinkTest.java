
package org.lunalang.lunac.compiler.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;
import org.lunalang.lunac.compiler.frontend.Nodes;

class SinkTest {

    private Sink sink;
    private Nodes n;

    @BeforeEach
    void setUp() {
        Traverser traverser = new Traverser();
        traverser.register(AstNode.Type.ID, (ctx, node, out, s) -> {
            AstNode.Name data = node.getValue();
            out.add(data.name());
        });
        GeneratorContext context = new GeneratorContext(
            traverser, PrimitiveTypes.C_TYPES, BuiltIns.materializers(), "  "
        );
        this.sink = context.newSink();
        this.n = new Nodes();
    }

    @Test
    void textAndNumbersAreAppended() throws ErrorException {
        this.sink.add("a", 1, "b").addLn(2.5).add("c");
        assertEquals("a1b2.5\nc", this.sink.generate());
    }

    @Test
    void nodesAreRenderedInPlace() throws ErrorException {
        this.sink.add("f(", this.n.id("x"), ")");
        assertEquals("f(x)", this.sink.generate());
    }

    @Test
    void listsAreSeparated() throws ErrorException {
        this.sink.add(List.of(this.n.id("a"), this.n.id("b"), "c"));
        this.sink.add(" ");
        this.sink.addTraversalList(
            List.of(this.n.id("d"), this.n.id("e")), "; "
        );
        assertEquals("a, b, c d; e", this.sink.generate());
    }

    @Test
    void indentationFollowsTheDepth() throws ErrorException {
        this.sink.addIndentLn("{");
        this.sink.incIndent();
        this.sink.incIndent();
        this.sink.addIndentLn("x;");
        this.sink.decIndent();
        this.sink.addIndent("y").addLn(";");
        this.sink.decIndent();
        this.sink.addIndentLn("}");
        assertEquals("{\n    x;\n  y;\n}\n", this.sink.generate());
        assertEquals(0, this.sink.depth());
    }

    @Test
    void indentationCannotGoNegative() {
        assertThrows(IllegalStateException.class, this.sink::decIndent);
    }

    @Test
    void otherObjectsAreRejected() {
        assertThrows(
            IllegalArgumentException.class,
            () -> this.sink.add((Object) null)
        );
        assertThrows(
            IllegalArgumentException.class,
            () -> this.sink.add(new StringBuilder("x"))
        );
    }

    @Test
    void unhandledNodesFail() {
        assertThrows(ErrorException.class, () -> this.sink.add(this.n.nil()));
    }

    @Test
    void quotedTextIsEscapedPerByte() {
        this.sink.addDoubleQuoted("tab\there\r\"q\"\\ ??= \u0001\u007fü");
        assertEquals(
            "\"tab\\there\\r\\\"q\\\"\\\\ \\077\\077= \\001\\177\\303\\274\"",
            this.sink.generate()
        );
    }

}
