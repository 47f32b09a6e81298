
package org.lunalang.lunac.compiler.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;
import org.lunalang.lunac.compiler.frontend.Nodes;

class TraverserTest {

    private Traverser traverser;
    private GeneratorContext context;
    private Nodes n;

    @BeforeEach
    void setUp() {
        this.traverser = new Traverser();
        this.context = new GeneratorContext(
            this.traverser, PrimitiveTypes.C_TYPES, BuiltIns.materializers(),
            CCodeGen.DEFAULT_INDENT
        );
        this.n = new Nodes();
    }

    @Test
    void registrationReturnsThePreviousHandler() {
        Traverser.Handler first = (ctx, node, out, s) -> out.add("1");
        Traverser.Handler second = (ctx, node, out, s) -> out.add("2");
        assertFalse(this.traverser.isRegistered(AstNode.Type.ID));
        assertEquals(
            Optional.empty(), this.traverser.register(AstNode.Type.ID, first)
        );
        assertTrue(this.traverser.isRegistered(AstNode.Type.ID));
        assertEquals(
            Optional.of(first),
            this.traverser.register(AstNode.Type.ID, second)
        );
    }

    @Test
    void theLatestHandlerWins() throws ErrorException {
        this.traverser.register(AstNode.Type.ID, (ctx, node, out, s) -> {
            out.add("old");
        });
        this.traverser.register(AstNode.Type.ID, (ctx, node, out, s) -> {
            out.add("new");
        });
        Sink out = this.context.newSink();
        this.context.traverse(this.n.id("x"), out);
        assertEquals("new", out.generate());
    }

    @Test
    void missingHandlersNameTheNodeType() {
        AstNode node = this.n.nil();
        ErrorException e = assertThrows(
            ErrorException.class,
            () -> this.context.traverse(node, this.context.main())
        );
        assertEquals(
            "Generation of nodes of type 'NIL' is not supported",
            e.error.message()
        );
        assertEquals(node.source, e.error.markings()[0].location());
    }

    @Test
    void handlersSeeTheirParentAndScope() throws ErrorException {
        List<Optional<AstNode>> parents = new ArrayList<>();
        List<Boolean> scoped = new ArrayList<>();
        this.traverser.register(AstNode.Type.PAREN, (ctx, node, out, s) -> {
            AstNode.Paren data = node.getValue();
            ctx.pushScope();
            out.add("(", data.value(), ")");
            ctx.popScope();
        });
        this.traverser.register(AstNode.Type.ID, (ctx, node, out, s) -> {
            parents.add(ctx.parentNode());
            scoped.add(s.isPresent());
            AstNode.Name data = node.getValue();
            out.add(data.name());
        });
        AstNode inner = this.n.id("a");
        AstNode paren = this.n.paren(inner);
        Sink out = this.context.newSink();
        this.context.traverse(paren, out);
        this.context.traverse(this.n.id("b"), out);
        assertEquals("(a)b", out.generate());
        assertEquals(List.of(Optional.of(paren), Optional.empty()), parents);
        assertEquals(List.of(true, false), scoped);
    }

    @Test
    void failedHandlersLeaveNoNodeBehind() throws ErrorException {
        this.traverser.register(AstNode.Type.PAREN, (ctx, node, out, s) -> {
            throw node.error("broken");
        });
        List<Optional<AstNode>> parents = new ArrayList<>();
        this.traverser.register(AstNode.Type.ID, (ctx, node, out, s) -> {
            parents.add(ctx.parentNode());
        });
        AstNode paren = this.n.paren(this.n.id("a"));
        assertThrows(
            ErrorException.class,
            () -> this.context.traverse(paren, this.context.main())
        );
        this.context.traverse(this.n.id("b"), this.context.main());
        assertEquals(List.of(Optional.empty()), parents);
    }

}
