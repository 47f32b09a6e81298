
package org.lunalang.lunac.compiler.backend;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;

public class Traverser {

    @FunctionalInterface
    public static interface Handler {
        void generate(
            GeneratorContext context, AstNode node, Sink out,
            Optional<GeneratorContext.Scope> scope
        ) throws ErrorException;
    }

    private final Map<AstNode.Type, Handler> handlers;

    public Traverser() {
        this.handlers = new EnumMap<>(AstNode.Type.class);
    }


    public Optional<Handler> register(AstNode.Type type, Handler handler) {
        return Optional.ofNullable(this.handlers.put(type, handler));
    }


    public boolean isRegistered(AstNode.Type type) {
        return this.handlers.containsKey(type);
    }


    public void traverse(GeneratorContext context, AstNode node, Sink out)
            throws ErrorException {
        Handler handler = this.handlers.get(node.type);
        if(handler == null) {
            throw node.error(
                "Generation of nodes of type '" + node.type
                    + "' is not supported"
            );
        }
        context.enterNode(node);
        try {
            handler.generate(context, node, out, context.scope());
        } finally {
            context.exitNode();
        }
    }

}
