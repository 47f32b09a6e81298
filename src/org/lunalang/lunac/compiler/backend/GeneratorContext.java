
package org.lunalang.lunac.compiler.backend;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.lunalang.lunac.compiler.Error;
import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;

/**
 * All state of a single generation run. Contexts are never shared between
 * runs, so independent runs may happen concurrently.
 */
public class GeneratorContext {

    public static class Scope {

        private final boolean isTop;
        private final boolean isMain;
        private boolean hasReturn;

        private Scope(boolean isTop, boolean isMain) {
            this.isTop = isTop;
            this.isMain = isMain;
            this.hasReturn = false;
        }

        public boolean isTop() {
            return this.isTop;
        }

        public boolean isMain() {
            return this.isMain;
        }

        public boolean hasReturn() {
            return this.hasReturn;
        }

        public void markReturn() {
            this.hasReturn = true;
        }

    }


    private final Traverser traverser;
    private final Map<String, CType> primitiveTypes;
    private final Map<String, BuiltIns.Materializer> materializers;
    private final String indent;

    private final Set<String> includes;
    private final Set<String> builtIns;
    private final Map<String, AstNode> globals;
    private final Map<String, Integer> fileIndices;
    private final List<Scope> scopeStack;
    private final List<AstNode> nodeStack;
    private int functionDepth;
    private int scopeCount;

    private final Sink includesSink;
    private final Sink builtInDeclarations;
    private final Sink builtInDefinitions;
    private final Sink declarations;
    private final Sink definitions;
    private final Sink mainSink;

    public GeneratorContext(
        Traverser traverser, Map<String, CType> primitiveTypes,
        Map<String, BuiltIns.Materializer> materializers, String indent
    ) {
        this.traverser = traverser;
        this.primitiveTypes = primitiveTypes;
        this.materializers = materializers;
        this.indent = indent;
        this.includes = new HashSet<>();
        this.builtIns = new HashSet<>();
        this.globals = new HashMap<>();
        this.fileIndices = new HashMap<>();
        this.scopeStack = new LinkedList<>();
        this.nodeStack = new LinkedList<>();
        this.functionDepth = 0;
        this.scopeCount = 0;
        this.includesSink = this.newSink();
        this.builtInDeclarations = this.newSink();
        this.builtInDefinitions = this.newSink();
        this.declarations = this.newSink();
        this.definitions = this.newSink();
        this.mainSink = this.newSink();
    }


    public Sink newSink() {
        return new Sink(this, this.indent);
    }


    public void traverse(AstNode node, Sink out) throws ErrorException {
        this.traverser.traverse(this, node, out);
    }


    void enterNode(AstNode node) {
        this.nodeStack.add(node);
    }


    void exitNode() {
        this.nodeStack.remove(this.nodeStack.size() - 1);
    }


    /**
     * Returns the node whose handler caused the currently handled node to
     * be rendered.
     */
    public Optional<AstNode> parentNode() {
        if(this.nodeStack.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(this.nodeStack.get(this.nodeStack.size() - 2));
    }


    public void addInclude(String name) throws ErrorException {
        if(!this.includes.add(name)) { return; }
        this.includesSink.addLn("#include ", name);
    }


    public void addBuiltIn(AstNode requester, String name)
            throws ErrorException {
        BuiltIns.Materializer materializer = this.materializers.get(name);
        if(materializer == null) {
            throw requester.error("Built-in '" + name + "' does not exist");
        }
        if(!this.builtIns.add(name)) { return; }
        materializer.materialize(this);
    }


    /**
     * Builds a global name that is unique to the position of the given node.
     * Files are numbered in the order they are first seen in this run.
     */
    public String uniqueName(String prefix, AstNode node) {
        String file = node.source.file();
        Integer fileIndex = this.fileIndices.get(file);
        if(fileIndex == null) {
            fileIndex = this.fileIndices.size();
            this.fileIndices.put(file, fileIndex);
        }
        return prefix + fileIndex + "_" + node.source.startOffset();
    }


    /**
     * Records that a generated global with the given name was declared for
     * the given node. Returns false if that node already declared it.
     */
    public boolean declareGlobal(String name, AstNode owner)
            throws ErrorException {
        AstNode previous = this.globals.putIfAbsent(name, owner);
        if(previous == null) {
            return true;
        }
        if(previous != owner) {
            throw new ErrorException(new Error(
                "Generated name '" + name + "' is already taken",
                Error.Marking.error(owner.source, "this needs the name"),
                Error.Marking.info(previous.source, "but it was given here")
            ));
        }
        return false;
    }


    public CType getCType(AstNode node, String typeName)
            throws ErrorException {
        CType type = this.primitiveTypes.get(typeName);
        if(type == null) {
            throw node.error("Type '" + typeName + "' is not known");
        }
        if(type.include().isPresent()) {
            this.addInclude(type.include().get());
        }
        return type;
    }


    public Scope pushScope() {
        boolean isFirst = this.scopeCount == 0;
        Scope scope = new Scope(isFirst, isFirst);
        this.scopeStack.add(scope);
        this.scopeCount += 1;
        return scope;
    }


    public Scope popScope() {
        if(this.scopeStack.isEmpty()) {
            throw new IllegalStateException("No scope left to exit!");
        }
        return this.scopeStack.remove(this.scopeStack.size() - 1);
    }


    public Optional<Scope> scope() {
        if(this.scopeStack.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(this.scopeStack.get(this.scopeStack.size() - 1));
    }


    public boolean isTop() {
        return this.scope().map(Scope::isTop).orElse(false);
    }


    public boolean isMain() {
        return this.scope().map(Scope::isMain).orElse(false);
    }


    public void enterFunction() {
        this.functionDepth += 1;
    }


    public void exitFunction() {
        this.functionDepth -= 1;
    }


    public boolean isInMainFunction() {
        return this.functionDepth == 0 && !this.scopeStack.isEmpty();
    }


    public Sink includes() {
        return this.includesSink;
    }


    public Sink builtInDeclarations() {
        return this.builtInDeclarations;
    }


    public Sink builtInDefinitions() {
        return this.builtInDefinitions;
    }


    public Sink declarations() {
        return this.declarations;
    }


    public Sink definitions() {
        return this.definitions;
    }


    public Sink main() {
        return this.mainSink;
    }


    public String assemble() {
        StringBuilder out = new StringBuilder();
        out.append(this.includesSink.generate());
        out.append(this.builtInDeclarations.generate());
        out.append(this.builtInDefinitions.generate());
        out.append(this.declarations.generate());
        out.append(this.definitions.generate());
        out.append(this.mainSink.generate());
        return out.toString();
    }

}
