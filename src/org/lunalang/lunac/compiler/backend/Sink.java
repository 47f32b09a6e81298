
package org.lunalang.lunac.compiler.backend;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;

/**
 * An ordered text accumulator with its own indentation depth.
 * Nodes added to a sink are rendered in place by dispatching them
 * through the traverser of the owning context.
 */
public class Sink {

    private final GeneratorContext context;
    private final String indent;
    private final StringBuilder out;
    private int depth;

    public Sink(GeneratorContext context, String indent) {
        this.context = context;
        this.indent = indent;
        this.out = new StringBuilder();
        this.depth = 0;
    }


    public Sink add(Object... parts) throws ErrorException {
        for(Object part: parts) {
            this.addPart(part);
        }
        return this;
    }


    private void addPart(Object part) throws ErrorException {
        if(part instanceof AstNode) {
            this.context.traverse((AstNode) part, this);
        } else if(part instanceof List) {
            this.addTraversalList((List<?>) part, ", ");
        } else if(part instanceof String || part instanceof Number) {
            this.out.append(part);
        } else {
            throw new IllegalArgumentException(
                "Sinks only accept text, numbers and nodes, got "
                    + (part == null? "null" : part.getClass().getName())
            );
        }
    }


    public Sink addLn(Object... parts) throws ErrorException {
        this.add(parts);
        this.out.append("\n");
        return this;
    }


    public Sink addIndent(Object... parts) throws ErrorException {
        this.out.append(this.indent.repeat(this.depth));
        return this.add(parts);
    }


    public Sink addIndentLn(Object... parts) throws ErrorException {
        this.addIndent(parts);
        this.out.append("\n");
        return this;
    }


    public Sink addTraversalList(List<?> parts, String separator)
            throws ErrorException {
        for(int partI = 0; partI < parts.size(); partI += 1) {
            if(partI > 0) {
                this.out.append(separator);
            }
            this.addPart(parts.get(partI));
        }
        return this;
    }


    public Sink addDoubleQuoted(String content) {
        this.out.append("\"");
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        for(byte b: bytes) {
            int c = b & 0xFF;
            switch(c) {
                case '\\': this.out.append("\\\\"); break;
                case '\n': this.out.append("\\n"); break;
                case '\r': this.out.append("\\r"); break;
                case '\t': this.out.append("\\t"); break;
                case '\"': this.out.append("\\\""); break;
                default:
                    if(c < 0x20 || c >= 0x7F || c == '?') {
                        // '?' could form a trigraph
                        this.out.append(String.format("\\%03o", c));
                    } else {
                        this.out.append((char) c);
                    }
            }
        }
        this.out.append("\"");
        return this;
    }


    public void incIndent() {
        this.depth += 1;
    }


    public void decIndent() {
        if(this.depth == 0) {
            throw new IllegalStateException("Sink indentation is already 0!");
        }
        this.depth -= 1;
    }


    public int depth() {
        return this.depth;
    }


    public String generate() {
        return this.out.toString();
    }

}
